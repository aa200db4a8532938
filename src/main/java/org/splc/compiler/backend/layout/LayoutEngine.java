package org.splc.compiler.backend.layout;

import org.splc.compiler.api.SourceInfo;
import org.splc.compiler.diagnostics.InternalConsistencyException;
import org.splc.compiler.ir.IrCall;
import org.splc.compiler.ir.IrCallAssign;
import org.splc.compiler.ir.IrItem;
import org.splc.compiler.ir.IrLabelDef;
import org.splc.compiler.ir.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layout pass: assigns sequential addresses to a call-free instruction stream.
 * <p>
 * The i-th item gets {@code start + i * step}. Label markers occupy an address like every other
 * item and define the label table. The result depends only on stream order and the two
 * parameters, so laying out an already linked stream again yields the same addresses.
 */
public class LayoutEngine {

    private static final Logger LOG = LoggerFactory.getLogger(LayoutEngine.class);

    private final int start;
    private final int step;

    /**
     * @param start The first address, at least 0.
     * @param step The address increment, greater than 0.
     */
    public LayoutEngine(int start, int step) {
        if (start < 0) throw new IllegalArgumentException("start must be >= 0, got " + start);
        if (step <= 0) throw new IllegalArgumentException("step must be > 0, got " + step);
        this.start = start;
        this.step = step;
    }

    /**
     * Lays out the given program.
     * @param program The call-free IR program.
     * @return The layout result.
     */
    public LayoutResult layout(IrProgram program) {
        List<PlacedItem> placed = new ArrayList<>();
        Map<String, Integer> labelToAddress = new LinkedHashMap<>();
        Map<Integer, SourceInfo> sourceMap = new HashMap<>();

        List<IrItem> items = program.items();
        for (int i = 0; i < items.size(); i++) {
            IrItem item = items.get(i);
            int address = addressOf(i, item);
            if (item instanceof IrCall || item instanceof IrCallAssign) {
                throw new InternalConsistencyException("Call survived inlining: " + item);
            }
            if (item instanceof IrLabelDef label) {
                Integer previous = labelToAddress.putIfAbsent(label.name(), address);
                if (previous != null) {
                    throw new InternalConsistencyException(
                            "Label '" + label.name() + "' defined at " + previous + " and " + address);
                }
            }
            placed.add(new PlacedItem(address, item));
            sourceMap.put(address, item.source());
        }

        LOG.debug("Laid out {} items from address {} with step {}, {} labels", placed.size(), start, step, labelToAddress.size());
        return new LayoutResult(placed, labelToAddress, sourceMap);
    }

    private int addressOf(int index, IrItem item) {
        long address = start + (long) index * step;
        if (address > Integer.MAX_VALUE) {
            throw new InternalConsistencyException("Address " + address + " of item " + index + " (" + item.source()
                    + ") exceeds the addressable range; lower linearizer.start or linearizer.step");
        }
        return (int) address;
    }
}
