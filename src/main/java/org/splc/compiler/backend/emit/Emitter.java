package org.splc.compiler.backend.emit;

import org.splc.compiler.api.NumberedLine;
import org.splc.compiler.api.ProgramArtifact;
import org.splc.compiler.backend.layout.LayoutResult;
import org.splc.compiler.backend.layout.PlacedItem;
import org.splc.compiler.ir.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Final phase: renders the linked layout into numbered lines and packages the artifact.
 */
public class Emitter {

    private static final Logger LOG = LoggerFactory.getLogger(Emitter.class);

    private final InstructionRenderer renderer = new InstructionRenderer();

    /**
     * Emits the final program artifact.
     *
     * @param linked       The linked layout.
     * @param intermediate The program as generated, before inlining.
     * @param callFree     The program after inlining.
     * @return The program artifact.
     */
    public ProgramArtifact emit(LayoutResult linked, IrProgram intermediate, IrProgram callFree) {
        List<NumberedLine> lines = new ArrayList<>(linked.placed().size());
        for (PlacedItem placed : linked.placed()) {
            lines.add(new NumberedLine(placed.address(), renderer.render(placed.item())));
        }
        LOG.debug("Emitted {} lines for {}", lines.size(), callFree.programName());
        return new ProgramArtifact(callFree.programName(), lines, linked.labelToAddress(), intermediate, callFree);
    }
}
