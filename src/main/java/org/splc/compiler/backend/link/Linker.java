package org.splc.compiler.backend.link;

import org.splc.compiler.api.CompilerErrorCode;
import org.splc.compiler.backend.layout.LayoutResult;
import org.splc.compiler.backend.layout.PlacedItem;
import org.splc.compiler.diagnostics.DiagnosticsEngine;
import org.splc.compiler.ir.IrItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Linking pass: resolves symbolic jump targets using the layout result.
 * <p>
 * In strict mode every unresolved target is reported as {@link CompilerErrorCode#LABEL_NOT_FOUND}.
 * Otherwise the symbolic name is kept in the output and a warning is logged and reported.
 */
public final class Linker {

    private static final Logger LOG = LoggerFactory.getLogger(Linker.class);

    private final LinkingRegistry registry;
    private final DiagnosticsEngine diagnostics;
    private final boolean strictLabels;

    /**
     * Constructs a new linker.
     * @param registry The registry of linking rules to apply.
     * @param diagnostics The diagnostics engine for reporting unresolved targets.
     * @param strictLabels Whether an unresolved target is an error.
     */
    public Linker(LinkingRegistry registry, DiagnosticsEngine diagnostics, boolean strictLabels) {
        this.registry = registry;
        this.diagnostics = diagnostics;
        this.strictLabels = strictLabels;
    }

    /**
     * Links the given layout.
     * @param layout The layout result to link.
     * @return A layout result with the same addresses and resolved jump targets.
     */
    public LayoutResult link(LayoutResult layout) {
        LinkingContext context = new LinkingContext();
        List<PlacedItem> out = new ArrayList<>();

        for (PlacedItem placed : layout.placed()) {
            context.moveTo(placed.address());
            IrItem item = placed.item();
            for (ILinkingRule rule : registry.rules()) {
                item = rule.apply(item, context, layout);
            }
            out.add(new PlacedItem(placed.address(), item));
        }

        for (LinkingContext.UnresolvedReference ref : context.unresolved()) {
            String message = "Jump target '" + ref.labelName() + "' at address " + ref.address() + " is not defined";
            if (strictLabels) {
                diagnostics.reportError(CompilerErrorCode.LABEL_NOT_FOUND, message, ref.source().lineNumber());
            } else {
                LOG.warn("{}; keeping the symbolic name", message);
                diagnostics.reportWarning(CompilerErrorCode.LABEL_NOT_FOUND, message, ref.source().lineNumber());
            }
        }

        LOG.debug("Linked {} jump targets, {} unresolved", context.resolvedCount(), context.unresolved().size());
        return layout.withPlaced(out);
    }
}
