package org.splc.compiler.backend.link;

import org.splc.compiler.backend.layout.LayoutResult;
import org.splc.compiler.ir.IrItem;

/**
 * Linking rule that can transform an instruction (e.g., resolve label refs).
 */
public interface ILinkingRule {

    /**
     * Applies linking on a single instruction, returning a potentially rewritten instruction.
     *
     * @param item    The original instruction.
     * @param context Linking context with the current address and unresolved references.
     * @param layout  The layout result providing the label table.
     * @return The (potentially) rewritten instruction.
     */
    IrItem apply(IrItem item, LinkingContext context, LayoutResult layout);
}
