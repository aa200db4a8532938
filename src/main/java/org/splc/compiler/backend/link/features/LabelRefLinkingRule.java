package org.splc.compiler.backend.link.features;

import org.splc.compiler.backend.layout.LayoutResult;
import org.splc.compiler.backend.link.ILinkingRule;
import org.splc.compiler.backend.link.LinkingContext;
import org.splc.compiler.ir.IrAddress;
import org.splc.compiler.ir.IrGoto;
import org.splc.compiler.ir.IrIfGoto;
import org.splc.compiler.ir.IrItem;
import org.splc.compiler.ir.IrJumpTarget;
import org.splc.compiler.ir.IrLabelRef;

/**
 * Resolves {@link IrLabelRef} jump targets to numeric addresses using the layout's label table.
 * A label missing from the table is recorded in the context and the target is left symbolic.
 */
public class LabelRefLinkingRule implements ILinkingRule {

    @Override
    public IrItem apply(IrItem item, LinkingContext context, LayoutResult layout) {
        if (item instanceof IrGoto jump) {
            return jump.withTarget(resolve(jump.target(), item, context, layout));
        }
        if (item instanceof IrIfGoto jump) {
            return jump.withTarget(resolve(jump.target(), item, context, layout));
        }
        return item;
    }

    private IrJumpTarget resolve(IrJumpTarget target, IrItem item, LinkingContext context, LayoutResult layout) {
        if (!(target instanceof IrLabelRef ref)) {
            return target;
        }
        Integer address = layout.labelToAddress().get(ref.labelName());
        if (address == null) {
            context.recordUnresolved(ref.labelName(), item.source());
            return target;
        }
        context.recordResolved();
        return new IrAddress(address);
    }
}
