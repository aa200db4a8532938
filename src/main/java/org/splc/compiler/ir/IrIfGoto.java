package org.splc.compiler.ir;

import org.splc.compiler.api.SourceInfo;

/**
 * Conditional jump: continues at {@code target} if the comparison holds, else falls through.
 */
public record IrIfGoto(IrCondition condition, IrJumpTarget target, SourceInfo source) implements IrItem {

    public IrIfGoto withTarget(IrJumpTarget newTarget) {
        return new IrIfGoto(condition, newTarget, source);
    }
}
