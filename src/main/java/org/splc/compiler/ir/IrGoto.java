package org.splc.compiler.ir;

import org.splc.compiler.api.SourceInfo;

public record IrGoto(IrJumpTarget target, SourceInfo source) implements IrItem {

    public IrGoto withTarget(IrJumpTarget newTarget) {
        return new IrGoto(newTarget, source);
    }
}
