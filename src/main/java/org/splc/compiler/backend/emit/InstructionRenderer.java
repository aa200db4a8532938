package org.splc.compiler.backend.emit;

import org.splc.compiler.diagnostics.InternalConsistencyException;
import org.splc.compiler.ir.IrAddress;
import org.splc.compiler.ir.IrAssign;
import org.splc.compiler.ir.IrAtom;
import org.splc.compiler.ir.IrBinary;
import org.splc.compiler.ir.IrCondition;
import org.splc.compiler.ir.IrExpr;
import org.splc.compiler.ir.IrGoto;
import org.splc.compiler.ir.IrHalt;
import org.splc.compiler.ir.IrIfGoto;
import org.splc.compiler.ir.IrItem;
import org.splc.compiler.ir.IrJumpTarget;
import org.splc.compiler.ir.IrLabelDef;
import org.splc.compiler.ir.IrLabelRef;
import org.splc.compiler.ir.IrNeg;
import org.splc.compiler.ir.IrNum;
import org.splc.compiler.ir.IrPrint;
import org.splc.compiler.ir.IrString;
import org.splc.compiler.ir.IrVar;

/**
 * Renders linked IR items to the textual instruction form of the target program.
 */
public final class InstructionRenderer {

    /**
     * @param item A call-free item.
     * @return The instruction text without its address.
     */
    public String render(IrItem item) {
        if (item instanceof IrAssign assign) {
            return assign.target() + " = " + renderExpr(assign.value());
        }
        if (item instanceof IrPrint print) {
            if (print.value() instanceof IrString string) {
                return "PRINT \"" + string.text() + "\"";
            }
            return "PRINT " + renderExpr((IrAtom) print.value());
        }
        if (item instanceof IrHalt) {
            return "STOP";
        }
        if (item instanceof IrIfGoto jump) {
            IrCondition c = jump.condition();
            return "IF " + renderExpr(c.left()) + " " + c.comparison().symbol() + " " + renderExpr(c.right())
                    + " THEN " + renderTarget(jump.target());
        }
        if (item instanceof IrGoto jump) {
            return "GOTO " + renderTarget(jump.target());
        }
        if (item instanceof IrLabelDef label) {
            return "REM " + label.name();
        }
        throw new InternalConsistencyException("Cannot render " + item);
    }

    public String renderExpr(IrExpr expr) {
        if (expr instanceof IrVar v) return v.name();
        if (expr instanceof IrNum n) return Long.toString(n.value());
        if (expr instanceof IrNeg neg) return "-(" + renderExpr(neg.operand()) + ")";
        IrBinary b = (IrBinary) expr;
        return "(" + renderExpr(b.left()) + " " + b.operator().symbol() + " " + renderExpr(b.right()) + ")";
    }

    private String renderTarget(IrJumpTarget target) {
        if (target instanceof IrAddress address) return Integer.toString(address.address());
        return ((IrLabelRef) target).labelName();
    }
}
