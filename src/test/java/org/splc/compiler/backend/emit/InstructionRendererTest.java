package org.splc.compiler.backend.emit;

import org.splc.compiler.api.SourceInfo;
import org.splc.compiler.diagnostics.InternalConsistencyException;
import org.splc.compiler.ir.ArithmeticOp;
import org.splc.compiler.ir.IrAddress;
import org.splc.compiler.ir.IrAssign;
import org.splc.compiler.ir.IrBinary;
import org.splc.compiler.ir.IrCall;
import org.splc.compiler.ir.IrCondition;
import org.splc.compiler.ir.IrGoto;
import org.splc.compiler.ir.IrHalt;
import org.splc.compiler.ir.IrIfGoto;
import org.splc.compiler.ir.IrLabelDef;
import org.splc.compiler.ir.IrLabelRef;
import org.splc.compiler.ir.IrNeg;
import org.splc.compiler.ir.IrNum;
import org.splc.compiler.ir.IrPrint;
import org.splc.compiler.ir.IrString;
import org.splc.compiler.ir.IrVar;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class InstructionRendererTest {

    private static final SourceInfo SRC = SourceInfo.unknown();

    private final InstructionRenderer renderer = new InstructionRenderer();

    @Test
    void rendersAssignmentsWithFullyParenthesizedExpressions() {
        IrAssign assign = new IrAssign("x",
                new IrBinary(new IrNeg(new IrVar("y")), ArithmeticOp.SUB,
                        new IrBinary(new IrNum(4), ArithmeticOp.DIV, new IrVar("z"))), SRC);

        assertThat(renderer.render(assign)).isEqualTo("x = (-(y) - (4 / z))");
    }

    @Test
    void rendersPrintHaltAndLabels() {
        assertThat(renderer.render(new IrPrint(new IrString("hello world"), SRC))).isEqualTo("PRINT \"hello world\"");
        assertThat(renderer.render(new IrPrint(new IrNum(7), SRC))).isEqualTo("PRINT 7");
        assertThat(renderer.render(new IrHalt(SRC))).isEqualTo("STOP");
        assertThat(renderer.render(new IrLabelDef("T1", SRC))).isEqualTo("REM T1");
    }

    @Test
    void rendersJumpsWithAddressOrSymbolicTarget() {
        IrCondition cond = new IrCondition(new IrBinary(new IrVar("a"), ArithmeticOp.MUL, new IrNum(2)), IrCondition.Comparison.GT, new IrVar("b"));

        assertThat(renderer.render(new IrIfGoto(cond, new IrAddress(70), SRC))).isEqualTo("IF (a * 2) > b THEN 70");
        assertThat(renderer.render(new IrGoto(new IrAddress(10), SRC))).isEqualTo("GOTO 10");
        assertThat(renderer.render(new IrGoto(new IrLabelRef("X9"), SRC))).isEqualTo("GOTO X9");
    }

    @Test
    void callsCannotBeRendered() {
        assertThatThrownBy(() -> renderer.render(new IrCall("p", List.of(), SRC)))
                .isInstanceOf(InternalConsistencyException.class);
    }
}
