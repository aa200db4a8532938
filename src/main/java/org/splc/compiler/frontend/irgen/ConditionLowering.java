package org.splc.compiler.frontend.irgen;

import org.splc.compiler.api.SourceInfo;
import org.splc.compiler.diagnostics.InternalConsistencyException;
import org.splc.compiler.frontend.ast.BinaryOperator;
import org.splc.compiler.frontend.ast.BinaryTerm;
import org.splc.compiler.frontend.ast.TermNode;
import org.splc.compiler.frontend.ast.UnaryOperator;
import org.splc.compiler.frontend.ast.UnaryTerm;
import org.splc.compiler.ir.IrCondition;
import org.splc.compiler.ir.IrIfGoto;
import org.splc.compiler.ir.IrLabelRef;

/**
 * Lowers boolean conditions into conditional and unconditional jumps without ever
 * materializing a boolean value.
 * <p>
 * {@link #jumpIfTrue} continues at the label when the condition holds and falls through
 * otherwise; {@link #jumpIfFalse} is its dual. Both evaluate {@code and}/{@code or} left to
 * right and skip the right operand as soon as the left one decides the result.
 */
public final class ConditionLowering {

	private final IrGenContext ctx;

	ConditionLowering(IrGenContext ctx) {
		this.ctx = ctx;
	}

	/**
	 * Emits code that jumps to {@code label} if {@code condition} holds and falls through otherwise.
	 */
	public void jumpIfTrue(TermNode condition, String label, SourceInfo src) {
		if (condition instanceof UnaryTerm unary && unary.operator() == UnaryOperator.NOT) {
			jumpIfFalse(unary.operand(), label, src);
			return;
		}
		BinaryTerm binary = requireBoolean(condition);
		switch (binary.operator()) {
			case EQ:
			case GT:
				ctx.emit(new IrIfGoto(comparison(binary), new IrLabelRef(label), src));
				break;
			case AND: {
				// the right operand is only reached through M
				String middle = ctx.freshLabel("M");
				String skip = ctx.freshLabel("S");
				jumpIfTrue(binary.left(), middle, src);
				ctx.emitGoto(skip, src);
				ctx.emitLabel(middle, src);
				jumpIfTrue(binary.right(), label, src);
				ctx.emitLabel(skip, src);
				break;
			}
			case OR:
				jumpIfTrue(binary.left(), label, src);
				jumpIfTrue(binary.right(), label, src);
				break;
			default:
				throw notBoolean(condition);
		}
	}

	/**
	 * Emits code that jumps to {@code label} if {@code condition} does not hold and falls through otherwise.
	 */
	public void jumpIfFalse(TermNode condition, String label, SourceInfo src) {
		if (condition instanceof UnaryTerm unary && unary.operator() == UnaryOperator.NOT) {
			jumpIfTrue(unary.operand(), label, src);
			return;
		}
		BinaryTerm binary = requireBoolean(condition);
		switch (binary.operator()) {
			case EQ:
			case GT: {
				String skip = ctx.freshLabel("S");
				ctx.emit(new IrIfGoto(comparison(binary), new IrLabelRef(skip), src));
				ctx.emitGoto(label, src);
				ctx.emitLabel(skip, src);
				break;
			}
			case AND:
				jumpIfFalse(binary.left(), label, src);
				jumpIfFalse(binary.right(), label, src);
				break;
			case OR: {
				String done = ctx.freshLabel("S");
				jumpIfTrue(binary.left(), done, src);
				jumpIfFalse(binary.right(), label, src);
				ctx.emitLabel(done, src);
				break;
			}
			default:
				throw notBoolean(condition);
		}
	}

	private static IrCondition comparison(BinaryTerm binary) {
		IrCondition.Comparison cmp = binary.operator() == BinaryOperator.EQ
				? IrCondition.Comparison.EQ
				: IrCondition.Comparison.GT;
		return new IrCondition(TermLowering.lowerNumeric(binary.left()), cmp, TermLowering.lowerNumeric(binary.right()));
	}

	private static BinaryTerm requireBoolean(TermNode condition) {
		if (condition instanceof BinaryTerm binary && binary.operator().kind() != BinaryOperator.Kind.ARITHMETIC) {
			return binary;
		}
		throw notBoolean(condition);
	}

	private static InternalConsistencyException notBoolean(TermNode condition) {
		return new InternalConsistencyException("Numeric term used as condition at line " + condition.line());
	}
}
