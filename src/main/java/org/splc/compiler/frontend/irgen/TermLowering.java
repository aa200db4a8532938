package org.splc.compiler.frontend.irgen;

import org.splc.compiler.diagnostics.InternalConsistencyException;
import org.splc.compiler.frontend.ast.AtomNode;
import org.splc.compiler.frontend.ast.AtomTerm;
import org.splc.compiler.frontend.ast.BinaryOperator;
import org.splc.compiler.frontend.ast.BinaryTerm;
import org.splc.compiler.frontend.ast.NumberLiteral;
import org.splc.compiler.frontend.ast.TermNode;
import org.splc.compiler.frontend.ast.UnaryOperator;
import org.splc.compiler.frontend.ast.UnaryTerm;
import org.splc.compiler.frontend.ast.VarRef;
import org.splc.compiler.ir.ArithmeticOp;
import org.splc.compiler.ir.IrAtom;
import org.splc.compiler.ir.IrBinary;
import org.splc.compiler.ir.IrExpr;
import org.splc.compiler.ir.IrNeg;
import org.splc.compiler.ir.IrNum;
import org.splc.compiler.ir.IrVar;

/**
 * Lowers numeric terms into IR expression trees. A boolean construct in a numeric position
 * means the type checker was bypassed and is reported as an internal fault.
 */
public final class TermLowering {

	private TermLowering() {}

	public static IrAtom lowerAtom(AtomNode atom) {
		if (atom instanceof VarRef ref) {
			return new IrVar(ref.name().text());
		}
		return new IrNum(((NumberLiteral) atom).value());
	}

	public static IrExpr lowerNumeric(TermNode term) {
		if (term instanceof AtomTerm atomTerm) {
			return lowerAtom(atomTerm.atom());
		}
		if (term instanceof UnaryTerm unary) {
			if (unary.operator() != UnaryOperator.NEG) {
				throw new InternalConsistencyException("Boolean operator 'not' in numeric context at line " + unary.line());
			}
			return new IrNeg(lowerNumeric(unary.operand()));
		}
		BinaryTerm binary = (BinaryTerm) term;
		return new IrBinary(lowerNumeric(binary.left()), arithmetic(binary), lowerNumeric(binary.right()));
	}

	private static ArithmeticOp arithmetic(BinaryTerm binary) {
		BinaryOperator operator = binary.operator();
		switch (operator) {
			case PLUS: return ArithmeticOp.ADD;
			case MINUS: return ArithmeticOp.SUB;
			case MULT: return ArithmeticOp.MUL;
			case DIV: return ArithmeticOp.DIV;
			default:
				throw new InternalConsistencyException(
						"Operator '" + operator.keyword() + "' in numeric context at line " + binary.line());
		}
	}
}
