package org.splc.compiler.frontend.ast;

/**
 * {@code ( TERM BINOP TERM )}
 *
 * @param left The left operand.
 * @param operator The operator.
 * @param right The right operand.
 */
public record BinaryTerm(TermNode left, BinaryOperator operator, TermNode right) implements TermNode {

    @Override
    public int line() {
        return left.line();
    }
}
