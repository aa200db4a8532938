package org.splc.compiler.frontend.ast;

/**
 * {@code ( UNOP TERM )}
 *
 * @param operator The operator.
 * @param operand The operand.
 */
public record UnaryTerm(UnaryOperator operator, TermNode operand) implements TermNode {

    @Override
    public int line() {
        return operand.line();
    }
}
