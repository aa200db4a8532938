package org.splc.compiler.frontend.ast;

/**
 * Unary operators of SPL.
 */
public enum UnaryOperator {
    /** Arithmetic negation. */
    NEG("neg"),
    /** Boolean negation. */
    NOT("not");

    private final String keyword;

    UnaryOperator(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return The SPL keyword of the operator.
     */
    public String keyword() {
        return keyword;
    }
}
