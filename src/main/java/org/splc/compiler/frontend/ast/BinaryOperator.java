package org.splc.compiler.frontend.ast;

/**
 * Binary operators of SPL, grouped by the kind of operands they take and the value they produce.
 */
public enum BinaryOperator {
    PLUS("plus", Kind.ARITHMETIC),
    MINUS("minus", Kind.ARITHMETIC),
    MULT("mult", Kind.ARITHMETIC),
    DIV("div", Kind.ARITHMETIC),
    AND("and", Kind.BOOLEAN),
    OR("or", Kind.BOOLEAN),
    EQ("eq", Kind.COMPARISON),
    GT("gt", Kind.COMPARISON);

    /**
     * Operator families.
     */
    public enum Kind {
        /** numeric x numeric -> numeric */
        ARITHMETIC,
        /** boolean x boolean -> boolean */
        BOOLEAN,
        /** numeric x numeric -> boolean */
        COMPARISON
    }

    private final String keyword;
    private final Kind kind;

    BinaryOperator(String keyword, Kind kind) {
        this.keyword = keyword;
        this.kind = kind;
    }

    public String keyword() {
        return keyword;
    }

    public Kind kind() {
        return kind;
    }
}
