package org.splc.compiler.ir;

/**
 * The single comparison a conditional jump tests.
 */
public record IrCondition(IrExpr left, Comparison comparison, IrExpr right) {

    public enum Comparison {
        EQ("="),
        GT(">");

        private final String symbol;

        Comparison(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }
}
