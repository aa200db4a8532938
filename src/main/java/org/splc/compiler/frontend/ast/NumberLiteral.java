package org.splc.compiler.frontend.ast;

/**
 * A non-negative integer literal.
 *
 * @param value The literal value.
 * @param line The source line.
 */
public record NumberLiteral(long value, int line) implements AtomNode {
    public NumberLiteral {
        if (value < 0) {
            throw new IllegalArgumentException("Numeric literals are non-negative, got " + value);
        }
    }
}
