package org.splc.compiler.frontend.ast;

/**
 * A user-defined name together with the source line it appears on.
 *
 * @param text The name.
 * @param line The source line, used for diagnostics.
 */
public record Identifier(String text, int line) implements AstNode {

    @Override
    public String toString() {
        return text;
    }
}
