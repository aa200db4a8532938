package org.splc.compiler.frontend.ast;

/**
 * A use of a variable.
 *
 * @param name The referenced name.
 */
public record VarRef(Identifier name) implements AtomNode {

    @Override
    public int line() {
        return name.line();
    }
}
