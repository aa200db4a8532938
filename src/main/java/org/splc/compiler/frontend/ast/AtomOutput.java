package org.splc.compiler.frontend.ast;

/**
 * @param atom The printed atom.
 */
public record AtomOutput(AtomNode atom) implements OutputNode {

    @Override
    public int line() {
        return atom.line();
    }
}
