package org.splc.compiler.frontend.ast;

/**
 * A term consisting of a single atom.
 *
 * @param atom The atom.
 */
public record AtomTerm(AtomNode atom) implements TermNode {

    @Override
    public int line() {
        return atom.line();
    }
}
