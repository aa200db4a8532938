package org.splc.compiler.frontend.ast;

/**
 * The closed set of term variants.
 */
public sealed interface TermNode extends AstNode permits AtomTerm, UnaryTerm, BinaryTerm {

    int line();
}
