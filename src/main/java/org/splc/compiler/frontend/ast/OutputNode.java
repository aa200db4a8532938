package org.splc.compiler.frontend.ast;

/**
 * What a {@code print} instruction prints: an atom or a string literal.
 */
public sealed interface OutputNode extends AstNode permits AtomOutput, StringOutput {

    int line();
}
