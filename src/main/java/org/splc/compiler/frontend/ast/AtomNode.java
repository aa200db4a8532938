package org.splc.compiler.frontend.ast;

/**
 * The closed set of atom variants: a variable reference or a numeric literal.
 */
public sealed interface AtomNode extends AstNode permits VarRef, NumberLiteral {

    int line();
}
