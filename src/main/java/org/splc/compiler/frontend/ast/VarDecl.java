package org.splc.compiler.frontend.ast;

/**
 * Declaration of a variable, parameter or local.
 *
 * @param name The declared name.
 */
public record VarDecl(Identifier name) implements AstNode {
}
