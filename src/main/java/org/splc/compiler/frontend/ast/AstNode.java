package org.splc.compiler.frontend.ast;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * The tree is produced by an external parser and is never modified by the compiler;
 * scopes, symbols and types are attached through side tables keyed by node identity.
 */
public interface AstNode {
}
