package org.splc.compiler.frontend.ast;

import java.util.List;

/**
 * The body of a procedure or function: its locals followed by its algorithm.
 *
 * @param locals The local variable declarations (at most three).
 * @param algorithm The instructions of the body.
 */
public record BodyNode(List<VarDecl> locals, Algorithm algorithm) implements AstNode {
    public BodyNode {
        locals = List.copyOf(locals);
    }
}
