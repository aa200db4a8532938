package org.splc.compiler.frontend.ast;

import java.util.List;

/**
 * The main program.
 *
 * @param locals The variables declared by main.
 * @param algorithm The instructions of main.
 */
public record MainNode(List<VarDecl> locals, Algorithm algorithm) implements AstNode {
    public MainNode {
        locals = List.copyOf(locals);
    }
}
