package org.splc.compiler.frontend.ast;

import java.util.List;

/**
 * Root of the AST: {@code glob { ... } proc { ... } func { ... } main { ... }}.
 *
 * @param globals The global variable declarations.
 * @param procedures The procedure definitions in declaration order.
 * @param functions The function definitions in declaration order.
 * @param main The main program.
 */
public record ProgramNode(
        List<VarDecl> globals,
        List<ProcedureDef> procedures,
        List<FunctionDef> functions,
        MainNode main
) implements AstNode {
    public ProgramNode {
        globals = List.copyOf(globals);
        procedures = List.copyOf(procedures);
        functions = List.copyOf(functions);
    }
}
