package org.splc.compiler.frontend.ast;

import java.util.List;

/**
 * Common shape of procedure and function definitions.
 */
public sealed interface RoutineDef extends AstNode permits ProcedureDef, FunctionDef {

    Identifier name();

    List<VarDecl> parameters();

    BodyNode body();
}
