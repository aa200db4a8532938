package org.splc.compiler.frontend.ast;

import java.util.List;

/**
 * Definition of a procedure.
 *
 * @param name The procedure name.
 * @param parameters The formal parameters (at most three).
 * @param body The body.
 */
public record ProcedureDef(Identifier name, List<VarDecl> parameters, BodyNode body) implements RoutineDef {
    public ProcedureDef {
        parameters = List.copyOf(parameters);
    }
}
