package org.splc.compiler.frontend.ast;

import java.util.List;

/**
 * Definition of a function.
 *
 * @param name The function name.
 * @param parameters The formal parameters (at most three).
 * @param body The body.
 * @param returnAtom The atom whose value the function returns.
 */
public record FunctionDef(Identifier name, List<VarDecl> parameters, BodyNode body, AtomNode returnAtom) implements RoutineDef {
    public FunctionDef {
        parameters = List.copyOf(parameters);
    }
}
