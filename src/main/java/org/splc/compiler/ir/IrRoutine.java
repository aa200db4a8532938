package org.splc.compiler.ir;

import java.util.List;
import java.util.Optional;

/**
 * The generated template of a procedure or function. Names inside the body are the original
 * source names; the inliner renames them per call site.
 *
 * @param name The routine name.
 * @param kind Whether this is a procedure or a function.
 * @param parameters The parameter names in declaration order.
 * @param locals The local variable names.
 * @param body The lowered body, which may itself contain calls.
 * @param returnValue The return atom of a function, {@code null} for procedures.
 */
public record IrRoutine(
        String name,
        Kind kind,
        List<String> parameters,
        List<String> locals,
        List<IrItem> body,
        IrAtom returnValue
) {
    public enum Kind {
        PROCEDURE,
        FUNCTION
    }

    public IrRoutine {
        parameters = List.copyOf(parameters);
        locals = List.copyOf(locals);
        body = List.copyOf(body);
    }

    public Optional<IrAtom> returnAtom() {
        return Optional.ofNullable(returnValue);
    }
}
