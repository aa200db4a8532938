package org.splc.compiler.ir;

import org.splc.compiler.api.SourceInfo;

import java.util.List;

/**
 * A procedure call statement. Only present before inlining.
 *
 * @param routine The callee name.
 * @param arguments The actual arguments, positionally.
 * @param source The source information.
 */
public record IrCall(String routine, List<IrAtom> arguments, SourceInfo source) implements IrItem {
    public IrCall {
        arguments = List.copyOf(arguments);
    }
}
