package org.splc.compiler.ir;

import org.splc.compiler.api.SourceInfo;

import java.util.List;

/**
 * Assignment of a function result to a variable. Only present before inlining.
 *
 * @param target The variable receiving the return value.
 * @param routine The callee name.
 * @param arguments The actual arguments, positionally.
 * @param source The source information.
 */
public record IrCallAssign(String target, String routine, List<IrAtom> arguments, SourceInfo source) implements IrItem {
    public IrCallAssign {
        arguments = List.copyOf(arguments);
    }
}
