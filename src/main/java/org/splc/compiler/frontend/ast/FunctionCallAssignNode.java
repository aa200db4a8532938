package org.splc.compiler.frontend.ast;

import java.util.List;

/**
 * {@code VAR = NAME ( INPUT )}
 *
 * @param target The variable receiving the returned value.
 * @param name The called function.
 * @param arguments The actual arguments.
 */
public record FunctionCallAssignNode(VarRef target, Identifier name, List<AtomNode> arguments) implements InstructionNode {
    public FunctionCallAssignNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public int line() {
        return target.line();
    }

    @Override
    public String construct() {
        return target.name().text() + " = " + name.text() + "(...)";
    }
}
