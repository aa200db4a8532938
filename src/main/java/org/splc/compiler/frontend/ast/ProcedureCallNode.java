package org.splc.compiler.frontend.ast;

import java.util.List;

/**
 * {@code NAME ( INPUT )} used as a statement.
 *
 * @param name The called procedure.
 * @param arguments The actual arguments.
 */
public record ProcedureCallNode(Identifier name, List<AtomNode> arguments) implements InstructionNode {
    public ProcedureCallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public int line() {
        return name.line();
    }

    @Override
    public String construct() {
        return "call " + name.text();
    }
}
