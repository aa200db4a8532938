package org.splc.compiler.frontend.ast;

import java.util.List;

/**
 * An ordered list of instructions.
 *
 * @param instructions The instructions in execution order.
 */
public record Algorithm(List<InstructionNode> instructions) implements AstNode {
    public Algorithm {
        instructions = List.copyOf(instructions);
    }
}
