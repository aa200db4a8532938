package org.splc.compiler.frontend.ast;

/**
 * {@code while TERM { ALGO }}
 *
 * @param condition The loop condition.
 * @param body The loop body.
 * @param line The source line of the keyword.
 */
public record WhileNode(TermNode condition, Algorithm body, int line) implements InstructionNode {

    @Override
    public String construct() {
        return "while";
    }
}
