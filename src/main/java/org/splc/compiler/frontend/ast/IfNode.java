package org.splc.compiler.frontend.ast;

/**
 * {@code if TERM { ALGO }}
 *
 * @param condition The branch condition.
 * @param thenBranch The instructions executed when the condition holds.
 * @param line The source line of the keyword.
 */
public record IfNode(TermNode condition, Algorithm thenBranch, int line) implements InstructionNode {

    @Override
    public String construct() {
        return "if";
    }
}
