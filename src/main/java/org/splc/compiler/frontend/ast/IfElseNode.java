package org.splc.compiler.frontend.ast;

/**
 * {@code if TERM { ALGO } else { ALGO }}
 *
 * @param condition The branch condition.
 * @param thenBranch The instructions executed when the condition holds.
 * @param elseBranch The instructions executed otherwise.
 * @param line The source line of the keyword.
 */
public record IfElseNode(TermNode condition, Algorithm thenBranch, Algorithm elseBranch, int line) implements InstructionNode {

    @Override
    public String construct() {
        return "if-else";
    }
}
