package org.splc.compiler.frontend.ast;

/**
 * {@code do { ALGO } until TERM}
 *
 * @param body The loop body, executed at least once.
 * @param condition The exit condition.
 * @param line The source line of the keyword.
 */
public record DoUntilNode(Algorithm body, TermNode condition, int line) implements InstructionNode {

    @Override
    public String construct() {
        return "do-until";
    }
}
