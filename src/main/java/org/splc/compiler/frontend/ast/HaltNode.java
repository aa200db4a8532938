package org.splc.compiler.frontend.ast;

/**
 * {@code halt}
 *
 * @param line The source line.
 */
public record HaltNode(int line) implements InstructionNode {

    @Override
    public String construct() {
        return "halt";
    }
}
