package org.splc.compiler.frontend.ast;

/**
 * {@code print OUTPUT}
 *
 * @param output The printed atom or string.
 */
public record PrintNode(OutputNode output) implements InstructionNode {

    @Override
    public int line() {
        return output.line();
    }

    @Override
    public String construct() {
        return "print";
    }
}
