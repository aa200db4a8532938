package org.splc.compiler.frontend.ast;

/**
 * {@code VAR = TERM}
 *
 * @param target The assigned variable.
 * @param term The assigned expression.
 */
public record AssignNode(VarRef target, TermNode term) implements InstructionNode {

    @Override
    public int line() {
        return target.line();
    }

    @Override
    public String construct() {
        return target.name().text() + " = ...";
    }
}
