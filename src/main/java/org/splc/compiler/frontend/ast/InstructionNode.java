package org.splc.compiler.frontend.ast;

/**
 * The closed set of instruction variants.
 */
public sealed interface InstructionNode extends AstNode
        permits HaltNode, PrintNode, ProcedureCallNode, FunctionCallAssignNode, AssignNode,
                WhileNode, DoUntilNode, IfNode, IfElseNode {

    /**
     * @return The source line of the instruction.
     */
    int line();

    /**
     * @return The SPL keyword or form of the instruction, used in diagnostics.
     */
    String construct();
}
