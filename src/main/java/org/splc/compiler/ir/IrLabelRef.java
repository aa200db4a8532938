package org.splc.compiler.ir;

public record IrLabelRef(String labelName) implements IrJumpTarget {}
