package org.splc.compiler.ir;

public record IrAddress(int address) implements IrJumpTarget {}
