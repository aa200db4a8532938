package org.splc.compiler.ir;

public record IrNum(long value) implements IrAtom {}
