package org.splc.compiler.ir;

public record IrVar(String name) implements IrAtom {}
