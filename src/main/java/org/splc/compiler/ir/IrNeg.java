package org.splc.compiler.ir;

public record IrNeg(IrExpr operand) implements IrExpr {}
