package org.splc.compiler.ir;

public record IrBinary(IrExpr left, ArithmeticOp operator, IrExpr right) implements IrExpr {}
