package org.splc.compiler.ir;

public sealed interface IrAtom extends IrExpr, IrPrintable permits IrVar, IrNum {}
