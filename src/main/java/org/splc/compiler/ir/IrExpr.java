package org.splc.compiler.ir;

/**
 * A numeric expression tree. Boolean values never appear here; they are lowered to jumps.
 */
public sealed interface IrExpr permits IrAtom, IrNeg, IrBinary {}
