package org.splc.compiler.ir;

/**
 * Target of a jump: a symbolic label before linking, a numeric address after.
 */
public sealed interface IrJumpTarget permits IrLabelRef, IrAddress {}
