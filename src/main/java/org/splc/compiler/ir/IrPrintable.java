package org.splc.compiler.ir;

/**
 * Something a print instruction can output: an atom or a string literal.
 */
public sealed interface IrPrintable permits IrAtom, IrString {}
