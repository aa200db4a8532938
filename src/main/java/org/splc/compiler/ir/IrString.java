package org.splc.compiler.ir;

/**
 * A string literal, held without quotes.
 */
public record IrString(String text) implements IrPrintable {}
