package org.splc.compiler.ir;

import org.splc.compiler.api.SourceInfo;

public record IrPrint(IrPrintable value, SourceInfo source) implements IrItem {}
