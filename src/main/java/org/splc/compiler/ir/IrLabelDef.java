package org.splc.compiler.ir;

import org.splc.compiler.api.SourceInfo;

public record IrLabelDef(String name, SourceInfo source) implements IrItem {}
