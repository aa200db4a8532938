package org.splc.compiler.ir;

import org.splc.compiler.api.SourceInfo;

public record IrHalt(SourceInfo source) implements IrItem {}
