package org.splc.compiler.ir;

import org.splc.compiler.api.SourceInfo;

public record IrAssign(String target, IrExpr value, SourceInfo source) implements IrItem {}
