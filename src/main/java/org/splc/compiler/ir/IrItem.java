package org.splc.compiler.ir;

import org.splc.compiler.api.SourceInfo;

/**
 * Marker interface for all instructions of the intermediate instruction stream. Every item
 * carries source information for diagnostics and debugging.
 */
public sealed interface IrItem
        permits IrAssign, IrPrint, IrHalt, IrCall, IrCallAssign, IrIfGoto, IrGoto, IrLabelDef {
    SourceInfo source();
}
