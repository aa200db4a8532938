package org.splc.compiler.backend.layout;

import org.splc.compiler.ir.IrItem;

/**
 * An instruction together with the address the layout assigned to it.
 */
public record PlacedItem(int address, IrItem item) {}
