package org.splc.compiler.frontend.irgen.converters;

import org.splc.compiler.frontend.ast.HaltNode;
import org.splc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.splc.compiler.frontend.irgen.IrGenContext;
import org.splc.compiler.ir.IrHalt;

/**
 * Converts {@link HaltNode} into {@link IrHalt}.
 */
public final class HaltNodeConverter implements IAstNodeToIrConverter<HaltNode> {

	@Override
	public void convert(HaltNode node, IrGenContext ctx) {
		ctx.emit(new IrHalt(ctx.sourceOf(node)));
	}
}
