package org.splc.compiler.frontend.irgen.converters;

import org.splc.compiler.frontend.ast.WhileNode;
import org.splc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.splc.compiler.frontend.irgen.IrGenContext;
import org.splc.compiler.api.SourceInfo;

/**
 * Converts {@link WhileNode} into a head-tested loop.
 */
public final class WhileNodeConverter implements IAstNodeToIrConverter<WhileNode> {

	@Override
	public void convert(WhileNode node, IrGenContext ctx) {
		SourceInfo src = ctx.sourceOf(node);
		String start = ctx.freshLabel("W");
		String body = ctx.freshLabel("WB");
		String exit = ctx.freshLabel("WX");
		ctx.emitLabel(start, src);
		ctx.conditions().jumpIfTrue(node.condition(), body, src);
		ctx.emitGoto(exit, src);
		ctx.emitLabel(body, src);
		ctx.convertAll(node.body());
		ctx.emitGoto(start, src);
		ctx.emitLabel(exit, src);
	}
}
