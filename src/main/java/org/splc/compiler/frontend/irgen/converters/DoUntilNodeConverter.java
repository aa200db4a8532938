package org.splc.compiler.frontend.irgen.converters;

import org.splc.compiler.frontend.ast.DoUntilNode;
import org.splc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.splc.compiler.frontend.irgen.IrGenContext;
import org.splc.compiler.api.SourceInfo;

/**
 * Converts {@link DoUntilNode} into a tail-tested loop that leaves once the condition holds.
 */
public final class DoUntilNodeConverter implements IAstNodeToIrConverter<DoUntilNode> {

	@Override
	public void convert(DoUntilNode node, IrGenContext ctx) {
		SourceInfo src = ctx.sourceOf(node);
		String start = ctx.freshLabel("D");
		String exit = ctx.freshLabel("DX");
		ctx.emitLabel(start, src);
		ctx.convertAll(node.body());
		ctx.conditions().jumpIfTrue(node.condition(), exit, src);
		ctx.emitGoto(start, src);
		ctx.emitLabel(exit, src);
	}
}
