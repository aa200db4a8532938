package org.splc.compiler.frontend.irgen.converters;

import org.splc.compiler.frontend.ast.IfNode;
import org.splc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.splc.compiler.frontend.irgen.IrGenContext;
import org.splc.compiler.api.SourceInfo;

/**
 * Converts {@link IfNode}: jump to the then-label on true, else skip to the exit label.
 */
public final class IfNodeConverter implements IAstNodeToIrConverter<IfNode> {

	@Override
	public void convert(IfNode node, IrGenContext ctx) {
		SourceInfo src = ctx.sourceOf(node);
		String then = ctx.freshLabel("T");
		String exit = ctx.freshLabel("X");
		ctx.conditions().jumpIfTrue(node.condition(), then, src);
		ctx.emitGoto(exit, src);
		ctx.emitLabel(then, src);
		ctx.convertAll(node.thenBranch());
		ctx.emitLabel(exit, src);
	}
}
