package org.splc.compiler.frontend.irgen.converters;

import org.splc.compiler.frontend.ast.IfElseNode;
import org.splc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.splc.compiler.frontend.irgen.IrGenContext;
import org.splc.compiler.api.SourceInfo;

/**
 * Converts {@link IfElseNode}. The else branch is emitted inline right after the condition, the then branch behind its label.
 */
public final class IfElseNodeConverter implements IAstNodeToIrConverter<IfElseNode> {

	@Override
	public void convert(IfElseNode node, IrGenContext ctx) {
		SourceInfo src = ctx.sourceOf(node);
		String then = ctx.freshLabel("T");
		String exit = ctx.freshLabel("X");
		ctx.conditions().jumpIfTrue(node.condition(), then, src);
		ctx.convertAll(node.elseBranch());
		ctx.emitGoto(exit, src);
		ctx.emitLabel(then, src);
		ctx.convertAll(node.thenBranch());
		ctx.emitLabel(exit, src);
	}
}
