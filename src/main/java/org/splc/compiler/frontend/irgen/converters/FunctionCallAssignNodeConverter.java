package org.splc.compiler.frontend.irgen.converters;

import org.splc.compiler.frontend.ast.FunctionCallAssignNode;
import org.splc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.splc.compiler.frontend.irgen.IrGenContext;
import org.splc.compiler.frontend.irgen.TermLowering;
import org.splc.compiler.ir.IrCallAssign;

/**
 * Converts a function call assignment into an {@link IrCallAssign}. The call is expanded later by the inliner.
 */
public final class FunctionCallAssignNodeConverter implements IAstNodeToIrConverter<FunctionCallAssignNode> {

	@Override
	public void convert(FunctionCallAssignNode node, IrGenContext ctx) {
		ctx.emit(new IrCallAssign(
				node.target().name().text(),
				node.name().text(),
				node.arguments().stream().map(TermLowering::lowerAtom).toList(),
				ctx.sourceOf(node)));
	}
}
