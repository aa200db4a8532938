package org.splc.compiler.frontend.irgen.converters;

import org.splc.compiler.frontend.ast.ProcedureCallNode;
import org.splc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.splc.compiler.frontend.irgen.IrGenContext;
import org.splc.compiler.frontend.irgen.TermLowering;
import org.splc.compiler.ir.IrCall;

/**
 * Converts a procedure call statement into an {@link IrCall}. The call is expanded later by the inliner.
 */
public final class ProcedureCallNodeConverter implements IAstNodeToIrConverter<ProcedureCallNode> {

	@Override
	public void convert(ProcedureCallNode node, IrGenContext ctx) {
		ctx.emit(new IrCall(
				node.name().text(),
				node.arguments().stream().map(TermLowering::lowerAtom).toList(),
				ctx.sourceOf(node)));
	}
}
