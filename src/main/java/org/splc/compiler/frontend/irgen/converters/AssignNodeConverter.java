package org.splc.compiler.frontend.irgen.converters;

import org.splc.compiler.frontend.ast.AssignNode;
import org.splc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.splc.compiler.frontend.irgen.IrGenContext;
import org.splc.compiler.frontend.irgen.TermLowering;
import org.splc.compiler.ir.IrAssign;

/**
 * Converts a term assignment into a single {@link IrAssign} carrying the lowered expression tree.
 */
public final class AssignNodeConverter implements IAstNodeToIrConverter<AssignNode> {

	@Override
	public void convert(AssignNode node, IrGenContext ctx) {
		ctx.emit(new IrAssign(
				node.target().name().text(),
				TermLowering.lowerNumeric(node.term()),
				ctx.sourceOf(node)));
	}
}
