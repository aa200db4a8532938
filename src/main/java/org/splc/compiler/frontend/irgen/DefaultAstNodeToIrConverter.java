package org.splc.compiler.frontend.irgen;

import org.splc.compiler.diagnostics.InternalConsistencyException;
import org.splc.compiler.frontend.ast.InstructionNode;

/**
 * Fallback converter used when no specific converter is registered. Every instruction variant
 * has a converter, so reaching this one is a pipeline fault.
 */
public final class DefaultAstNodeToIrConverter implements IAstNodeToIrConverter<InstructionNode> {

	@Override
	public void convert(InstructionNode node, IrGenContext ctx) {
		throw new InternalConsistencyException(
				"No IR converter registered for node type " + node.getClass().getSimpleName());
	}
}
