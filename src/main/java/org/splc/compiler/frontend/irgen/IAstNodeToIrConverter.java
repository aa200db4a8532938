package org.splc.compiler.frontend.irgen;

import org.splc.compiler.frontend.ast.InstructionNode;

/**
 * Converts a specific instruction node type into zero or more IR items.
 * <p>
 * Implementations should be stateless. All output must be emitted via the provided {@link IrGenContext}.
 *
 * @param <T> The concrete instruction node type handled by this converter.
 */
public interface IAstNodeToIrConverter<T extends InstructionNode> {

	/**
	 * Converts the given node into IR and emits results via the provided context.
	 *
	 * @param node The node to convert.
	 * @param ctx  The IR generation context used to emit IR items and draw fresh labels.
	 */
	void convert(T node, IrGenContext ctx);
}
