package org.splc.compiler.backend.rewrite;

import org.splc.compiler.ir.IrProgram;

/**
 * Rewriter rule that can expand or modify the IR stream before layout.
 */
public interface IRewriteRule {

	/**
	 * Applies this rule to the given IR program.
	 *
	 * @param program The input program.
	 * @return The rewritten program.
	 */
	IrProgram apply(IrProgram program);
}
