package org.splc.compiler.backend.rewrite;

import org.splc.compiler.backend.rewrite.features.CallInliningRule;
import org.splc.compiler.config.CompilerConfig;
import org.splc.compiler.diagnostics.DiagnosticsEngine;
import org.splc.compiler.frontend.irgen.NameSupply;
import org.splc.compiler.ir.IrProgram;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry for rewrite rules applied in order.
 */
public final class RewriteRegistry {

	private final List<IRewriteRule> rules = new ArrayList<>();

	/**
	 * Registers a new rewrite rule.
	 * @param rule The rule to register.
	 */
	public void register(IRewriteRule rule) { rules.add(rule); }

	/**
	 * @return The list of registered rewrite rules.
	 */
	public List<IRewriteRule> rules() { return rules; }

	/**
	 * Applies every registered rule in registration order.
	 * @param program The program to rewrite.
	 * @return The result of the last rule.
	 */
	public IrProgram applyAll(IrProgram program) {
		IrProgram current = program;
		for (IRewriteRule rule : rules) {
			current = rule.apply(current);
		}
		return current;
	}

	/**
	 * Initializes a new rewrite registry with the default rules for one compilation.
	 * @param diagnostics The diagnostics engine of the compilation.
	 * @param names The name supply of the compilation.
	 * @param config The compiler configuration.
	 * @return A new registry with default rules.
	 */
	public static RewriteRegistry initializeWithDefaults(DiagnosticsEngine diagnostics, NameSupply names, CompilerConfig config) {
		RewriteRegistry reg = new RewriteRegistry();
		reg.register(new CallInliningRule(diagnostics, names, config.freshParameterPrefix(), config.freshLocalPrefix()));
		return reg;
	}
}
