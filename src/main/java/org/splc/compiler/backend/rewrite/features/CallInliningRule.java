package org.splc.compiler.backend.rewrite.features;

import org.splc.compiler.api.CompilerErrorCode;
import org.splc.compiler.api.SourceInfo;
import org.splc.compiler.backend.rewrite.IRewriteRule;
import org.splc.compiler.diagnostics.DiagnosticsEngine;
import org.splc.compiler.diagnostics.InternalConsistencyException;
import org.splc.compiler.frontend.irgen.NameSupply;
import org.splc.compiler.ir.IrAssign;
import org.splc.compiler.ir.IrAtom;
import org.splc.compiler.ir.IrBinary;
import org.splc.compiler.ir.IrCall;
import org.splc.compiler.ir.IrCallAssign;
import org.splc.compiler.ir.IrCondition;
import org.splc.compiler.ir.IrExpr;
import org.splc.compiler.ir.IrGoto;
import org.splc.compiler.ir.IrHalt;
import org.splc.compiler.ir.IrIfGoto;
import org.splc.compiler.ir.IrItem;
import org.splc.compiler.ir.IrJumpTarget;
import org.splc.compiler.ir.IrLabelDef;
import org.splc.compiler.ir.IrLabelRef;
import org.splc.compiler.ir.IrNeg;
import org.splc.compiler.ir.IrPrint;
import org.splc.compiler.ir.IrProgram;
import org.splc.compiler.ir.IrRoutine;
import org.splc.compiler.ir.IrVar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces every {@link IrCall} and {@link IrCallAssign} with a renamed copy of the callee's body.
 * <p>
 * Each expansion allocates fresh names for the callee's parameters and locals, and fresh labels
 * for every label in its body, so two copies of the same routine never share a variable or label.
 * Global variables keep their names. Calls inside an inlined body are expanded recursively.
 * <p>
 * A call to a routine that is already being expanded further up the chain is reported as
 * {@link CompilerErrorCode#RECURSIVE_INLINE} and left in place, which bounds the expansion.
 * Unknown callees and callees of the wrong kind are reported and left in place as well.
 */
public final class CallInliningRule implements IRewriteRule {

	private static final Logger LOG = LoggerFactory.getLogger(CallInliningRule.class);

	private final DiagnosticsEngine diagnostics;
	private final NameSupply names;
	private final String parameterPrefix;
	private final String localPrefix;

	/**
	 * @param diagnostics The diagnostics engine for reporting errors.
	 * @param names The name supply shared with code generation.
	 * @param parameterPrefix Prefix of fresh parameter names.
	 * @param localPrefix Prefix of fresh local variable names.
	 */
	public CallInliningRule(DiagnosticsEngine diagnostics, NameSupply names, String parameterPrefix, String localPrefix) {
		this.diagnostics = diagnostics;
		this.names = names;
		this.parameterPrefix = parameterPrefix;
		this.localPrefix = localPrefix;
	}

	@Override
	public IrProgram apply(IrProgram program) {
		Expansion expansion = new Expansion(program.routines());
		expansion.expand(program.items(), Renamer.identity());
		LOG.debug("Inlined {} call sites, {} items after inlining", expansion.inlined, expansion.out.size());
		return program.withItems(expansion.out);
	}

	/**
	 * State of one application of the rule.
	 */
	private final class Expansion {
		private final Map<String, IrRoutine> routines;
		private final List<IrItem> out = new ArrayList<>();
		private final Deque<String> chain = new ArrayDeque<>();
		private int inlined;

		Expansion(Map<String, IrRoutine> routines) {
			this.routines = routines;
		}

		void expand(List<IrItem> items, Renamer renamer) {
			for (IrItem item : items) {
				if (item instanceof IrCall call) {
					List<IrAtom> arguments = renamer.atoms(call.arguments());
					IrItem renamed = new IrCall(call.routine(), arguments, call.source());
					inline(call.routine(), arguments, null, IrRoutine.Kind.PROCEDURE, renamed);
				} else if (item instanceof IrCallAssign call) {
					String target = renamer.variable(call.target());
					List<IrAtom> arguments = renamer.atoms(call.arguments());
					IrItem renamed = new IrCallAssign(target, call.routine(), arguments, call.source());
					inline(call.routine(), arguments, target, IrRoutine.Kind.FUNCTION, renamed);
				} else {
					out.add(renamer.rename(item));
				}
			}
		}

		private void inline(String callee, List<IrAtom> arguments, String target, IrRoutine.Kind expected, IrItem callSite) {
			SourceInfo src = callSite.source();
			IrRoutine routine = routines.get(callee);
			if (routine == null) {
				report(CompilerErrorCode.UNKNOWN_ROUTINE, "Unknown " + kindName(expected) + " '" + callee + "'", src, callSite);
				return;
			}
			if (routine.kind() != expected) {
				report(CompilerErrorCode.WRONG_CALL_KIND,
						"'" + callee + "' is a " + kindName(routine.kind()) + ", not a " + kindName(expected), src, callSite);
				return;
			}
			if (chain.contains(callee)) {
				String path = String.join(" -> ", chain) + " -> " + callee;
				report(CompilerErrorCode.RECURSIVE_INLINE,
						"Recursive call to '" + callee + "' cannot be inlined (" + path + ")", src, callSite);
				return;
			}
			if (arguments.size() != routine.parameters().size()) {
				throw new InternalConsistencyException("Call to '" + callee + "' with " + arguments.size()
						+ " argument(s) reached inlining, expected " + routine.parameters().size() + " at " + src);
			}

			Renamer inner = Renamer.forCopy(routine, names, parameterPrefix, localPrefix);
			for (int i = 0; i < arguments.size(); i++) {
				out.add(new IrAssign(inner.variable(routine.parameters().get(i)), arguments.get(i), src));
			}
			chain.addLast(callee);
			expand(routine.body(), inner);
			chain.removeLast();
			if (target != null) {
				IrAtom returnAtom = routine.returnAtom().orElseThrow(() ->
						new InternalConsistencyException("Function '" + callee + "' has no return value"));
				out.add(new IrAssign(target, inner.atom(returnAtom), src));
			}
			inlined++;
		}

		private void report(CompilerErrorCode code, String message, SourceInfo src, IrItem callSite) {
			diagnostics.reportError(code, message, src.lineNumber());
			out.add(callSite);
		}
	}

	private static String kindName(IrRoutine.Kind kind) {
		return kind == IrRoutine.Kind.PROCEDURE ? "procedure" : "function";
	}

	/**
	 * Maps variable and label names of one inlined copy to their fresh names. Names not in the
	 * variable map (globals) stay unchanged. Labels are renamed lazily on first sight.
	 */
	private static final class Renamer {
		private final Map<String, String> variables;
		private final Map<String, String> labels = new HashMap<>();
		private final NameSupply names;

		private Renamer(Map<String, String> variables, NameSupply names) {
			this.variables = variables;
			this.names = names;
		}

		static Renamer identity() {
			return new Renamer(Map.of(), null);
		}

		static Renamer forCopy(IrRoutine routine, NameSupply names, String parameterPrefix, String localPrefix) {
			Map<String, String> variables = new HashMap<>();
			for (String parameter : routine.parameters()) {
				variables.put(parameter, names.freshVariable(parameterPrefix, parameter));
			}
			for (String local : routine.locals()) {
				variables.put(local, names.freshVariable(localPrefix, local));
			}
			return new Renamer(variables, names);
		}

		String variable(String name) {
			return variables.getOrDefault(name, name);
		}

		String label(String name) {
			if (names == null) return name;
			return labels.computeIfAbsent(name, names::freshLabelLike);
		}

		IrAtom atom(IrAtom atom) {
			if (atom instanceof IrVar v) return new IrVar(variable(v.name()));
			return atom;
		}

		List<IrAtom> atoms(List<IrAtom> atoms) {
			return atoms.stream().map(this::atom).toList();
		}

		IrExpr expr(IrExpr expr) {
			if (expr instanceof IrAtom a) return atom(a);
			if (expr instanceof IrNeg n) return new IrNeg(expr(n.operand()));
			IrBinary b = (IrBinary) expr;
			return new IrBinary(expr(b.left()), b.operator(), expr(b.right()));
		}

		IrJumpTarget target(IrJumpTarget target) {
			if (target instanceof IrLabelRef ref) return new IrLabelRef(label(ref.labelName()));
			return target;
		}

		IrItem rename(IrItem item) {
			if (item instanceof IrAssign a) {
				return new IrAssign(variable(a.target()), expr(a.value()), a.source());
			}
			if (item instanceof IrPrint p) {
				return p.value() instanceof IrAtom a ? new IrPrint(atom(a), p.source()) : p;
			}
			if (item instanceof IrIfGoto g) {
				IrCondition c = g.condition();
				return new IrIfGoto(new IrCondition(expr(c.left()), c.comparison(), expr(c.right())), target(g.target()), g.source());
			}
			if (item instanceof IrGoto g) {
				return g.withTarget(target(g.target()));
			}
			if (item instanceof IrLabelDef l) {
				return new IrLabelDef(label(l.name()), l.source());
			}
			if (item instanceof IrHalt) {
				return item;
			}
			throw new InternalConsistencyException("Unexpected item during inlining: " + item);
		}
	}
}
