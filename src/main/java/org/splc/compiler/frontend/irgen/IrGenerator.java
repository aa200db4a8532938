package org.splc.compiler.frontend.irgen;

import org.splc.compiler.frontend.ast.FunctionDef;
import org.splc.compiler.frontend.ast.ProcedureDef;
import org.splc.compiler.frontend.ast.ProgramNode;
import org.splc.compiler.frontend.ast.RoutineDef;
import org.splc.compiler.frontend.ast.VarDecl;
import org.splc.compiler.ir.IrAtom;
import org.splc.compiler.ir.IrProgram;
import org.splc.compiler.ir.IrRoutine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Phase: Generates the intermediate instruction stream from a type-checked AST by delegating
 * each instruction to a converter resolved via the {@link IrConverterRegistry}.
 * <p>
 * Main is lowered into the program's item list. Every procedure and function is lowered once
 * into an {@link IrRoutine} template that the inliner later expands per call site.
 */
public final class IrGenerator {

	private static final Logger LOG = LoggerFactory.getLogger(IrGenerator.class);

	private final IrConverterRegistry registry;

	/**
	 * Creates a new IR generator with a prepared registry.
	 *
	 * @param registry The converter registry.
	 */
	public IrGenerator(IrConverterRegistry registry) {
		this.registry = registry;
	}

	/**
	 * Generates the IR program.
	 *
	 * @param program     The validated program.
	 * @param programName The program name used for IR metadata and diagnostics.
	 * @param names       The name supply of this compilation.
	 * @return The generated IR program, which may still contain calls.
	 */
	public IrProgram generate(ProgramNode program, String programName, NameSupply names) {
		Map<String, IrRoutine> routines = new LinkedHashMap<>();
		for (ProcedureDef procedure : program.procedures()) {
			routines.put(procedure.name().text(), template(procedure, IrRoutine.Kind.PROCEDURE, null, programName, names));
		}
		for (FunctionDef function : program.functions()) {
			IrAtom returnValue = TermLowering.lowerAtom(function.returnAtom());
			routines.put(function.name().text(), template(function, IrRoutine.Kind.FUNCTION, returnValue, programName, names));
		}

		IrGenContext ctx = new IrGenContext(programName, registry, names);
		ctx.convertAll(program.main().algorithm());
		IrProgram ir = new IrProgram(programName, ctx.build(), routines);

		LOG.debug("Generated {} items for main and {} routine templates", ir.items().size(), routines.size());
		return ir;
	}

	private IrRoutine template(RoutineDef routine, IrRoutine.Kind kind, IrAtom returnValue,
							   String programName, NameSupply names) {
		IrGenContext ctx = new IrGenContext(programName, registry, names);
		ctx.convertAll(routine.body().algorithm());
		return new IrRoutine(
				routine.name().text(),
				kind,
				namesOf(routine.parameters()),
				namesOf(routine.body().locals()),
				ctx.build(),
				returnValue);
	}

	private static List<String> namesOf(List<VarDecl> decls) {
		return decls.stream().map(d -> d.name().text()).toList();
	}
}
