package org.splc.compiler;

import org.splc.compiler.api.CompilationException;
import org.splc.compiler.api.CompilerErrorCode;
import org.splc.compiler.api.ICompiler;
import org.splc.compiler.api.ProgramArtifact;
import org.splc.compiler.backend.emit.Emitter;
import org.splc.compiler.backend.layout.LayoutEngine;
import org.splc.compiler.backend.layout.LayoutResult;
import org.splc.compiler.backend.link.Linker;
import org.splc.compiler.backend.link.LinkingRegistry;
import org.splc.compiler.backend.rewrite.RewriteRegistry;
import org.splc.compiler.config.CompilerConfig;
import org.splc.compiler.diagnostics.Diagnostic;
import org.splc.compiler.diagnostics.DiagnosticsEngine;
import org.splc.compiler.diagnostics.InternalConsistencyException;
import org.splc.compiler.frontend.ast.ProgramNode;
import org.splc.compiler.frontend.irgen.IrConverterRegistry;
import org.splc.compiler.frontend.irgen.IrGenerator;
import org.splc.compiler.frontend.irgen.NameSupply;
import org.splc.compiler.frontend.semantics.ScopeResolver;
import org.splc.compiler.frontend.semantics.SymbolTable;
import org.splc.compiler.frontend.semantics.TypeChecker;
import org.splc.compiler.ir.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from a parsed program
 * to a numbered program artifact: scope resolution, type checking, IR generation, inlining,
 * layout, linking and emission.
 * <p>
 * Every call to {@link #compile} creates its own diagnostics, name supply and symbol table, so one
 * instance can be reused and shared between threads.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final CompilerConfig config;

    /**
     * Creates a compiler with the settings shipped in {@code reference.conf}.
     */
    public Compiler() {
        this(CompilerConfig.defaults());
    }

    /**
     * @param config The compiler settings.
     */
    public Compiler(CompilerConfig config) {
        this.config = config;
    }

    public CompilerConfig config() {
        return config;
    }

    @Override
    public ProgramArtifact compile(ProgramNode program, String programName) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(programName);
        try {
            return runPipeline(program, programName, diagnostics);
        } catch (InternalConsistencyException e) {
            LOG.error("Internal consistency fault while compiling {}: {}", programName, e.getMessage());
            Diagnostic fault = new Diagnostic(Diagnostic.Type.ERROR, CompilerErrorCode.INTERNAL_CONSISTENCY_FAULT,
                    e.getMessage(), programName, -1);
            throw new CompilationException(List.of(fault), e);
        }
    }

    private ProgramArtifact runPipeline(ProgramNode program, String programName, DiagnosticsEngine diagnostics)
            throws CompilationException {
        // Phase 1: Scope resolution
        SymbolTable symbolTable = new ScopeResolver(diagnostics).resolve(program);
        gate(diagnostics, "scope resolution");

        // Phase 2: Type checking
        new TypeChecker(diagnostics).check(program, symbolTable);
        gate(diagnostics, "type checking");

        // Phase 3: IR generation (calls stay symbolic)
        NameSupply names = new NameSupply();
        IrGenerator generator = new IrGenerator(IrConverterRegistry.initializeWithDefaults());
        IrProgram intermediate = generator.generate(program, programName, names);

        // Phase 4: Inlining
        IrProgram callFree = RewriteRegistry.initializeWithDefaults(diagnostics, names, config).applyAll(intermediate);
        gate(diagnostics, "inlining");

        // Phase 5: Layout
        LayoutResult layout = new LayoutEngine(config.start(), config.step()).layout(callFree);

        // Phase 6: Linking
        Linker linker = new Linker(LinkingRegistry.initializeWithDefaults(), diagnostics, config.strictLabels());
        LayoutResult linked = linker.link(layout);
        gate(diagnostics, "linking");

        // Phase 7: Emission
        ProgramArtifact artifact = new Emitter().emit(linked, intermediate, callFree);
        LOG.info("Compiled {}: {} lines, {} labels", programName, artifact.lines().size(), artifact.labelToAddress().size());
        return artifact;
    }

    private static void gate(DiagnosticsEngine diagnostics, String phase) throws CompilationException {
        if (diagnostics.hasErrors()) {
            LOG.warn("Compilation of {} failed after {} with {} error(s)",
                    diagnostics.programName(), phase, diagnostics.errorCount());
            throw new CompilationException(diagnostics.getDiagnostics());
        }
    }
}
