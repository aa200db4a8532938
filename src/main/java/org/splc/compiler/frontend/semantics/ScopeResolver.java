package org.splc.compiler.frontend.semantics;

import org.splc.compiler.api.CompilerErrorCode;
import org.splc.compiler.diagnostics.DiagnosticsEngine;
import org.splc.compiler.frontend.ast.Algorithm;
import org.splc.compiler.frontend.ast.AssignNode;
import org.splc.compiler.frontend.ast.AtomNode;
import org.splc.compiler.frontend.ast.AtomOutput;
import org.splc.compiler.frontend.ast.AtomTerm;
import org.splc.compiler.frontend.ast.BinaryTerm;
import org.splc.compiler.frontend.ast.DoUntilNode;
import org.splc.compiler.frontend.ast.FunctionCallAssignNode;
import org.splc.compiler.frontend.ast.FunctionDef;
import org.splc.compiler.frontend.ast.HaltNode;
import org.splc.compiler.frontend.ast.Identifier;
import org.splc.compiler.frontend.ast.IfElseNode;
import org.splc.compiler.frontend.ast.IfNode;
import org.splc.compiler.frontend.ast.InstructionNode;
import org.splc.compiler.frontend.ast.NumberLiteral;
import org.splc.compiler.frontend.ast.PrintNode;
import org.splc.compiler.frontend.ast.ProcedureCallNode;
import org.splc.compiler.frontend.ast.ProcedureDef;
import org.splc.compiler.frontend.ast.ProgramNode;
import org.splc.compiler.frontend.ast.RoutineDef;
import org.splc.compiler.frontend.ast.StringOutput;
import org.splc.compiler.frontend.ast.TermNode;
import org.splc.compiler.frontend.ast.UnaryTerm;
import org.splc.compiler.frontend.ast.VarDecl;
import org.splc.compiler.frontend.ast.VarRef;
import org.splc.compiler.frontend.ast.WhileNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the scope tree, registers every declaration and resolves every name use.
 * <p>
 * It works in three passes: collecting declarations, checking the program-wide name identity
 * rule, and resolving the uses inside main and the routine bodies. Every violation is reported
 * to the {@link DiagnosticsEngine} and the pass continues, so one run reports all of them.
 */
public class ScopeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ScopeResolver.class);

    private final DiagnosticsEngine diagnostics;

    /**
     * Constructs a new scope resolver.
     * @param diagnostics The diagnostics engine for reporting errors.
     */
    public ScopeResolver(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Resolves the names of the given program.
     * @param program The program to analyze.
     * @return The populated symbol table. It is complete even if errors were reported.
     */
    public SymbolTable resolve(ProgramNode program) {
        long errorsBefore = diagnostics.errorCount();
        SymbolTable symbolTable = new SymbolTable(diagnostics);

        collectDeclarations(program, symbolTable);
        checkNameIdentity(symbolTable);
        resolveUses(program, symbolTable);

        LOG.debug("Scope resolution finished: {} symbols, {} new errors",
                symbolTable.allSymbols().size(), diagnostics.errorCount() - errorsBefore);
        return symbolTable;
    }

    // --- pass 1: declarations ---

    private void collectDeclarations(ProgramNode program, SymbolTable symbolTable) {
        defineVariables(program.globals(), symbolTable.global(), symbolTable);

        for (ProcedureDef procedure : program.procedures()) {
            symbolTable.define(symbolTable.procGroup(),
                    new Symbol(procedure.name(), Symbol.Category.PROCEDURE, symbolTable.procGroup(), procedure));
            collectRoutine(procedure, symbolTable.procGroup(), symbolTable);
        }
        for (FunctionDef function : program.functions()) {
            symbolTable.define(symbolTable.funcGroup(),
                    new Symbol(function.name(), Symbol.Category.FUNCTION, symbolTable.funcGroup(), function));
            collectRoutine(function, symbolTable.funcGroup(), symbolTable);
        }

        symbolTable.registerScope(program.main(), symbolTable.main());
        defineVariables(program.main().locals(), symbolTable.main(), symbolTable);
    }

    private void collectRoutine(RoutineDef routine, SymbolTable.Scope group, SymbolTable symbolTable) {
        SymbolTable.Scope local = symbolTable.enterLocal(group, routine.name(), routine);
        defineVariables(routine.parameters(), local, symbolTable);

        Set<String> parameterNames = new HashSet<>();
        routine.parameters().forEach(p -> parameterNames.add(p.name().text()));

        for (VarDecl decl : routine.body().locals()) {
            Identifier name = decl.name();
            if (parameterNames.contains(name.text())) {
                diagnostics.reportError(
                        CompilerErrorCode.NAME_RULE_VIOLATION,
                        "Local variable '" + name.text() + "' shadows a parameter of '" + routine.name().text() + "'",
                        name.line()
                );
                continue;
            }
            symbolTable.define(local, new Symbol(name, Symbol.Category.VARIABLE, local, decl));
        }
    }

    private void defineVariables(List<VarDecl> decls, SymbolTable.Scope scope, SymbolTable symbolTable) {
        for (VarDecl decl : decls) {
            symbolTable.define(scope, new Symbol(decl.name(), Symbol.Category.VARIABLE, scope, decl));
        }
    }

    // --- pass 2: everywhere rule ---

    private void checkNameIdentity(SymbolTable symbolTable) {
        Set<String> variableNames = new HashSet<>();
        for (Symbol symbol : symbolTable.allSymbols()) {
            if (symbol.category() == Symbol.Category.VARIABLE) {
                variableNames.add(symbol.name().text());
            }
        }

        for (Symbol procedure : symbolTable.procGroup().symbols().values()) {
            String name = procedure.name().text();
            if (variableNames.contains(name)) {
                reportClash("Variable name '" + name + "' conflicts with procedure name", procedure);
            }
        }
        for (Symbol function : symbolTable.funcGroup().symbols().values()) {
            String name = function.name().text();
            if (variableNames.contains(name)) {
                reportClash("Variable name '" + name + "' conflicts with function name", function);
            }
            if (symbolTable.resolveProcedure(name).isPresent()) {
                reportClash("Procedure name '" + name + "' conflicts with function name", function);
            }
        }
    }

    private void reportClash(String message, Symbol symbol) {
        diagnostics.reportError(CompilerErrorCode.NAME_RULE_VIOLATION, message, symbol.name().line());
    }

    // --- pass 3: uses ---

    private void resolveUses(ProgramNode program, SymbolTable symbolTable) {
        for (ProcedureDef procedure : program.procedures()) {
            SymbolTable.Scope scope = symbolTable.scopeOf(procedure).orElseThrow();
            resolveAlgorithm(procedure.body().algorithm(), scope, symbolTable);
        }
        for (FunctionDef function : program.functions()) {
            SymbolTable.Scope scope = symbolTable.scopeOf(function).orElseThrow();
            resolveAlgorithm(function.body().algorithm(), scope, symbolTable);
            resolveAtom(function.returnAtom(), scope, symbolTable);
        }
        resolveAlgorithm(program.main().algorithm(), symbolTable.main(), symbolTable);
    }

    private void resolveAlgorithm(Algorithm algorithm, SymbolTable.Scope scope, SymbolTable symbolTable) {
        for (InstructionNode instruction : algorithm.instructions()) {
            resolveInstruction(instruction, scope, symbolTable);
        }
    }

    private void resolveInstruction(InstructionNode instruction, SymbolTable.Scope scope, SymbolTable symbolTable) {
        if (instruction instanceof HaltNode) {
            return;
        }
        if (instruction instanceof PrintNode print) {
            if (print.output() instanceof AtomOutput atomOutput) {
                resolveAtom(atomOutput.atom(), scope, symbolTable);
            } else if (!(print.output() instanceof StringOutput)) {
                throw new IllegalStateException("Unknown output variant: " + print.output());
            }
        } else if (instruction instanceof AssignNode assign) {
            resolveAtom(assign.target(), scope, symbolTable);
            resolveTerm(assign.term(), scope, symbolTable);
        } else if (instruction instanceof ProcedureCallNode call) {
            resolveRoutineName(call, call.name(), Symbol.Category.PROCEDURE, symbolTable);
            call.arguments().forEach(a -> resolveAtom(a, scope, symbolTable));
        } else if (instruction instanceof FunctionCallAssignNode call) {
            resolveAtom(call.target(), scope, symbolTable);
            resolveRoutineName(call, call.name(), Symbol.Category.FUNCTION, symbolTable);
            call.arguments().forEach(a -> resolveAtom(a, scope, symbolTable));
        } else if (instruction instanceof WhileNode loop) {
            resolveTerm(loop.condition(), scope, symbolTable);
            resolveAlgorithm(loop.body(), scope, symbolTable);
        } else if (instruction instanceof DoUntilNode loop) {
            resolveAlgorithm(loop.body(), scope, symbolTable);
            resolveTerm(loop.condition(), scope, symbolTable);
        } else if (instruction instanceof IfNode branch) {
            resolveTerm(branch.condition(), scope, symbolTable);
            resolveAlgorithm(branch.thenBranch(), scope, symbolTable);
        } else if (instruction instanceof IfElseNode branch) {
            resolveTerm(branch.condition(), scope, symbolTable);
            resolveAlgorithm(branch.thenBranch(), scope, symbolTable);
            resolveAlgorithm(branch.elseBranch(), scope, symbolTable);
        } else {
            throw new IllegalStateException("Unknown instruction variant: " + instruction);
        }
    }

    /**
     * Binds a call site to its routine. A name declared in the other routine group is left
     * unbound without an error here; the type checker reports the wrong call kind.
     */
    private void resolveRoutineName(InstructionNode call, Identifier name, Symbol.Category expected, SymbolTable symbolTable) {
        var symbol = expected == Symbol.Category.PROCEDURE
                ? symbolTable.resolveProcedure(name.text())
                : symbolTable.resolveFunction(name.text());
        if (symbol.isPresent()) {
            symbolTable.bind(call, symbol.get());
            return;
        }
        boolean declaredAsOther = expected == Symbol.Category.PROCEDURE
                ? symbolTable.resolveFunction(name.text()).isPresent()
                : symbolTable.resolveProcedure(name.text()).isPresent();
        if (!declaredAsOther) {
            diagnostics.reportError(
                    CompilerErrorCode.UNDECLARED_REFERENCE,
                    "Undeclared " + expected + " '" + name.text() + "'",
                    name.line()
            );
        }
    }

    private void resolveTerm(TermNode term, SymbolTable.Scope scope, SymbolTable symbolTable) {
        if (term instanceof AtomTerm atomTerm) {
            resolveAtom(atomTerm.atom(), scope, symbolTable);
        } else if (term instanceof UnaryTerm unary) {
            resolveTerm(unary.operand(), scope, symbolTable);
        } else if (term instanceof BinaryTerm binary) {
            resolveTerm(binary.left(), scope, symbolTable);
            resolveTerm(binary.right(), scope, symbolTable);
        }
    }

    private void resolveAtom(AtomNode atom, SymbolTable.Scope scope, SymbolTable symbolTable) {
        if (atom instanceof NumberLiteral) {
            return;
        }
        VarRef ref = (VarRef) atom;
        var symbol = symbolTable.resolveVariable(scope, ref.name().text());
        if (symbol.isPresent()) {
            symbolTable.bind(ref, symbol.get());
        } else {
            diagnostics.reportError(
                    CompilerErrorCode.UNDECLARED_REFERENCE,
                    "Undeclared variable '" + ref.name().text() + "'",
                    ref.line()
            );
        }
    }
}
