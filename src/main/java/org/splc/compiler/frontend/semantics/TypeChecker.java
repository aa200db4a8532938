package org.splc.compiler.frontend.semantics;

import org.splc.compiler.api.CompilerErrorCode;
import org.splc.compiler.diagnostics.DiagnosticsEngine;
import org.splc.compiler.frontend.ast.Algorithm;
import org.splc.compiler.frontend.ast.AssignNode;
import org.splc.compiler.frontend.ast.AtomNode;
import org.splc.compiler.frontend.ast.AtomOutput;
import org.splc.compiler.frontend.ast.AtomTerm;
import org.splc.compiler.frontend.ast.BinaryOperator;
import org.splc.compiler.frontend.ast.BinaryTerm;
import org.splc.compiler.frontend.ast.DoUntilNode;
import org.splc.compiler.frontend.ast.FunctionCallAssignNode;
import org.splc.compiler.frontend.ast.FunctionDef;
import org.splc.compiler.frontend.ast.HaltNode;
import org.splc.compiler.frontend.ast.Identifier;
import org.splc.compiler.frontend.ast.IfElseNode;
import org.splc.compiler.frontend.ast.IfNode;
import org.splc.compiler.frontend.ast.InstructionNode;
import org.splc.compiler.frontend.ast.PrintNode;
import org.splc.compiler.frontend.ast.ProcedureCallNode;
import org.splc.compiler.frontend.ast.ProcedureDef;
import org.splc.compiler.frontend.ast.ProgramNode;
import org.splc.compiler.frontend.ast.TermNode;
import org.splc.compiler.frontend.ast.UnaryOperator;
import org.splc.compiler.frontend.ast.UnaryTerm;
import org.splc.compiler.frontend.ast.WhileNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Assigns a type to every term and atom and validates the contextual type rules.
 * <p>
 * The checker walks the whole tree and reports every violation it finds. It relies on the
 * bindings of a previous {@link ScopeResolver} run for call sites.
 */
public class TypeChecker {

    private static final Logger LOG = LoggerFactory.getLogger(TypeChecker.class);

    private final DiagnosticsEngine diagnostics;
    private SymbolTable symbolTable;
    private TypeAnnotations annotations;

    /**
     * Constructs a new type checker.
     * @param diagnostics The diagnostics engine for reporting errors.
     */
    public TypeChecker(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Checks the given program.
     * @param program The program to check.
     * @param symbolTable The symbol table produced by scope resolution.
     * @return The computed type annotations.
     */
    public TypeAnnotations check(ProgramNode program, SymbolTable symbolTable) {
        this.symbolTable = symbolTable;
        this.annotations = new TypeAnnotations();
        long errorsBefore = diagnostics.errorCount();

        for (ProcedureDef procedure : program.procedures()) {
            checkAlgorithm(procedure.body().algorithm());
        }
        for (FunctionDef function : program.functions()) {
            checkAlgorithm(function.body().algorithm());
            Type returnType = typeOfAtom(function.returnAtom());
            if (!returnType.satisfies(Type.NUMERIC)) {
                diagnostics.reportError(
                        CompilerErrorCode.INVALID_RETURN_TYPE,
                        "Return value of function '" + function.name().text() + "' must be numeric, got " + returnType,
                        function.returnAtom().line()
                );
            }
        }
        checkAlgorithm(program.main().algorithm());

        LOG.debug("Type check finished: {} annotated nodes, {} new errors",
                annotations.size(), diagnostics.errorCount() - errorsBefore);
        return annotations;
    }

    private void checkAlgorithm(Algorithm algorithm) {
        for (InstructionNode instruction : algorithm.instructions()) {
            checkInstruction(instruction);
        }
    }

    private void checkInstruction(InstructionNode instruction) {
        if (instruction instanceof HaltNode) {
            return;
        }
        if (instruction instanceof PrintNode print) {
            if (print.output() instanceof AtomOutput atomOutput) {
                requireNumeric(typeOfAtom(atomOutput.atom()), "Printed value", atomOutput.line());
            }
        } else if (instruction instanceof AssignNode assign) {
            typeOfAtom(assign.target());
            Type rhs = typeOf(assign.term());
            if (!rhs.satisfies(Type.NUMERIC)) {
                diagnostics.reportError(
                        CompilerErrorCode.TYPE_MISMATCH,
                        "Assignment RHS must be numeric, got " + rhs + " (target '" + assign.target().name().text() + "')",
                        assign.line()
                );
            }
        } else if (instruction instanceof ProcedureCallNode call) {
            checkArguments(call.arguments());
            checkCall(call, call.name(), call.arguments().size(), Symbol.Category.PROCEDURE);
        } else if (instruction instanceof FunctionCallAssignNode call) {
            typeOfAtom(call.target());
            checkArguments(call.arguments());
            checkCall(call, call.name(), call.arguments().size(), Symbol.Category.FUNCTION);
        } else if (instruction instanceof WhileNode loop) {
            checkCondition(loop.condition(), "while");
            checkAlgorithm(loop.body());
        } else if (instruction instanceof DoUntilNode loop) {
            checkAlgorithm(loop.body());
            checkCondition(loop.condition(), "until");
        } else if (instruction instanceof IfNode branch) {
            checkCondition(branch.condition(), "if");
            checkAlgorithm(branch.thenBranch());
        } else if (instruction instanceof IfElseNode branch) {
            checkCondition(branch.condition(), "if");
            checkAlgorithm(branch.thenBranch());
            checkAlgorithm(branch.elseBranch());
        } else {
            throw new IllegalStateException("Unknown instruction variant: " + instruction);
        }
    }

    private void checkArguments(List<AtomNode> arguments) {
        for (AtomNode argument : arguments) {
            requireNumeric(typeOfAtom(argument), "Argument", argument.line());
        }
    }

    private void checkCall(InstructionNode call, Identifier name, int argumentCount, Symbol.Category expected) {
        Optional<Symbol> bound = symbolTable.symbolOf(call);
        if (bound.isEmpty()) {
            reportWrongCallKind(name, expected);
            return;
        }
        Symbol routine = bound.get();
        if (routine.arity() != argumentCount) {
            String kind = expected == Symbol.Category.PROCEDURE ? "Procedure" : "Function";
            diagnostics.reportError(
                    CompilerErrorCode.ARITY_MISMATCH,
                    kind + " '" + name.text() + "' expects " + routine.arity() + " argument(s), got " + argumentCount,
                    name.line()
            );
        }
    }

    /**
     * Reports a call whose name is only declared in the other routine group. Names declared
     * nowhere were already reported during scope resolution.
     */
    private void reportWrongCallKind(Identifier name, Symbol.Category expected) {
        if (expected == Symbol.Category.PROCEDURE && symbolTable.resolveFunction(name.text()).isPresent()) {
            diagnostics.reportError(
                    CompilerErrorCode.WRONG_CALL_KIND,
                    "Function '" + name.text() + "' cannot be called as a procedure",
                    name.line()
            );
        } else if (expected == Symbol.Category.FUNCTION && symbolTable.resolveProcedure(name.text()).isPresent()) {
            diagnostics.reportError(
                    CompilerErrorCode.WRONG_CALL_KIND,
                    "Procedure '" + name.text() + "' does not return a value and cannot be assigned",
                    name.line()
            );
        }
    }

    private void checkCondition(TermNode condition, String construct) {
        Type type = typeOf(condition);
        if (!type.satisfies(Type.BOOLEAN)) {
            diagnostics.reportError(
                    CompilerErrorCode.INVALID_CONDITION_TYPE,
                    "Condition of " + construct + " must be boolean, got " + type,
                    condition.line()
            );
        }
    }

    private void requireNumeric(Type type, String what, int line) {
        if (!type.satisfies(Type.NUMERIC)) {
            diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH, what + " must be numeric, got " + type, line);
        }
    }

    // --- syntax-directed typing ---

    private Type typeOf(TermNode term) {
        Type type;
        if (term instanceof AtomTerm atomTerm) {
            type = typeOfAtom(atomTerm.atom());
        } else if (term instanceof UnaryTerm unary) {
            type = typeOfUnary(unary);
        } else if (term instanceof BinaryTerm binary) {
            type = typeOfBinary(binary);
        } else {
            throw new IllegalStateException("Unknown term variant: " + term);
        }
        annotations.annotate(term, type);
        return type;
    }

    private Type typeOfAtom(AtomNode atom) {
        annotations.annotate(atom, Type.NUMERIC);
        return Type.NUMERIC;
    }

    private Type typeOfUnary(UnaryTerm unary) {
        Type required = unary.operator() == UnaryOperator.NEG ? Type.NUMERIC : Type.BOOLEAN;
        Type operand = typeOf(unary.operand());
        if (!operand.satisfies(required)) {
            diagnostics.reportError(
                    CompilerErrorCode.TYPE_MISMATCH,
                    "Unary operator " + unary.operator().keyword() + " expects " + required + ", got " + operand,
                    unary.line()
            );
        }
        return required;
    }

    private Type typeOfBinary(BinaryTerm binary) {
        BinaryOperator operator = binary.operator();
        Type required = operator.kind() == BinaryOperator.Kind.BOOLEAN ? Type.BOOLEAN : Type.NUMERIC;
        Type result = operator.kind() == BinaryOperator.Kind.ARITHMETIC ? Type.NUMERIC : Type.BOOLEAN;

        Type left = typeOf(binary.left());
        Type right = typeOf(binary.right());
        if (!left.satisfies(required) || !right.satisfies(required)) {
            diagnostics.reportError(
                    CompilerErrorCode.TYPE_MISMATCH,
                    "Binary operator " + operator.keyword() + " expects " + required + " operands, got " + left + " and " + right,
                    binary.line()
            );
        }
        return result;
    }
}
