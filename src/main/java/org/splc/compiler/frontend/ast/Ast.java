package org.splc.compiler.frontend.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Static factories for building ASTs without a parser, e.g. from a parser adapter or a test.
 * <p>
 * Factories that take no line number place the node on line 1.
 */
public final class Ast {

    private static final int DEFAULT_LINE = 1;

    private Ast() {
        // Static factories only
    }

    // --- program structure ---

    public static ProgramNode program(List<VarDecl> globals, List<ProcedureDef> procedures,
                                      List<FunctionDef> functions, MainNode main) {
        return new ProgramNode(globals, procedures, functions, main);
    }

    /**
     * Builds a program without procedures and functions.
     */
    public static ProgramNode program(List<VarDecl> globals, MainNode main) {
        return new ProgramNode(globals, List.of(), List.of(), main);
    }

    public static List<VarDecl> decls(String... names) {
        return Arrays.stream(names).map(n -> new VarDecl(new Identifier(n, DEFAULT_LINE))).toList();
    }

    public static VarDecl decl(String name, int line) {
        return new VarDecl(new Identifier(name, line));
    }

    public static ProcedureDef procedure(String name, List<VarDecl> parameters, List<VarDecl> locals,
                                         InstructionNode... body) {
        return new ProcedureDef(new Identifier(name, DEFAULT_LINE), parameters, new BodyNode(locals, algo(body)));
    }

    public static FunctionDef function(String name, List<VarDecl> parameters, List<VarDecl> locals,
                                       AtomNode returnAtom, InstructionNode... body) {
        return new FunctionDef(new Identifier(name, DEFAULT_LINE), parameters, new BodyNode(locals, algo(body)), returnAtom);
    }

    public static MainNode main(List<VarDecl> locals, InstructionNode... body) {
        return new MainNode(locals, algo(body));
    }

    public static Algorithm algo(InstructionNode... instructions) {
        return new Algorithm(List.of(instructions));
    }

    // --- instructions ---

    public static HaltNode halt() {
        return new HaltNode(DEFAULT_LINE);
    }

    public static PrintNode print(AtomNode atom) {
        return new PrintNode(new AtomOutput(atom));
    }

    public static PrintNode print(String text) {
        return new PrintNode(new StringOutput(text, DEFAULT_LINE));
    }

    public static ProcedureCallNode call(String procedure, AtomNode... arguments) {
        return new ProcedureCallNode(new Identifier(procedure, DEFAULT_LINE), List.of(arguments));
    }

    public static FunctionCallAssignNode callAssign(String target, String function, AtomNode... arguments) {
        return new FunctionCallAssignNode(var(target), new Identifier(function, DEFAULT_LINE), List.of(arguments));
    }

    public static AssignNode assign(String target, TermNode term) {
        return new AssignNode(var(target), term);
    }

    public static AssignNode assign(String target, AtomNode atom) {
        return new AssignNode(var(target), new AtomTerm(atom));
    }

    public static WhileNode whileLoop(TermNode condition, InstructionNode... body) {
        return new WhileNode(condition, algo(body), DEFAULT_LINE);
    }

    public static DoUntilNode doUntil(Algorithm body, TermNode condition) {
        return new DoUntilNode(body, condition, DEFAULT_LINE);
    }

    public static IfNode ifThen(TermNode condition, InstructionNode... thenBranch) {
        return new IfNode(condition, algo(thenBranch), DEFAULT_LINE);
    }

    public static IfElseNode ifElse(TermNode condition, Algorithm thenBranch, Algorithm elseBranch) {
        return new IfElseNode(condition, thenBranch, elseBranch, DEFAULT_LINE);
    }

    // --- atoms and terms ---

    public static VarRef var(String name) {
        return new VarRef(new Identifier(name, DEFAULT_LINE));
    }

    public static VarRef var(String name, int line) {
        return new VarRef(new Identifier(name, line));
    }

    public static NumberLiteral num(long value) {
        return new NumberLiteral(value, DEFAULT_LINE);
    }

    public static AtomTerm term(AtomNode atom) {
        return new AtomTerm(atom);
    }

    public static AtomTerm term(String variable) {
        return new AtomTerm(var(variable));
    }

    public static AtomTerm term(long value) {
        return new AtomTerm(num(value));
    }

    public static UnaryTerm neg(TermNode operand) {
        return new UnaryTerm(UnaryOperator.NEG, operand);
    }

    public static UnaryTerm not(TermNode operand) {
        return new UnaryTerm(UnaryOperator.NOT, operand);
    }

    public static BinaryTerm binary(TermNode left, BinaryOperator operator, TermNode right) {
        return new BinaryTerm(left, operator, right);
    }

    public static BinaryTerm plus(TermNode left, TermNode right) {
        return binary(left, BinaryOperator.PLUS, right);
    }

    public static BinaryTerm minus(TermNode left, TermNode right) {
        return binary(left, BinaryOperator.MINUS, right);
    }

    public static BinaryTerm mult(TermNode left, TermNode right) {
        return binary(left, BinaryOperator.MULT, right);
    }

    public static BinaryTerm div(TermNode left, TermNode right) {
        return binary(left, BinaryOperator.DIV, right);
    }

    public static BinaryTerm eq(TermNode left, TermNode right) {
        return binary(left, BinaryOperator.EQ, right);
    }

    public static BinaryTerm gt(TermNode left, TermNode right) {
        return binary(left, BinaryOperator.GT, right);
    }

    public static BinaryTerm and(TermNode left, TermNode right) {
        return binary(left, BinaryOperator.AND, right);
    }

    public static BinaryTerm or(TermNode left, TermNode right) {
        return binary(left, BinaryOperator.OR, right);
    }
}
