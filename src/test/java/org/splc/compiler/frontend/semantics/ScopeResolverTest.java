package org.splc.compiler.frontend.semantics;

import org.splc.compiler.api.CompilerErrorCode;
import org.splc.compiler.diagnostics.Diagnostic;
import org.splc.compiler.diagnostics.DiagnosticsEngine;
import org.splc.compiler.frontend.ast.AssignNode;
import org.splc.compiler.frontend.ast.AtomTerm;
import org.splc.compiler.frontend.ast.ProcedureCallNode;
import org.splc.compiler.frontend.ast.ProgramNode;
import org.splc.compiler.frontend.ast.VarRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.splc.compiler.frontend.ast.Ast.*;

@Tag("unit")
public class ScopeResolverTest {

    private DiagnosticsEngine diagnostics;
    private ScopeResolver resolver;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine("test.spl");
        resolver = new ScopeResolver(diagnostics);
    }

    @Test
    void wellFormedProgramHasNoErrors() {
        // Arrange
        ProgramNode program = program(
                decls("g"),
                List.of(procedure("inc", decls("n"), decls("t"),
                        assign("t", plus(term("g"), term("n"))),
                        assign("g", term("t")))),
                List.of(),
                main(decls("x"), assign("x", num(1)), call("inc", var("x")), halt()));

        // Act
        SymbolTable table = resolver.resolve(program);

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(table.global().symbols()).containsOnlyKeys("g");
        assertThat(table.procGroup().symbols()).containsOnlyKeys("inc");
        assertThat(table.main().symbols()).containsOnlyKeys("x");
        SymbolTable.Scope local = table.scopeOf(program.procedures().get(0)).orElseThrow();
        assertThat(local.kind()).isEqualTo(ScopeKind.LOCAL);
        assertThat(local.parent()).contains(table.procGroup());
        assertThat(local.symbols()).containsOnlyKeys("n", "t");
    }

    @Test
    void bindsReferencesToTheInnermostDeclaration() {
        // Arrange
        ProgramNode program = program(
                decls("g", "n"),
                List.of(procedure("p", decls("n"), decls(), assign("g", term("n")))),
                List.of(),
                main(decls(), call("p", var("n"))));

        // Act
        SymbolTable table = resolver.resolve(program);

        // Assert
        AssignNode assign = (AssignNode) program.procedures().get(0).body().algorithm().instructions().get(0);
        VarRef target = assign.target();
        VarRef parameterUse = (VarRef) ((AtomTerm) assign.term()).atom();
        assertThat(table.symbolOf(target).orElseThrow().scope()).isSameAs(table.global());
        assertThat(table.symbolOf(parameterUse).orElseThrow().scope().kind()).isEqualTo(ScopeKind.LOCAL);

        ProcedureCallNode call = (ProcedureCallNode) program.main().algorithm().instructions().get(0);
        assertThat(table.symbolOf(call).orElseThrow().category()).isEqualTo(Symbol.Category.PROCEDURE);
        assertThat(table.symbolOf(call.arguments().get(0)).orElseThrow().scope()).isSameAs(table.global());
    }

    @Test
    void reportsEveryDuplicateGlobal() {
        // Arrange
        ProgramNode program = program(decls("x", "x", "x"), main(decls(), halt()));

        // Act
        resolver.resolve(program);

        // Assert
        assertThat(diagnostics.errorsWithCode(CompilerErrorCode.NAME_RULE_VIOLATION))
                .hasSize(2)
                .allSatisfy(d -> assertThat(d.message()).isEqualTo("Duplicate variable name 'x' in GLOBAL scope"));
    }

    @Test
    void reportsDuplicateParameterAndDuplicateProcedure() {
        // Arrange
        ProgramNode program = program(
                decls(),
                List.of(procedure("p", decls("a", "a"), decls()), procedure("p", decls(), decls())),
                List.of(),
                main(decls()));

        // Act
        resolver.resolve(program);

        // Assert
        assertThat(diagnostics.errorsWithCode(CompilerErrorCode.NAME_RULE_VIOLATION))
                .extracting(Diagnostic::message)
                .containsExactlyInAnyOrder(
                        "Duplicate variable name 'a' in LOCAL(p) scope",
                        "Duplicate procedure name 'p' in PROC_GROUP scope");
    }

    @Test
    void localShadowingParameterIsAnError() {
        // Arrange
        ProgramNode program = program(
                decls(),
                List.of(),
                List.of(function("f", decls("a"), decls("a"), var("a"))),
                main(decls()));

        // Act
        resolver.resolve(program);

        // Assert
        assertThat(diagnostics.errorsWithCode(CompilerErrorCode.NAME_RULE_VIOLATION))
                .singleElement()
                .satisfies(d -> assertThat(d.message()).isEqualTo("Local variable 'a' shadows a parameter of 'f'"));
    }

    @Test
    void enforcesTheEverywhereRule() {
        // Arrange
        ProgramNode program = program(
                decls("p"),
                List.of(procedure("p", decls(), decls()), procedure("q", decls(), decls())),
                List.of(function("q", decls(), decls("f"), num(0)), function("f", decls(), decls(), num(0))),
                main(decls()));

        // Act
        resolver.resolve(program);

        // Assert
        assertThat(diagnostics.errorsWithCode(CompilerErrorCode.NAME_RULE_VIOLATION))
                .extracting(Diagnostic::message)
                .containsExactlyInAnyOrder(
                        "Variable name 'p' conflicts with procedure name",
                        "Procedure name 'q' conflicts with function name",
                        "Variable name 'f' conflicts with function name");
    }

    @Test
    void mainCannotSeeRoutineLocals() {
        // Arrange
        ProgramNode program = program(
                decls(),
                List.of(procedure("p", decls(), decls("secret"))),
                List.of(),
                main(decls(), print(var("secret", 7))));

        // Act
        resolver.resolve(program);

        // Assert
        assertThat(diagnostics.errorsWithCode(CompilerErrorCode.UNDECLARED_REFERENCE))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.message()).isEqualTo("Undeclared variable 'secret'");
                    assertThat(d.lineNumber()).isEqualTo(7);
                });
    }

    @Test
    void keepsGoingAfterUndeclaredReferences() {
        // Arrange
        ProgramNode program = program(
                decls(),
                main(decls(), assign("a", term("b")), call("missing"), callAssign("c", "nothing")));

        // Act
        resolver.resolve(program);

        // Assert
        assertThat(diagnostics.errorsWithCode(CompilerErrorCode.UNDECLARED_REFERENCE))
                .extracting(Diagnostic::message)
                .containsExactly(
                        "Undeclared variable 'a'",
                        "Undeclared variable 'b'",
                        "Undeclared procedure 'missing'",
                        "Undeclared variable 'c'",
                        "Undeclared function 'nothing'");
    }

    @Test
    void callOfRoutineFromTheOtherGroupIsLeftToTheTypeChecker() {
        // Arrange
        ProgramNode program = program(
                decls(),
                List.of(),
                List.of(function("f", decls(), decls(), num(1))),
                main(decls(), call("f")));

        // Act
        SymbolTable table = resolver.resolve(program);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(table.symbolOf(program.main().algorithm().instructions().get(0))).isEmpty();
    }
}
