package org.splc.compiler;

import org.splc.compiler.api.CompilationException;
import org.splc.compiler.api.CompilerErrorCode;
import org.splc.compiler.api.NumberedLine;
import org.splc.compiler.api.ProgramArtifact;
import org.splc.compiler.config.CompilerConfig;
import org.splc.compiler.diagnostics.Diagnostic;
import org.splc.compiler.frontend.ast.ProgramNode;
import org.splc.compiler.ir.IrCall;
import org.splc.compiler.ir.IrCallAssign;
import org.splc.compiler.testutils.IrInterpreter;
import org.splc.junit.extensions.logging.AllowLog;
import org.splc.junit.extensions.logging.LogLevel;
import org.splc.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.splc.compiler.frontend.ast.Ast.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.WARN, loggerPattern = ".*Compiler", messagePattern = "Compilation of .* failed after .*")
public class CompilerTest {

    private static final Pattern JUMP = Pattern.compile("(?:IF .* THEN|GOTO) (\\S+)");

    private final Compiler compiler = new Compiler();

    private static ProgramNode squares() {
        return program(
                decls("i", "s"),
                List.of(),
                List.of(function("sq", decls("n"), decls("r"), var("r"),
                        assign("r", mult(term("n"), term("n"))))),
                main(decls("t"),
                        assign("i", num(0)),
                        assign("s", num(0)),
                        whileLoop(gt(term(3), term("i")),
                                callAssign("t", "sq", var("i")),
                                assign("s", plus(term("s"), term("t"))),
                                assign("i", plus(term("i"), term(1)))),
                        print(var("s")),
                        halt()));
    }

    @Test
    void compilesStraightLineProgram() throws CompilationException {
        // Arrange
        ProgramNode program = program(decls("x"), main(List.of(), assign("x", num(5)), halt()));

        // Act
        ProgramArtifact artifact = compiler.compile(program, "straight.spl");

        // Assert
        assertThat(artifact.render()).isEqualTo("10 x = 5\n20 STOP");
        assertThat(artifact.labelToAddress()).isEmpty();
    }

    @Test
    void ifElseProducesOneConditionalJump() throws CompilationException {
        // Arrange
        ProgramNode program = program(decls("x"), main(List.of(),
                assign("x", num(1)),
                ifElse(gt(term("x"), term(0)), algo(print("pos")), algo(print("neg"))),
                halt()));

        // Act
        ProgramArtifact artifact = compiler.compile(program, "branch.spl");

        // Assert
        List<String> texts = artifact.lines().stream().map(NumberedLine::text).toList();
        assertThat(texts).filteredOn(t -> t.startsWith("IF ")).hasSize(1);
        assertThat(texts).last().isEqualTo("STOP");
        assertThat(IrInterpreter.run(artifact.callFree().items(), Map.of()).output()).containsExactly("pos");
    }

    @Test
    void everyJumpTargetIsANumericAddressOfALabel() throws CompilationException {
        // Act
        ProgramArtifact artifact = compiler.compile(squares(), "squares.spl");

        // Assert
        Set<Integer> addresses = artifact.lines().stream().map(NumberedLine::address).collect(Collectors.toSet());
        List<String> targets = artifact.lines().stream()
                .map(l -> JUMP.matcher(l.text()))
                .filter(Matcher::matches)
                .map(m -> m.group(1))
                .toList();
        assertThat(targets).isNotEmpty().allMatch(t -> t.matches("\\d+"));
        assertThat(targets).allSatisfy(t -> {
            assertThat(addresses).contains(Integer.parseInt(t));
            assertThat(artifact.labelToAddress()).containsValue(Integer.parseInt(t));
        });
    }

    @Test
    void inlinedProgramComputesTheSameResult() throws CompilationException {
        // Act
        ProgramArtifact artifact = compiler.compile(squares(), "squares.spl");

        // Assert
        assertThat(artifact.intermediate().items()).anyMatch(i -> i instanceof IrCallAssign);
        assertThat(artifact.callFree().items()).noneMatch(i -> i instanceof IrCall || i instanceof IrCallAssign);
        IrInterpreter.Trace trace = IrInterpreter.run(artifact.callFree().items(), Map.of());
        assertThat(trace.output()).containsExactly("5");
        assertThat(trace.halted()).isTrue();
    }

    @Test
    void configuredAddressingIsUsed() throws CompilationException {
        // Arrange
        Compiler custom = new Compiler(CompilerConfig.defaults().withAddressing(100, 5));
        ProgramNode program = program(decls("x"), main(List.of(), assign("x", num(5)), print(var("x")), halt()));

        // Act
        ProgramArtifact artifact = custom.compile(program, "custom.spl");

        // Assert
        assertThat(artifact.lines()).extracting(NumberedLine::address).containsExactly(100, 105, 110);
    }

    @Test
    void highStartAddressCompilesWhenEveryAddressFits() throws CompilationException {
        // Arrange
        Compiler custom = new Compiler(CompilerConfig.defaults().withAddressing(Integer.MAX_VALUE - 5, 10));
        ProgramNode program = program(decls("x"), main(List.of(), halt()));

        // Act
        ProgramArtifact artifact = custom.compile(program, "high.spl");

        // Assert
        assertThat(artifact.render()).isEqualTo((Integer.MAX_VALUE - 5) + " STOP");
    }

    @Test
    @AllowLog(level = LogLevel.ERROR, loggerPattern = ".*Compiler", messagePattern = "Internal consistency fault .*")
    void addressOverflowBecomesACompilationError() {
        // Arrange
        Compiler custom = new Compiler(CompilerConfig.defaults().withAddressing(Integer.MAX_VALUE - 5, 10));
        ProgramNode program = program(decls("x"), main(List.of(), assign("x", num(1)), halt()));

        // Act
        CompilationException e = catchThrowableOfType(() -> custom.compile(program, "overflow.spl"), CompilationException.class);

        // Assert
        assertThat(e.errors()).singleElement()
                .extracting(Diagnostic::code).isEqualTo(CompilerErrorCode.INTERNAL_CONSISTENCY_FAULT);
    }

    @Test
    void reusedCompilerIsDeterministic() throws CompilationException {
        // Act
        String first = compiler.compile(squares(), "squares.spl").render();
        String second = compiler.compile(squares(), "squares.spl").render();

        // Assert
        assertThat(second).isEqualTo(first);
    }

    @Test
    void duplicateGlobalStopsBeforeTypeChecking() {
        // Arrange
        ProgramNode program = program(decls("x", "x"), main(List.of(), assign("x", gt(term(1), term(0))), halt()));

        // Act
        CompilationException e = catchThrowableOfType(() -> compiler.compile(program, "dup.spl"), CompilationException.class);

        // Assert
        assertThat(e.errors()).isNotEmpty().extracting(Diagnostic::code).containsOnly(CompilerErrorCode.NAME_RULE_VIOLATION);
    }

    @Test
    void booleanAssignmentIsOneTypeMismatch() {
        // Arrange
        ProgramNode program = program(decls("x"), main(List.of(), assign("x", gt(term(1), term(0))), halt()));

        // Act
        CompilationException e = catchThrowableOfType(() -> compiler.compile(program, "types.spl"), CompilationException.class);

        // Assert
        assertThat(e.errors()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.TYPE_MISMATCH);
    }

    @Test
    void wrongArgumentCountIsOneArityMismatch() {
        // Arrange
        ProgramNode program = program(
                List.of(),
                List.of(procedure("add", decls("a", "b"), List.of(), print(var("a")))),
                List.of(),
                main(List.of(), call("add", num(1)), halt()));

        // Act
        CompilationException e = catchThrowableOfType(() -> compiler.compile(program, "arity.spl"), CompilationException.class);

        // Assert
        assertThat(e.errors()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(CompilerErrorCode.ARITY_MISMATCH);
            assertThat(d.message()).isEqualTo("Procedure 'add' expects 2 argument(s), got 1");
        });
    }

    @Test
    void recursiveFunctionFailsAtInlining() {
        // Arrange
        ProgramNode program = program(
                decls("y"),
                List.of(),
                List.of(function("f", decls("n"), decls("r"), var("r"), callAssign("r", "f", var("n")))),
                main(List.of(), callAssign("y", "f", num(1)), halt()));

        // Act & Assert
        assertThatThrownBy(() -> compiler.compile(program, "rec.spl"))
                .isInstanceOfSatisfying(CompilationException.class, e ->
                        assertThat(e.errors()).extracting(Diagnostic::code).contains(CompilerErrorCode.RECURSIVE_INLINE));
    }
}
