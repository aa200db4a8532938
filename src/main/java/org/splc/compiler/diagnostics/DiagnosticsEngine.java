package org.splc.compiler.diagnostics;

import org.splc.compiler.api.CompilerErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during the compilation process.
 * <p>
 * This decouples error reporting from the analysis logic: phases report and keep going,
 * the orchestrator decides at phase boundaries whether to stop.
 */
public class DiagnosticsEngine {

    private final String programName;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Creates an engine for one compilation.
     * @param programName The program name attached to every diagnostic.
     */
    public DiagnosticsEngine(String programName) {
        this.programName = programName;
    }

    /**
     * Reports an error.
     *
     * @param code       The error code.
     * @param message    The error message.
     * @param lineNumber The line number of the error.
     */
    public void reportError(CompilerErrorCode code, String message, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, programName, lineNumber));
    }

    /**
     * Reports a warning.
     *
     * @param code       The code classifying the warning.
     * @param message    The warning message.
     * @param lineNumber The line number of the warning.
     */
    public void reportWarning(CompilerErrorCode code, String message, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, programName, lineNumber));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return The number of reported errors.
     */
    public long errorCount() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns the collected errors that carry the given code.
     *
     * @param code The code to filter by.
     * @return The matching errors in report order.
     */
    public List<Diagnostic> errorsWithCode(CompilerErrorCode code) {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR && d.code() == code)
                .toList();
    }

    /**
     * @return The program name attached to the diagnostics.
     */
    public String programName() {
        return programName;
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
