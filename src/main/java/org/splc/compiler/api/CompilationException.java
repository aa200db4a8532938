package org.splc.compiler.api;

import org.splc.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It carries every diagnostic accumulated by the failing phase, so callers can report
 * the complete list instead of only the first problem.
 */
public class CompilationException extends Exception {

    private final transient List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception from the collected diagnostics.
     * @param diagnostics The diagnostics of the failing phase.
     */
    public CompilationException(List<Diagnostic> diagnostics) {
        this(diagnostics, null);
    }

    /**
     * Constructs a new compilation exception from the collected diagnostics and a cause.
     * @param diagnostics The diagnostics of the failing phase.
     * @param cause The cause.
     */
    public CompilationException(List<Diagnostic> diagnostics, Throwable cause) {
        super(summarize(diagnostics), cause);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics that caused the compilation to fail.
     */
    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    /**
     * @return Only the diagnostics of type {@link Diagnostic.Type#ERROR}.
     */
    public List<Diagnostic> errors() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .toList();
    }

    private static String summarize(List<Diagnostic> diagnostics) {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
