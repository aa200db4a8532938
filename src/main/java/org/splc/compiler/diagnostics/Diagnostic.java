package org.splc.compiler.diagnostics;

import org.splc.compiler.api.CompilerErrorCode;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs during the compilation process.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code classifying the diagnostic.
 * @param message The diagnostic message.
 * @param programName The name of the program in which the issue occurred.
 * @param lineNumber The line number of the issue, or -1 if unknown.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        String programName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s: %s", type, programName, lineNumber, code, message);
    }
}
