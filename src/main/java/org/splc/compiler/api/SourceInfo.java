package org.splc.compiler.api;

/**
 * A pure data class representing the origin of a compiled element in the source program.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param programName The name of the compiled program.
 * @param lineNumber The line number, or -1 if unknown.
 * @param construct A short description of the originating SPL construct (e.g. {@code while}).
 */
public record SourceInfo(String programName, int lineNumber, String construct) {

    /**
     * @return A source info for elements without a known origin.
     */
    public static SourceInfo unknown() {
        return new SourceInfo("unknown", -1, "");
    }

    @Override
    public String toString() {
        return programName + ":" + lineNumber + (construct.isEmpty() ? "" : " (" + construct + ")");
    }
}
