package org.splc.compiler.api;

import org.splc.compiler.ir.IrProgram;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Represents the complete output of one compilation. This is an immutable data carrier.
 *
 * @param programName The name of the compiled program.
 * @param lines The final program as (address, instruction) pairs in stream order.
 * @param labelToAddress The resolved label table.
 * @param intermediate The instruction stream before inlining (may contain calls).
 * @param callFree The instruction stream after inlining, before addressing.
 */
public record ProgramArtifact(
        String programName,
        List<NumberedLine> lines,
        Map<String, Integer> labelToAddress,
        IrProgram intermediate,
        IrProgram callFree
) {
    public ProgramArtifact {
        lines = List.copyOf(lines);
        labelToAddress = Collections.unmodifiableMap(labelToAddress);
    }

    /**
     * Renders the program in its external text form, one {@code <address> <instruction>} per line.
     * @return The program text.
     */
    public String render() {
        return lines.stream()
                .map(NumberedLine::toString)
                .collect(Collectors.joining("\n"));
    }
}
