package org.splc.compiler.api;

import org.splc.compiler.frontend.ast.ProgramNode;

/**
 * Defines the public interface of the SPL compiler back end.
 */
public interface ICompiler {

    /**
     * Compiles a parsed program into its final numbered form.
     *
     * @param program The AST produced by the parser.
     * @param programName A name for the program, used in diagnostics and artifact metadata.
     * @return A {@link ProgramArtifact} containing the numbered program and its intermediate forms.
     * @throws CompilationException if any phase reports errors.
     */
    ProgramArtifact compile(ProgramNode program, String programName) throws CompilationException;
}
