package org.splc.compiler.diagnostics;

/**
 * Thrown by code generation, inlining and linearization when they observe a state
 * that scope resolution or type checking must have rejected. It always indicates a
 * pipeline bug, never a user error.
 */
public class InternalConsistencyException extends IllegalStateException {

    /**
     * @param message A description of the broken invariant.
     */
    public InternalConsistencyException(String message) {
        super(message);
    }
}
