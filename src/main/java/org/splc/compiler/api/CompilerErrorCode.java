package org.splc.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the wording of the error messages.
 */
public enum CompilerErrorCode {
    // region Scope Resolution Errors
    /** Duplicate declaration, a local shadowing a parameter, or a cross-category name clash. */
    NAME_RULE_VIOLATION,
    /** A variable, procedure or function is used but not declared. */
    UNDECLARED_REFERENCE,
    // endregion

    // region Type Checking Errors
    /** Operand, assignment or argument type disagreement. */
    TYPE_MISMATCH,
    /** An if/while/until condition that is not boolean. */
    INVALID_CONDITION_TYPE,
    /** A function return atom that is not numeric. */
    INVALID_RETURN_TYPE,
    /** The number of arguments differs from the number of declared parameters. */
    ARITY_MISMATCH,
    /** A function called as a statement, or a procedure used on the right side of an assignment. */
    WRONG_CALL_KIND,
    // endregion

    // region Inlining Errors
    /** A call names a routine that has no definition. */
    UNKNOWN_ROUTINE,
    /** A call that would expand a routine inside its own expansion. */
    RECURSIVE_INLINE,
    // endregion

    // region Linker Errors
    /** A jump references a label that was never placed. */
    LABEL_NOT_FOUND,
    // endregion

    // region General Errors
    /** A later stage observed a state an earlier stage must have prevented. */
    INTERNAL_CONSISTENCY_FAULT
    // endregion
}
