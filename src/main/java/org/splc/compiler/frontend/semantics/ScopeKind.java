package org.splc.compiler.frontend.semantics;

/**
 * The kinds of scopes an SPL program is divided into.
 */
public enum ScopeKind {
    /** Program-wide root, only used for the name identity rule. */
    EVERYWHERE,
    /** Global variables. */
    GLOBAL,
    /** Names of all procedures; siblings must be unique. */
    PROC_GROUP,
    /** Names of all functions; siblings must be unique. */
    FUNC_GROUP,
    /** Variables declared by main. */
    MAIN,
    /** Parameters and locals of one procedure or function. */
    LOCAL
}
