package org.splc.compiler.frontend.semantics;

/**
 * Types of SPL expressions. Only {@link #NUMERIC} values are ever stored; {@link #BOOLEAN}
 * exists transiently while a condition is evaluated.
 */
public enum Type {
    NUMERIC("numeric"),
    BOOLEAN("boolean");

    private final String displayName;

    Type(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @param required The type a context requires.
     * @return {@code true} if a value of this type is acceptable where {@code required} is expected.
     */
    public boolean satisfies(Type required) {
        return this == required;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
