package org.bhavforge.runtime.isa;

/**
 * Storage scope named by the scope byte of a variable reference.
 */
public enum VariableScope {
    GLOBAL(4),
    LITERAL(5),
    LOCAL(6),
    TEMP(7),
    ARGUMENT(8),
    CONSTANT(9),
    /** Any scope code the engine does not model, e.g. object or neighbor attributes. */
    OTHER(-1);

    private final int code;

    VariableScope(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolves a scope byte.
     *
     * @param code the unsigned scope byte
     * @return the matching scope, or {@link #OTHER}
     */
    public static VariableScope fromCode(int code) {
        for (VariableScope scope : values()) {
            if (scope.code == code) {
                return scope;
            }
        }
        return OTHER;
    }

    /**
     * Whether references in this scope must stay within a count declared by the graph.
     *
     * @return true for locals and arguments
     */
    public boolean isBounded() {
        return this == LOCAL || this == ARGUMENT;
    }
}
