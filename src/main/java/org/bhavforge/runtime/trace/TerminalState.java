package org.bhavforge.runtime.trace;

import org.bhavforge.runtime.isa.ExitPointer;

/**
 * How a traced path, or the whole trace, ended.
 */
public enum TerminalState {
    RETURN_TRUE,
    RETURN_FALSE,
    ERROR,
    /** The step, visit or call-depth budget ran out before the trace terminated. */
    EXCEEDED_STEP_BUDGET;

    /**
     * Maps a sentinel exit to its terminal state.
     *
     * @param sentinel one of the {@link ExitPointer} sentinels
     * @return the matching state
     * @throws IllegalArgumentException if the pointer is not a sentinel
     */
    public static TerminalState fromSentinel(int sentinel) {
        return switch (sentinel) {
            case ExitPointer.RETURN_TRUE -> RETURN_TRUE;
            case ExitPointer.RETURN_FALSE -> RETURN_FALSE;
            case ExitPointer.ERROR -> ERROR;
            default -> throw new IllegalArgumentException("Not a sentinel exit: " + sentinel);
        };
    }
}
