package org.bhavforge.runtime.isa;

/**
 * Constants and helpers for instruction successor pointers.
 *
 * <p>A successor pointer is a single unsigned byte. Values below {@link #ERROR} index an
 * instruction in the owning graph; the three highest values are terminal sentinels that
 * are never dereferenced and never remapped.
 *
 * <p>This class is thread-safe as it contains only static methods and immutable constants.
 */
public final class ExitPointer {

    /** Terminal exit: the behavior fails with an error. */
    public static final int ERROR = 253;

    /** Terminal exit: the behavior returns true to its caller. */
    public static final int RETURN_TRUE = 254;

    /** Terminal exit: the behavior returns false to its caller. */
    public static final int RETURN_FALSE = 255;

    /** Largest value a pointer byte may hold. */
    public static final int MAX_VALUE = 255;

    private ExitPointer() {
        // Utility class - prevent instantiation
    }

    /**
     * Checks whether a pointer is one of the terminal sentinels.
     *
     * @param pointer the pointer value (0-255)
     * @return true for {@link #ERROR}, {@link #RETURN_TRUE} and {@link #RETURN_FALSE}
     */
    public static boolean isSentinel(int pointer) {
        return pointer == ERROR || pointer == RETURN_TRUE || pointer == RETURN_FALSE;
    }

    /**
     * Checks whether a pointer addresses an existing instruction of a graph.
     *
     * @param pointer the pointer value
     * @param instructionCount the number of instructions in the graph
     * @return true if the pointer is not a sentinel and lies in {@code [0, instructionCount)}
     */
    public static boolean isInBounds(int pointer, int instructionCount) {
        return !isSentinel(pointer) && pointer >= 0 && pointer < instructionCount;
    }

    /**
     * Checks that a value fits in a pointer byte.
     *
     * @param pointer the value to check
     * @return true if the value is in {@code [0, 255]}
     */
    public static boolean isEncodable(int pointer) {
        return pointer >= 0 && pointer <= MAX_VALUE;
    }

    /**
     * Renders a pointer for listings and logs.
     *
     * @param pointer the pointer value
     * @return {@code "ERROR"}, {@code "TRUE"}, {@code "FALSE"} or the decimal index
     */
    public static String describe(int pointer) {
        return switch (pointer) {
            case ERROR -> "ERROR";
            case RETURN_TRUE -> "TRUE";
            case RETURN_FALSE -> "FALSE";
            default -> Integer.toString(pointer);
        };
    }
}
