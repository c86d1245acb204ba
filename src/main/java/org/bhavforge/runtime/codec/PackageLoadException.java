package org.bhavforge.runtime.codec;

/**
 * Thrown when a behavior package cannot be read from disk.
 */
public class PackageLoadException extends RuntimeException {

    /**
     * Creates a new exception with the given message.
     *
     * @param message description naming the offending file
     */
    public PackageLoadException(String message) {
        super(message);
    }

    /**
     * Creates a new exception with the given message and cause.
     *
     * @param message description naming the offending file
     * @param cause   the underlying failure
     */
    public PackageLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
