package org.bhavforge.runtime.codec;

/**
 * Thrown when a raw behavior buffer cannot be decoded into instructions.
 * <p>
 * Decoding is all-or-nothing: when this exception is thrown no partial graph exists.
 */
public class DecodeException extends Exception {

    /**
     * Creates a new exception with the given message.
     *
     * @param message description of the malformed input
     */
    public DecodeException(String message) {
        super(message);
    }

    /**
     * Creates a new exception with the given message and cause.
     *
     * @param message description of the malformed input
     * @param cause   the underlying failure
     */
    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
