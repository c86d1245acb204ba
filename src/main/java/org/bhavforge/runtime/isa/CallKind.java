package org.bhavforge.runtime.isa;

/**
 * How a call instruction transfers control to another behavior.
 */
public enum CallKind {
    /** Direct synchronous call; the caller continues on the callee's true or false return. */
    SUBROUTINE,
    /** A behavior registered to run later, e.g. when a created object finishes initializing. */
    CALLBACK,
    /** A behavior queued as an interaction on some actor. */
    INTERACTION,
    /** A behavior selected by the autonomy system. */
    AUTONOMOUS
}
