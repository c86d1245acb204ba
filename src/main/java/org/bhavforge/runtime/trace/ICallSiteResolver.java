package org.bhavforge.runtime.trace;

import java.util.OptionalInt;

/**
 * Tells the tracer which instructions call another behavior synchronously.
 */
@FunctionalInterface
public interface ICallSiteResolver {

    /** Resolver that reports no call sites, making every call opaque. */
    ICallSiteResolver NONE = (graphId, position) -> OptionalInt.empty();

    /**
     * Returns the behavior called as a subroutine at a position.
     *
     * @param graphId  calling behavior
     * @param position instruction index
     * @return the callee id, or empty if the instruction is not a subroutine call
     */
    OptionalInt subroutineTarget(int graphId, int position);
}
