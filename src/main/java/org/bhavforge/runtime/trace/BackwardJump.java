package org.bhavforge.runtime.trace;

/**
 * A taken exit whose target is at or before its source.
 *
 * @param graphId behavior id
 * @param from    source position
 * @param to      target position
 */
public record BackwardJump(int graphId, int from, int to) {
}
