package org.bhavforge.analysis.callgraph;

/**
 * A behavior with the number of distinct behaviors calling it, or called by it.
 *
 * @param behaviorId behavior id
 * @param count      number of distinct neighbors
 */
public record CallCount(int behaviorId, int count) {
}
