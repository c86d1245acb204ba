package org.bhavforge.analysis.flow;

/**
 * An expensive primitive executed inside a loop.
 *
 * @param position instruction index
 * @param opcode   the opcode
 * @param name     opcode display name
 * @param loopId   innermost enclosing loop
 */
public record HotSpot(int position, int opcode, String name, int loopId) {
}
