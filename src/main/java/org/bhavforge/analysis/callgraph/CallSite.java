package org.bhavforge.analysis.callgraph;

import org.bhavforge.runtime.isa.CallKind;

/**
 * One call instruction.
 *
 * @param callerId behavior containing the instruction
 * @param position instruction index
 * @param calleeId called behavior
 * @param kind     kind of control transfer
 */
public record CallSite(int callerId, int position, int calleeId, CallKind kind) {
}
