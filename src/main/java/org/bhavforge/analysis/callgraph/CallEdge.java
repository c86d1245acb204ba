package org.bhavforge.analysis.callgraph;

import java.util.List;

import org.bhavforge.runtime.isa.CallKind;

/**
 * All calls of one kind from one behavior to another.
 *
 * @param callerId  calling behavior
 * @param calleeId  called behavior
 * @param kind      kind of control transfer
 * @param positions instruction indices of the call sites in the caller, ascending
 */
public record CallEdge(int callerId, int calleeId, CallKind kind, List<Integer> positions) {

    public CallEdge {
        positions = List.copyOf(positions);
    }

    public int callCount() {
        return positions.size();
    }
}
