package org.bhavforge.analysis.flow;

import java.util.List;

/**
 * A loop found from back-edges sharing one header.
 *
 * @param id            sequential id in header order
 * @param header        target of the back-edges, the loop's first position
 * @param end           highest back-edge source, the loop's last position
 * @param latches       sources of the back-edges, ascending
 * @param infinite      the header branches to itself, or no instruction in the span has an exit leaving it
 * @param containsCalls the span contains a call instruction
 * @param nestingDepth  number of other loops whose span strictly encloses this one
 */
public record LoopInfo(int id, int header, int end, List<Integer> latches, boolean infinite, boolean containsCalls,
                       int nestingDepth) {

    public LoopInfo {
        latches = List.copyOf(latches);
    }

    public boolean contains(int position) {
        return position >= header && position <= end;
    }

    public int length() {
        return end - header + 1;
    }
}
