package org.bhavforge.analysis.callgraph;

import java.util.Map;

import org.bhavforge.runtime.model.BehaviorScope;

/**
 * Headline statistics of a {@link CallGraph}.
 *
 * @param behaviors   behaviors in the package
 * @param edges       aggregated call edges
 * @param callSites   individual call instructions
 * @param roots       behaviors without callers
 * @param leaves      behaviors without callees
 * @param unused      behaviors without callers that are not entry points
 * @param external    called ids missing from the package
 * @param cycles      recursion cycles
 * @param scopeCounts behaviors per scope
 */
public record CallGraphSummary(int behaviors, int edges, int callSites, int roots, int leaves, int unused,
                               int external, int cycles, Map<BehaviorScope, Integer> scopeCounts) {

    public CallGraphSummary {
        scopeCounts = Map.copyOf(scopeCounts);
    }
}
