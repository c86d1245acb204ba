package org.bhavforge.analysis.flow;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import org.bhavforge.analysis.diagnostics.Diagnostic;

/**
 * Result of {@link FlowAnalyzer#analyze}.
 *
 * @param graphId              analyzed behavior
 * @param instructionCount     number of instructions
 * @param reachable            positions reachable from instruction 0
 * @param deadCode             positions not reachable, ascending
 * @param loops                loops in header order
 * @param hotSpots             expensive primitives inside loops
 * @param cyclomaticComplexity branching instructions plus one
 * @param nestingDepths        nesting depth per position
 * @param coverage             reachable / total, 1.0 for an empty behavior
 * @param issues               findings derived from the metrics
 */
public record FlowReport(int graphId, int instructionCount, SortedSet<Integer> reachable, List<Integer> deadCode,
                         List<LoopInfo> loops, List<HotSpot> hotSpots, int cyclomaticComplexity,
                         List<Integer> nestingDepths, double coverage, List<Diagnostic> issues) {

    public FlowReport {
        reachable = Collections.unmodifiableSortedSet(new TreeSet<>(reachable));
        deadCode = List.copyOf(deadCode);
        loops = List.copyOf(loops);
        hotSpots = List.copyOf(hotSpots);
        nestingDepths = List.copyOf(nestingDepths);
        issues = List.copyOf(issues);
    }

    public int maxNestingDepth() {
        return nestingDepths.stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    public double averageNestingDepth() {
        return nestingDepths.stream().mapToInt(Integer::intValue).average().orElse(0.0);
    }

    public boolean hasInfiniteLoop() {
        return loops.stream().anyMatch(LoopInfo::infinite);
    }

    public String formatText() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Flow analysis of behavior 0x%04X%n", graphId));
        sb.append(String.format("  instructions: %d, reachable: %d, coverage: %.1f%%%n",
                instructionCount, reachable.size(), coverage * 100.0));
        sb.append(String.format("  cyclomatic complexity: %d%n", cyclomaticComplexity));
        sb.append(String.format("  nesting depth: max %d, avg %.2f%n", maxNestingDepth(), averageNestingDepth()));
        if (!deadCode.isEmpty()) {
            sb.append(String.format("  dead code: %s%n", deadCode));
        }
        for (LoopInfo loop : loops) {
            sb.append(String.format("  loop %d: %d-%d%s%s (nesting %d)%n", loop.id(), loop.header(), loop.end(),
                    loop.infinite() ? " INFINITE" : "", loop.containsCalls() ? " calls" : "", loop.nestingDepth()));
        }
        for (HotSpot hotSpot : hotSpots) {
            sb.append(String.format("  hot spot: #%d %s in loop %d%n", hotSpot.position(), hotSpot.name(),
                    hotSpot.loopId()));
        }
        for (Diagnostic issue : issues) {
            sb.append("  ").append(issue.format()).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
