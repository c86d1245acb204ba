package org.bhavforge.runtime.trace;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Result of statically tracing a behavior.
 *
 * @param graphId       entry behavior
 * @param steps         all steps in exploration order; path 0 first
 * @param terminal      overall classification: the primary path's outcome, or
 *                      {@link TerminalState#EXCEEDED_STEP_BUDGET} if a budget ran out
 * @param outcomes      every outcome reached by some explored path
 * @param visited       visited positions per behavior id
 * @param backwardJumps distinct taken exits that target the same or an earlier position
 * @param unreachable   positions of the entry behavior no explored path visited
 * @param pathCount     number of explored paths
 */
public record ExecutionTrace(int graphId, List<ExecutionStep> steps, TerminalState terminal,
                             Set<TerminalState> outcomes, Map<Integer, SortedSet<Integer>> visited,
                             List<BackwardJump> backwardJumps, List<Integer> unreachable, int pathCount) {

    public ExecutionTrace {
        steps = List.copyOf(steps);
        outcomes = outcomes.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(TerminalState.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(outcomes));
        TreeMap<Integer, SortedSet<Integer>> copy = new TreeMap<>();
        visited.forEach((id, positions) -> copy.put(id, Collections.unmodifiableSortedSet(new TreeSet<>(positions))));
        visited = Collections.unmodifiableMap(copy);
        backwardJumps = List.copyOf(backwardJumps);
        unreachable = List.copyOf(unreachable);
    }

    public int stepCount() {
        return steps.size();
    }

    public boolean exceededBudget() {
        return terminal == TerminalState.EXCEEDED_STEP_BUDGET;
    }

    /**
     * Positions visited in one behavior.
     *
     * @param id behavior id
     * @return the positions, empty if the behavior was never entered
     */
    public SortedSet<Integer> visitedPositions(int id) {
        return visited.getOrDefault(id, Collections.emptySortedSet());
    }

    /**
     * Steps of the primary (true-first) path.
     *
     * @return steps with path index 0
     */
    public List<ExecutionStep> primaryPath() {
        return steps.stream().filter(s -> s.pathIndex() == 0).toList();
    }

    public String formatSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Trace of behavior 0x%04X: %s%n", graphId, terminal));
        sb.append(String.format("  steps: %d, paths: %d, outcomes: %s%n", steps.size(), pathCount, outcomes));
        sb.append(String.format("  visited: %s%n", visitedPositions(graphId)));
        if (!backwardJumps.isEmpty()) {
            sb.append("  backward jumps:");
            for (BackwardJump jump : backwardJumps) {
                sb.append(String.format(" 0x%04X:%d->%d", jump.graphId(), jump.from(), jump.to()));
            }
            sb.append(System.lineSeparator());
        }
        if (!unreachable.isEmpty()) {
            sb.append(String.format("  unreachable: %s%n", unreachable));
        }
        return sb.toString();
    }

    public String formatSteps() {
        StringBuilder sb = new StringBuilder();
        for (ExecutionStep step : steps) {
            sb.append(step.format()).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
