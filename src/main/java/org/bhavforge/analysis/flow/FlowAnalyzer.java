package org.bhavforge.analysis.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.bhavforge.analysis.diagnostics.Diagnostic;
import org.bhavforge.analysis.diagnostics.DiagnosticCategory;
import org.bhavforge.runtime.isa.ExitPointer;
import org.bhavforge.runtime.isa.IOpcodeCatalog;
import org.bhavforge.runtime.isa.Instruction;
import org.bhavforge.runtime.isa.OpcodeInfo;
import org.bhavforge.runtime.model.BehaviorGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;

/**
 * Finds dead code, loops and hot spots, and computes complexity metrics for a behavior.
 * <p>
 * Reachability follows both exits of every instruction from position 0. An exit whose target
 * is at or before its source is a back-edge; back-edges sharing a target form one loop spanning
 * from that target to the furthest source. A loop is infinite when no instruction in the span
 * can leave it: true exits always count, false exits only for opcodes that may branch. A loop whose
 * header branches to itself is infinite as well.
 * <p>
 * Analysis is read-only and never throws. Instances are thread-safe.
 */
public class FlowAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FlowAnalyzer.class);

    private final IOpcodeCatalog catalog;
    private final AnalyzerOptions options;

    public FlowAnalyzer(IOpcodeCatalog catalog) {
        this(catalog, AnalyzerOptions.defaults());
    }

    public FlowAnalyzer(IOpcodeCatalog catalog, AnalyzerOptions options) {
        this.catalog = catalog;
        this.options = options;
    }

    public FlowReport analyze(BehaviorGraph graph) {
        int size = graph.size();
        SortedSet<Integer> reachable = reachable(graph);
        List<Integer> deadCode = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            if (!reachable.contains(i)) {
                deadCode.add(i);
            }
        }

        List<LoopInfo> loops = findLoops(graph);
        List<HotSpot> hotSpots = findHotSpots(graph, loops);
        int complexity = cyclomaticComplexity(graph);
        List<Integer> nesting = nestingDepths(graph);
        double coverage = size == 0 ? 1.0 : (double) reachable.size() / size;

        List<Diagnostic> issues = new ArrayList<>();
        reportDeadCode(deadCode, issues);
        for (LoopInfo loop : loops) {
            if (loop.infinite()) {
                String message = loop.latches().contains(loop.header()) && hasExit(graph, loop.header(), loop.end())
                        ? String.format("Instruction %d branches to itself", loop.header())
                        : String.format("Loop %d-%d has no exit", loop.header(), loop.end());
                issues.add(Diagnostic.error(DiagnosticCategory.INFINITE_LOOP, loop.header(), message)
                        .withSuggestion("add a condition that leaves the loop"));
            }
        }
        for (HotSpot hotSpot : hotSpots) {
            issues.add(Diagnostic.warning(DiagnosticCategory.HOT_SPOT, hotSpot.position(),
                    hotSpot.name() + " runs inside loop " + hotSpot.loopId()));
        }
        int maxNesting = 0;
        int maxNestingAt = 0;
        for (int i = 0; i < nesting.size(); i++) {
            if (nesting.get(i) > maxNesting) {
                maxNesting = nesting.get(i);
                maxNestingAt = i;
            }
        }
        if (maxNesting > options.deepNestingThreshold()) {
            issues.add(Diagnostic.info(DiagnosticCategory.DEEP_NESTING, maxNestingAt,
                    "Nesting depth " + maxNesting + " exceeds " + options.deepNestingThreshold()));
        }
        if (complexity > options.complexityThreshold()) {
            issues.add(Diagnostic.info(DiagnosticCategory.COMPLEX_LOGIC, Diagnostic.GRAPH_LEVEL,
                    "Cyclomatic complexity " + complexity + " exceeds " + options.complexityThreshold())
                    .withSuggestion("split the behavior into subroutines"));
        }

        if (!deadCode.isEmpty()) {
            log.warn("Behavior {} has {} unreachable instruction(s): {}", graph.id(), deadCode.size(), deadCode);
        }
        if (loops.stream().anyMatch(LoopInfo::infinite)) {
            log.warn("Behavior {} contains an infinite loop", graph.id());
        }
        log.debug("Analyzed behavior {}: complexity {}, {} loop(s), coverage {}", graph.id(), complexity,
                loops.size(), coverage);
        return new FlowReport(graph.id(), size, reachable, deadCode, loops, hotSpots, complexity, nesting, coverage,
                issues);
    }

    /**
     * Positions reachable from instruction 0 over both exits, plus fall-through if enabled.
     *
     * @param graph the behavior
     * @return reachable positions
     */
    public SortedSet<Integer> reachable(BehaviorGraph graph) {
        SortedSet<Integer> seen = new TreeSet<>();
        if (graph.isEmpty()) {
            return seen;
        }
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(0);
        seen.add(0);
        while (!queue.isEmpty()) {
            int pos = queue.dequeueInt();
            Instruction instruction = graph.get(pos);
            int[] next = options.followFallthrough()
                    ? new int[] {instruction.trueExit(), instruction.falseExit(), pos + 1}
                    : new int[] {instruction.trueExit(), instruction.falseExit()};
            for (int target : next) {
                if (graph.isValidTarget(target) && seen.add(target)) {
                    queue.enqueue(target);
                }
            }
        }
        return seen;
    }

    /**
     * Groups back-edges by header.
     *
     * @param graph the behavior
     * @return loops in header order
     */
    public List<LoopInfo> findLoops(BehaviorGraph graph) {
        Map<Integer, TreeSet<Integer>> latchesByHeader = new TreeMap<>();
        for (Instruction instruction : graph.instructions()) {
            for (int target : new int[] {instruction.trueExit(), instruction.falseExit()}) {
                if (graph.isValidTarget(target) && target <= instruction.position()) {
                    latchesByHeader.computeIfAbsent(target, h -> new TreeSet<>()).add(instruction.position());
                }
            }
        }

        List<int[]> spans = new ArrayList<>();
        latchesByHeader.forEach((header, latches) -> spans.add(new int[] {header, latches.last()}));

        List<LoopInfo> loops = new ArrayList<>();
        int id = 0;
        for (Map.Entry<Integer, TreeSet<Integer>> entry : latchesByHeader.entrySet()) {
            int header = entry.getKey();
            int end = entry.getValue().last();
            int nesting = 0;
            for (int[] other : spans) {
                boolean encloses = other[0] <= header && other[1] >= end && (other[0] != header || other[1] != end);
                if (encloses) {
                    nesting++;
                }
            }
            // A header that is its own latch is a self-branch.
            boolean infinite = entry.getValue().contains(header) || !hasExit(graph, header, end);
            loops.add(new LoopInfo(id++, header, end, new ArrayList<>(entry.getValue()),
                    infinite, containsCall(graph, header, end), nesting));
        }
        return loops;
    }

    private boolean hasExit(BehaviorGraph graph, int header, int end) {
        for (int pos = header; pos <= end; pos++) {
            Instruction instruction = graph.get(pos);
            if (leavesSpan(instruction.trueExit(), header, end)) {
                return true;
            }
            boolean mayBranch = catalog.lookup(instruction.opcode()).mayBranch();
            if (mayBranch && leavesSpan(instruction.falseExit(), header, end)) {
                return true;
            }
        }
        return false;
    }

    private static boolean leavesSpan(int pointer, int header, int end) {
        return ExitPointer.isSentinel(pointer) || pointer < header || pointer > end;
    }

    private boolean containsCall(BehaviorGraph graph, int header, int end) {
        for (int pos = header; pos <= end; pos++) {
            if (catalog.isCallOpcode(graph.get(pos).opcode())) {
                return true;
            }
        }
        return false;
    }

    private List<HotSpot> findHotSpots(BehaviorGraph graph, List<LoopInfo> loops) {
        List<HotSpot> hotSpots = new ArrayList<>();
        if (options.expensiveOpcodes().isEmpty() || loops.isEmpty()) {
            return hotSpots;
        }
        for (Instruction instruction : graph.instructions()) {
            if (!options.expensiveOpcodes().contains(instruction.opcode())) {
                continue;
            }
            LoopInfo innermost = null;
            for (LoopInfo loop : loops) {
                if (loop.contains(instruction.position())
                        && (innermost == null || loop.length() < innermost.length())) {
                    innermost = loop;
                }
            }
            if (innermost != null) {
                OpcodeInfo info = catalog.lookup(instruction.opcode());
                hotSpots.add(new HotSpot(instruction.position(), instruction.opcode(), info.name(), innermost.id()));
            }
        }
        return hotSpots;
    }

    /**
     * Number of instructions whose exits differ, plus one.
     *
     * @param graph the behavior
     * @return the complexity, 1 for a behavior without branches
     */
    public int cyclomaticComplexity(BehaviorGraph graph) {
        int branches = 0;
        for (Instruction instruction : graph.instructions()) {
            if (instruction.trueExit() != instruction.falseExit()) {
                branches++;
            }
        }
        return branches + 1;
    }

    /**
     * Nesting depth of every position: the number of forward exits of earlier instructions
     * that jump past it. An instruction with identical exits contributes once.
     *
     * @param graph the behavior
     * @return depths indexed by position
     */
    public List<Integer> nestingDepths(BehaviorGraph graph) {
        int size = graph.size();
        int[] depth = new int[size];
        for (Instruction instruction : graph.instructions()) {
            int source = instruction.position();
            addSpan(depth, source, instruction.trueExit(), size);
            if (instruction.falseExit() != instruction.trueExit()) {
                addSpan(depth, source, instruction.falseExit(), size);
            }
        }
        List<Integer> result = new ArrayList<>(size);
        for (int d : depth) {
            result.add(d);
        }
        return result;
    }

    private static void addSpan(int[] depth, int source, int target, int size) {
        if (ExitPointer.isSentinel(target) || target <= source) {
            return;
        }
        int last = Math.min(target - 1, size - 1);
        for (int p = source + 1; p <= last; p++) {
            depth[p]++;
        }
    }

    private static void reportDeadCode(List<Integer> deadCode, List<Diagnostic> issues) {
        int i = 0;
        while (i < deadCode.size()) {
            int start = deadCode.get(i);
            int end = start;
            while (i + 1 < deadCode.size() && deadCode.get(i + 1) == end + 1) {
                end = deadCode.get(++i);
            }
            String range = start == end ? "Instruction " + start + " is" : "Instructions " + start + "-" + end + " are";
            issues.add(Diagnostic.warning(DiagnosticCategory.DEAD_CODE, start, range + " unreachable")
                    .withSuggestion("remove the instructions or route a branch to them"));
            i++;
        }
    }
}
