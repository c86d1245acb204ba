package org.bhavforge.runtime.trace;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.bhavforge.runtime.isa.ExitPointer;
import org.bhavforge.runtime.isa.IOpcodeCatalog;
import org.bhavforge.runtime.isa.Instruction;
import org.bhavforge.runtime.isa.OpcodeInfo;
import org.bhavforge.runtime.model.BehaviorGraph;
import org.bhavforge.runtime.model.BehaviorPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Explores every path of a behavior without executing any primitive.
 * <p>
 * The primary path always takes the true exit. Wherever an instruction may branch (its opcode
 * is conditional or unknown) and its exits differ, the false exit is queued as a separate path,
 * at most once per call stack and target. With a package and a call-site resolver, subroutine
 * calls are followed into the callee and resume at the caller's true or false exit when the
 * callee returns; calls to behaviors outside the package are treated as opaque primitives.
 * <p>
 * Cycles are bounded by a visit budget and a global step budget. Visits are counted per path and
 * per call stack, so paths that merge into a common tail, or repeated calls of one subroutine from
 * different call sites, do not use up each other's budget. Exceeding either budget, or the
 * call-depth budget, classifies the whole trace as {@link TerminalState#EXCEEDED_STEP_BUDGET}.
 * <p>
 * Instances are stateless and thread-safe; each call to {@code trace} uses its own state.
 */
public class ExecutionTracer {

    private static final Logger log = LoggerFactory.getLogger(ExecutionTracer.class);

    private final IOpcodeCatalog catalog;
    private final TracerOptions options;

    public ExecutionTracer(IOpcodeCatalog catalog) {
        this(catalog, TracerOptions.defaults());
    }

    public ExecutionTracer(IOpcodeCatalog catalog, TracerOptions options) {
        this.catalog = catalog;
        this.options = options;
    }

    /**
     * Traces a single behavior from position 0, treating every call as opaque.
     *
     * @param graph the behavior
     * @return the trace
     */
    public ExecutionTrace trace(BehaviorGraph graph) {
        return trace(graph, 0);
    }

    public ExecutionTrace trace(BehaviorGraph graph, int entry) {
        return trace(BehaviorPackage.of(graph), ICallSiteResolver.NONE, graph.id(), entry);
    }

    /**
     * Traces a behavior of a package, following subroutine calls within the package.
     *
     * @param pkg      the package
     * @param calls    call-site lookup, typically a call graph built from the same package
     * @param graphId  entry behavior
     * @param entry    entry position
     * @return the trace
     * @throws IllegalArgumentException if the entry behavior is not in the package
     */
    public ExecutionTrace trace(BehaviorPackage pkg, ICallSiteResolver calls, int graphId, int entry) {
        BehaviorGraph entryGraph = pkg.graph(graphId).orElseThrow(() -> new IllegalArgumentException(
                String.format("Behavior 0x%04X is not part of package '%s'", graphId, pkg.name())));
        Run run = new Run(pkg, calls);
        TerminalState terminal = run.explore(graphId, entry);

        List<Integer> unreachable = new ArrayList<>();
        SortedSet<Integer> seen = run.visited.getOrDefault(graphId, new TreeSet<>());
        for (int i = 0; i < entryGraph.size(); i++) {
            if (!seen.contains(i)) {
                unreachable.add(i);
            }
        }

        if (terminal == TerminalState.EXCEEDED_STEP_BUDGET) {
            log.warn("Trace of behavior {} exceeded its budget after {} steps", graphId, run.steps.size());
        } else {
            log.debug("Traced behavior {}: {} in {} steps over {} path(s)", graphId, terminal, run.steps.size(),
                    run.pathCount);
        }
        return new ExecutionTrace(graphId, run.steps, terminal, run.outcomes, run.visited,
                new ArrayList<>(run.backwardJumps), unreachable, run.pathCount);
    }

    private record Frame(int graphId, int position) {
    }

    private record ForkKey(List<Frame> callStack, int graphId, int target) {
    }

    private record VisitKey(List<Frame> callStack, int graphId, int position) {
    }

    /**
     * A queued path: arriving at {@code pointer} in {@code graphId} after the false exit of
     * {@code forkedAt}, or at the entry when {@code forkedAt} is null.
     */
    private record PathStart(int pathIndex, List<Frame> callStack, int graphId, int pointer, int stackDepth,
                             Instruction forkedAt) {
    }

    private final class Run {

        private final BehaviorPackage pkg;
        private final ICallSiteResolver calls;

        private final List<ExecutionStep> steps = new ArrayList<>();
        private final Set<TerminalState> outcomes = EnumSet.noneOf(TerminalState.class);
        private final Map<Integer, SortedSet<Integer>> visited = new HashMap<>();
        private final Set<BackwardJump> backwardJumps = new LinkedHashSet<>();
        private final Set<ForkKey> forks = new HashSet<>();
        private final Deque<PathStart> worklist = new ArrayDeque<>();
        private int pathCount;
        private boolean budgetExceeded;

        Run(BehaviorPackage pkg, ICallSiteResolver calls) {
            this.pkg = pkg;
            this.calls = calls;
        }

        TerminalState explore(int graphId, int entry) {
            worklist.add(new PathStart(0, List.of(), graphId, entry, 0, null));
            TerminalState primary = null;
            while (!worklist.isEmpty() && !budgetExceeded) {
                PathStart start = worklist.poll();
                pathCount++;
                TerminalState outcome = runPath(start);
                outcomes.add(outcome);
                if (primary == null) {
                    primary = outcome;
                }
            }
            return budgetExceeded ? TerminalState.EXCEEDED_STEP_BUDGET : primary;
        }

        private TerminalState runPath(PathStart start) {
            Deque<Frame> frames = new ArrayDeque<>(start.callStack());
            List<Frame> stack = start.callStack();
            Object2IntOpenHashMap<VisitKey> visits = new Object2IntOpenHashMap<>();
            int graphId = start.graphId();
            int depth = start.stackDepth();
            int pointer = start.pointer();

            if (start.forkedAt() != null) {
                Instruction origin = start.forkedAt();
                if (!recordStep(graphId, origin, BranchTaken.FALSE, depth, depth, frames.size(), start.pathIndex())) {
                    return TerminalState.EXCEEDED_STEP_BUDGET;
                }
                noteBackwardJump(graphId, origin.position(), pointer);
            }

            while (true) {
                // Unwind returns until the pointer names an instruction.
                while (ExitPointer.isSentinel(pointer)) {
                    if (frames.isEmpty() || pointer == ExitPointer.ERROR) {
                        return TerminalState.fromSentinel(pointer);
                    }
                    Frame caller = frames.pop();
                    stack = List.copyOf(frames);
                    Instruction callSite = graphOf(caller.graphId()).get(caller.position());
                    graphId = caller.graphId();
                    pointer = callSite.exit(pointer == ExitPointer.RETURN_TRUE);
                }

                BehaviorGraph graph = graphOf(graphId);
                if (!graph.isValidTarget(pointer)) {
                    log.debug("Path {} hit out-of-range pointer {} in behavior {}", start.pathIndex(), pointer, graphId);
                    return TerminalState.ERROR;
                }

                if (visits.addTo(new VisitKey(stack, graphId, pointer), 1) + 1 > options.maxVisitsPerInstruction()) {
                    budgetExceeded = true;
                    return TerminalState.EXCEEDED_STEP_BUDGET;
                }

                Instruction instruction = graph.get(pointer);
                OpcodeInfo info = catalog.lookup(instruction.opcode());
                int after = Math.max(0, depth + info.stackDelta());
                visited.computeIfAbsent(graphId, id -> new TreeSet<>()).add(pointer);

                OptionalInt callee = calls.subroutineTarget(graphId, pointer);
                if (callee.isPresent() && pkg.contains(callee.getAsInt())) {
                    if (frames.size() >= options.maxCallDepth()) {
                        budgetExceeded = true;
                        return TerminalState.EXCEEDED_STEP_BUDGET;
                    }
                    if (!recordStep(graphId, instruction, BranchTaken.CALL, depth, after, frames.size(), start.pathIndex())) {
                        return TerminalState.EXCEEDED_STEP_BUDGET;
                    }
                    frames.push(new Frame(graphId, pointer));
                    stack = List.copyOf(frames);
                    graphId = callee.getAsInt();
                    pointer = 0;
                    depth = after;
                    continue;
                }

                int trueExit = instruction.trueExit();
                int falseExit = instruction.falseExit();
                if (info.mayBranch() && trueExit != falseExit) {
                    if (forks.add(new ForkKey(stack, graphId, falseExit))) {
                        worklist.add(new PathStart(pathCount + worklist.size(), stack, graphId, falseExit, after,
                                instruction));
                    }
                }

                if (!recordStep(graphId, instruction, BranchTaken.TRUE, depth, after, frames.size(), start.pathIndex())) {
                    return TerminalState.EXCEEDED_STEP_BUDGET;
                }
                noteBackwardJump(graphId, pointer, trueExit);
                pointer = trueExit;
                depth = after;
            }
        }

        private boolean recordStep(int graphId, Instruction instruction, BranchTaken branch, int before, int after,
                                   int callDepth, int pathIndex) {
            if (steps.size() >= options.maxSteps()) {
                budgetExceeded = true;
                return false;
            }
            steps.add(new ExecutionStep(graphId, instruction.position(), instruction.opcode(), branch, before, after,
                    callDepth, pathIndex));
            return true;
        }

        private void noteBackwardJump(int graphId, int from, int to) {
            if (!ExitPointer.isSentinel(to) && to <= from) {
                backwardJumps.add(new BackwardJump(graphId, from, to));
            }
        }

        private BehaviorGraph graphOf(int graphId) {
            return pkg.graph(graphId).orElseThrow(() -> new IllegalStateException(
                    "Call site resolved to behavior " + graphId + " outside the package"));
        }
    }
}
