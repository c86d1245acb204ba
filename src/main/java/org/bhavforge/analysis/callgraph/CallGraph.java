package org.bhavforge.analysis.callgraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.bhavforge.runtime.isa.CallKind;
import org.bhavforge.runtime.model.BehaviorScope;
import org.bhavforge.runtime.trace.ICallSiteResolver;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;

/**
 * Immutable cross-reference of the calls between the behaviors of one package.
 * <p>
 * Nodes are the package's behaviors plus every id they call. Ids called but absent from the
 * package are external; they have no outgoing edges. Built by {@link CallGraphBuilder}; never
 * patched, rebuild it after an edit.
 * <p>
 * Thread-safe: all state is computed at construction.
 */
public final class CallGraph implements ICallSiteResolver {

    private final SortedSet<Integer> behaviorIds;
    private final Set<Integer> entryPoints;
    private final List<CallEdge> edges;
    private final Map<Integer, SortedSet<Integer>> callees = new TreeMap<>();
    private final Map<Integer, SortedSet<Integer>> callers = new TreeMap<>();
    private final SortedSet<Integer> external = new TreeSet<>();
    private final Int2ObjectMap<Int2ObjectMap<CallSite>> callSites = new Int2ObjectOpenHashMap<>();
    private final int callSiteCount;
    private final List<List<Integer>> cycles;

    CallGraph(Set<Integer> behaviorIds, Set<Integer> entryPoints, List<CallSite> sites) {
        this.behaviorIds = Collections.unmodifiableSortedSet(new TreeSet<>(behaviorIds));
        this.entryPoints = Set.copyOf(entryPoints);
        this.callSiteCount = sites.size();

        Map<String, List<Integer>> grouped = new TreeMap<>();
        Map<String, CallSite> firstOfGroup = new TreeMap<>();
        for (CallSite site : sites) {
            callSites.computeIfAbsent(site.callerId(), id -> new Int2ObjectOpenHashMap<>()).put(site.position(), site);
            callees.computeIfAbsent(site.callerId(), id -> new TreeSet<>()).add(site.calleeId());
            callers.computeIfAbsent(site.calleeId(), id -> new TreeSet<>()).add(site.callerId());
            if (!behaviorIds.contains(site.calleeId())) {
                external.add(site.calleeId());
            }
            String key = site.callerId() + ":" + site.calleeId() + ":" + site.kind();
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(site.position());
            firstOfGroup.putIfAbsent(key, site);
        }

        List<CallEdge> built = new ArrayList<>(grouped.size());
        grouped.forEach((key, positions) -> {
            CallSite first = firstOfGroup.get(key);
            List<Integer> sorted = new ArrayList<>(positions);
            Collections.sort(sorted);
            built.add(new CallEdge(first.callerId(), first.calleeId(), first.kind(), sorted));
        });
        built.sort(Comparator.comparingInt(CallEdge::callerId)
                .thenComparingInt(CallEdge::calleeId)
                .thenComparing(CallEdge::kind));
        this.edges = List.copyOf(built);
        this.cycles = findCycles();
    }

    public SortedSet<Integer> behaviorIds() {
        return behaviorIds;
    }

    public List<CallEdge> edges() {
        return edges;
    }

    public List<CallEdge> edgesFrom(int callerId) {
        return edges.stream().filter(e -> e.callerId() == callerId).toList();
    }

    public List<CallEdge> edgesTo(int calleeId) {
        return edges.stream().filter(e -> e.calleeId() == calleeId).toList();
    }

    public SortedSet<Integer> callersOf(int id) {
        return Collections.unmodifiableSortedSet(callers.getOrDefault(id, Collections.emptySortedSet()));
    }

    public SortedSet<Integer> calleesOf(int id) {
        return Collections.unmodifiableSortedSet(callees.getOrDefault(id, Collections.emptySortedSet()));
    }

    /**
     * Ids called from the package but not defined in it.
     *
     * @return external callee ids, ascending
     */
    public SortedSet<Integer> externalCallees() {
        return Collections.unmodifiableSortedSet(external);
    }

    public boolean isExternal(int id) {
        return external.contains(id);
    }

    public Optional<CallSite> callSiteAt(int graphId, int position) {
        Int2ObjectMap<CallSite> byPosition = callSites.get(graphId);
        return byPosition == null ? Optional.empty() : Optional.ofNullable(byPosition.get(position));
    }

    @Override
    public OptionalInt subroutineTarget(int graphId, int position) {
        return callSiteAt(graphId, position)
                .filter(site -> site.kind() == CallKind.SUBROUTINE)
                .map(site -> OptionalInt.of(site.calleeId()))
                .orElse(OptionalInt.empty());
    }

    /**
     * Length of the shortest call chain from one behavior to another.
     *
     * @param from calling behavior
     * @param to   target behavior
     * @return number of calls on the shortest chain, 0 if {@code from == to}, empty if unreachable
     */
    public OptionalInt callDepth(int from, int to) {
        if (from == to) {
            return OptionalInt.of(0);
        }
        Int2IntOpenHashMap distance = new Int2IntOpenHashMap();
        distance.put(from, 0);
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(from);
        while (!queue.isEmpty()) {
            int current = queue.dequeueInt();
            int next = distance.get(current) + 1;
            for (int callee : calleesOf(current)) {
                if (callee == to) {
                    return OptionalInt.of(next);
                }
                if (!distance.containsKey(callee)) {
                    distance.put(callee, next);
                    queue.enqueue(callee);
                }
            }
        }
        return OptionalInt.empty();
    }

    public boolean hasPath(int from, int to) {
        return callDepth(from, to).isPresent();
    }

    /**
     * Whether a behavior can reach itself through one or more calls.
     *
     * @param id behavior id
     * @return true for direct or mutual recursion
     */
    public boolean isRecursive(int id) {
        return allDescendants(id).contains(id);
    }

    public SortedSet<Integer> allDescendants(int id) {
        return reachable(id, Integer.MAX_VALUE, true);
    }

    /**
     * Behaviors reachable through at most {@code maxDepth} calls.
     *
     * @param id       start behavior
     * @param maxDepth maximum chain length
     * @return reachable ids; contains {@code id} only if it is recursive within the limit
     */
    public SortedSet<Integer> allDescendants(int id, int maxDepth) {
        return reachable(id, maxDepth, true);
    }

    public SortedSet<Integer> allAncestors(int id) {
        return reachable(id, Integer.MAX_VALUE, false);
    }

    public SortedSet<Integer> allAncestors(int id, int maxDepth) {
        return reachable(id, maxDepth, false);
    }

    private SortedSet<Integer> reachable(int start, int maxDepth, boolean forward) {
        SortedSet<Integer> result = new TreeSet<>();
        Int2IntOpenHashMap depth = new Int2IntOpenHashMap();
        depth.put(start, 0);
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(start);
        while (!queue.isEmpty()) {
            int current = queue.dequeueInt();
            int d = depth.get(current);
            if (d >= maxDepth) {
                continue;
            }
            for (int next : forward ? calleesOf(current) : callersOf(current)) {
                result.add(next);
                if (!depth.containsKey(next)) {
                    depth.put(next, d + 1);
                    queue.enqueue(next);
                }
            }
        }
        return Collections.unmodifiableSortedSet(result);
    }

    /**
     * Behaviors of the package nobody else calls and that are not entry points.
     * Self-calls do not count as callers.
     *
     * @return unused ids, ascending
     */
    public SortedSet<Integer> unused() {
        SortedSet<Integer> result = new TreeSet<>();
        for (int id : behaviorIds) {
            if (!entryPoints.contains(id) && externalCallers(id).isEmpty()) {
                result.add(id);
            }
        }
        return result;
    }

    /**
     * Behaviors of the package that call nothing.
     *
     * @return leaf ids, ascending
     */
    public SortedSet<Integer> leaves() {
        SortedSet<Integer> result = new TreeSet<>();
        for (int id : behaviorIds) {
            if (calleesOf(id).isEmpty()) {
                result.add(id);
            }
        }
        return result;
    }

    /**
     * Behaviors of the package without callers other than themselves.
     *
     * @return root ids, ascending
     */
    public SortedSet<Integer> roots() {
        SortedSet<Integer> result = new TreeSet<>();
        for (int id : behaviorIds) {
            if (externalCallers(id).isEmpty()) {
                result.add(id);
            }
        }
        return result;
    }

    private Set<Integer> externalCallers(int id) {
        Set<Integer> others = new TreeSet<>(callersOf(id));
        others.remove(id);
        return others;
    }

    public List<CallCount> mostCalled(int limit) {
        return ranked(callers, limit);
    }

    public List<CallCount> mostCalling(int limit) {
        return ranked(callees, limit);
    }

    private static List<CallCount> ranked(Map<Integer, SortedSet<Integer>> adjacency, int limit) {
        return adjacency.entrySet().stream()
                .map(e -> new CallCount(e.getKey(), e.getValue().size()))
                .sorted(Comparator.comparingInt(CallCount::count).reversed().thenComparingInt(CallCount::behaviorId))
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Recursion cycles, each an id list that starts and ends with the same behavior,
     * e.g. {@code [A, B, A]} for mutual recursion or {@code [A, A]} for a self-call.
     *
     * @return cycles in discovery order
     */
    public List<List<Integer>> cycles() {
        return cycles;
    }

    /**
     * Enumerates call chains starting at a behavior. A chain ends at a leaf, at an external
     * behavior, when it would revisit a behavior already on the chain, or at {@code maxDepth} calls.
     *
     * @param from     start behavior
     * @param maxDepth maximum number of calls per chain
     * @return chains as id lists, each beginning with {@code from}
     */
    public List<List<Integer>> callChains(int from, int maxDepth) {
        List<List<Integer>> chains = new ArrayList<>();
        Deque<List<Integer>> pending = new ArrayDeque<>();
        pending.push(List.of(from));
        while (!pending.isEmpty()) {
            List<Integer> chain = pending.pop();
            int last = chain.get(chain.size() - 1);
            List<Integer> extensions = new ArrayList<>();
            if (chain.size() - 1 < maxDepth) {
                for (int callee : calleesOf(last)) {
                    if (!chain.contains(callee)) {
                        extensions.add(callee);
                    }
                }
            }
            if (extensions.isEmpty()) {
                chains.add(chain);
                continue;
            }
            for (int i = extensions.size() - 1; i >= 0; i--) {
                List<Integer> extended = new ArrayList<>(chain);
                extended.add(extensions.get(i));
                pending.push(List.copyOf(extended));
            }
        }
        return chains;
    }

    public Set<Integer> entryPoints() {
        return entryPoints;
    }

    public CallGraphSummary summary() {
        Map<BehaviorScope, Integer> scopes = new EnumMap<>(BehaviorScope.class);
        for (BehaviorScope scope : BehaviorScope.values()) {
            scopes.put(scope, 0);
        }
        for (int id : behaviorIds) {
            scopes.merge(BehaviorScope.fromId(id), 1, Integer::sum);
        }
        return new CallGraphSummary(behaviorIds.size(), edges.size(), callSiteCount, roots().size(), leaves().size(),
                unused().size(), external.size(), cycles.size(), scopes);
    }

    private List<List<Integer>> findCycles() {
        List<List<Integer>> found = new ArrayList<>();
        Set<Integer> done = new TreeSet<>();
        Set<Integer> onStack = new TreeSet<>();
        Deque<Integer> path = new ArrayDeque<>();
        Deque<Iterator<Integer>> iterators = new ArrayDeque<>();

        for (int root : behaviorIds) {
            if (done.contains(root)) {
                continue;
            }
            path.addLast(root);
            onStack.add(root);
            iterators.push(calleesOf(root).iterator());
            while (!iterators.isEmpty()) {
                Iterator<Integer> it = iterators.peek();
                if (!it.hasNext()) {
                    iterators.pop();
                    int finished = path.removeLast();
                    onStack.remove(finished);
                    done.add(finished);
                    continue;
                }
                int callee = it.next();
                if (onStack.contains(callee)) {
                    List<Integer> cycle = new ArrayList<>();
                    boolean inCycle = false;
                    for (int node : path) {
                        if (node == callee) {
                            inCycle = true;
                        }
                        if (inCycle) {
                            cycle.add(node);
                        }
                    }
                    cycle.add(callee);
                    found.add(List.copyOf(cycle));
                } else if (!done.contains(callee)) {
                    path.addLast(callee);
                    onStack.add(callee);
                    iterators.push(calleesOf(callee).iterator());
                }
            }
        }
        return List.copyOf(found);
    }
}
