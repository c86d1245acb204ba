package org.bhavforge.runtime.model;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * An immutable set of behaviors that may call each other, keyed by behavior id.
 * <p>
 * Entry points are behaviors invoked from outside the package (interactions, the main loop);
 * they are never reported as unused even without callers. Iteration is in ascending id order.
 */
public final class BehaviorPackage {

    private final String name;
    private final Map<Integer, BehaviorGraph> graphs;
    private final Set<Integer> entryPoints;

    public BehaviorPackage(String name, Collection<BehaviorGraph> graphs, Set<Integer> entryPoints) {
        this.name = name == null ? "" : name;
        TreeMap<Integer, BehaviorGraph> byId = new TreeMap<>();
        for (BehaviorGraph graph : graphs) {
            if (byId.put(graph.id(), graph) != null) {
                throw new IllegalArgumentException(String.format("Duplicate behavior id 0x%04X in package '%s'",
                        graph.id(), this.name));
            }
        }
        this.graphs = Collections.unmodifiableMap(byId);
        this.entryPoints = Collections.unmodifiableSet(new TreeSet<>(entryPoints));
    }

    /**
     * Wraps a single graph as a package with that graph as its only entry point.
     *
     * @param graph the graph
     * @return the package
     */
    public static BehaviorPackage of(BehaviorGraph graph) {
        return new BehaviorPackage("", List.of(graph), Set.of(graph.id()));
    }

    public String name() {
        return name;
    }

    public Optional<BehaviorGraph> graph(int id) {
        return Optional.ofNullable(graphs.get(id));
    }

    public boolean contains(int id) {
        return graphs.containsKey(id);
    }

    public Collection<BehaviorGraph> graphs() {
        return graphs.values();
    }

    public Set<Integer> ids() {
        return graphs.keySet();
    }

    public Set<Integer> entryPoints() {
        return entryPoints;
    }

    public boolean isEntryPoint(int id) {
        return entryPoints.contains(id);
    }

    public int size() {
        return graphs.size();
    }

    @Override
    public String toString() {
        return "BehaviorPackage[name=" + name + ", graphs=" + graphs.size() + ", entryPoints=" + entryPoints + "]";
    }
}
