package org.bhavforge.analysis.callgraph;

import java.util.function.IntFunction;

import org.bhavforge.runtime.model.BehaviorScope;

/**
 * Renders a {@link CallGraph} in Graphviz DOT syntax.
 * <p>
 * Nodes are filled by scope, entry points are drawn bold and external behaviors dashed.
 * Edge style encodes the call kind; edges with several call sites are labeled with the count.
 */
public final class CallGraphDotExporter {

    private final IntFunction<String> labeler;

    public CallGraphDotExporter() {
        this(id -> String.format("0x%04X", id));
    }

    /**
     * @param labeler produces node labels from behavior ids
     */
    public CallGraphDotExporter(IntFunction<String> labeler) {
        this.labeler = labeler;
    }

    public String export(CallGraph graph, String name) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(escape(name)).append("\" {\n");
        sb.append("  rankdir=LR;\n");
        sb.append("  node [shape=box, style=filled, fontname=\"Helvetica\"];\n");

        for (int id : graph.behaviorIds()) {
            sb.append("  ").append(nodeId(id)).append(" [label=\"").append(escape(labeler.apply(id)))
                    .append("\", fillcolor=\"").append(color(BehaviorScope.fromId(id))).append('"');
            if (graph.entryPoints().contains(id)) {
                sb.append(", penwidth=2, style=\"filled,bold\"");
            }
            sb.append("];\n");
        }
        for (int id : graph.externalCallees()) {
            sb.append("  ").append(nodeId(id)).append(" [label=\"").append(escape(labeler.apply(id)))
                    .append("\", fillcolor=\"white\", style=\"dashed\"];\n");
        }

        for (CallEdge edge : graph.edges()) {
            sb.append("  ").append(nodeId(edge.callerId())).append(" -> ").append(nodeId(edge.calleeId()));
            sb.append(" [style=").append(edgeStyle(edge));
            if (edge.callCount() > 1) {
                sb.append(", label=\"x").append(edge.callCount()).append('"');
            }
            sb.append("];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String nodeId(int id) {
        return "b" + id;
    }

    private static String color(BehaviorScope scope) {
        return switch (scope) {
            case GLOBAL -> "lightblue";
            case PRIVATE -> "lightgreen";
            case SEMI_GLOBAL -> "lightyellow";
        };
    }

    private static String edgeStyle(CallEdge edge) {
        return switch (edge.kind()) {
            case SUBROUTINE -> "solid";
            case CALLBACK -> "dashed";
            case INTERACTION -> "bold";
            case AUTONOMOUS -> "dotted";
        };
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
