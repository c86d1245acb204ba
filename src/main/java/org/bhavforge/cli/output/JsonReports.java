package org.bhavforge.cli.output;

import java.util.Collection;
import java.util.List;

import org.bhavforge.analysis.callgraph.CallCount;
import org.bhavforge.analysis.callgraph.CallEdge;
import org.bhavforge.analysis.callgraph.CallGraph;
import org.bhavforge.analysis.callgraph.CallGraphSummary;
import org.bhavforge.analysis.diagnostics.Diagnostic;
import org.bhavforge.analysis.flow.FlowReport;
import org.bhavforge.analysis.flow.HotSpot;
import org.bhavforge.analysis.flow.LoopInfo;
import org.bhavforge.analysis.validation.ValidationReport;
import org.bhavforge.editor.rewire.RewireResult;
import org.bhavforge.runtime.trace.BackwardJump;
import org.bhavforge.runtime.trace.ExecutionTrace;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * JSON renderings of engine reports for the {@code --format json} option.
 */
public final class JsonReports {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private JsonReports() {
        // Utility class - prevent instantiation
    }

    public static String toJson(ValidationReport report) {
        JsonObject root = new JsonObject();
        root.addProperty("behavior", report.graphId());
        root.addProperty("valid", report.isValid());
        JsonObject summary = new JsonObject();
        report.summary().forEach((group, count) -> summary.addProperty(group.name(), count));
        root.add("summary", summary);
        root.add("diagnostics", diagnostics(report.diagnostics()));
        return GSON.toJson(root);
    }

    public static String toJson(FlowReport report) {
        JsonObject root = new JsonObject();
        root.addProperty("behavior", report.graphId());
        root.addProperty("instructions", report.instructionCount());
        root.addProperty("coverage", report.coverage());
        root.addProperty("cyclomaticComplexity", report.cyclomaticComplexity());
        root.addProperty("maxNestingDepth", report.maxNestingDepth());
        root.addProperty("averageNestingDepth", report.averageNestingDepth());
        root.add("reachable", ints(report.reachable()));
        root.add("deadCode", ints(report.deadCode()));
        JsonArray loops = new JsonArray();
        for (LoopInfo loop : report.loops()) {
            JsonObject json = new JsonObject();
            json.addProperty("id", loop.id());
            json.addProperty("header", loop.header());
            json.addProperty("end", loop.end());
            json.add("latches", ints(loop.latches()));
            json.addProperty("infinite", loop.infinite());
            json.addProperty("containsCalls", loop.containsCalls());
            json.addProperty("nestingDepth", loop.nestingDepth());
            loops.add(json);
        }
        root.add("loops", loops);
        JsonArray hotSpots = new JsonArray();
        for (HotSpot hotSpot : report.hotSpots()) {
            hotSpots.add(GSON.toJsonTree(hotSpot));
        }
        root.add("hotSpots", hotSpots);
        root.add("issues", diagnostics(report.issues()));
        return GSON.toJson(root);
    }

    public static String toJson(ExecutionTrace trace) {
        JsonObject root = new JsonObject();
        root.addProperty("behavior", trace.graphId());
        root.addProperty("terminal", trace.terminal().name());
        JsonArray outcomes = new JsonArray();
        trace.outcomes().forEach(o -> outcomes.add(o.name()));
        root.add("outcomes", outcomes);
        root.addProperty("steps", trace.stepCount());
        root.addProperty("paths", trace.pathCount());
        root.add("visited", ints(trace.visitedPositions(trace.graphId())));
        root.add("unreachable", ints(trace.unreachable()));
        JsonArray jumps = new JsonArray();
        for (BackwardJump jump : trace.backwardJumps()) {
            jumps.add(GSON.toJsonTree(jump));
        }
        root.add("backwardJumps", jumps);
        return GSON.toJson(root);
    }

    public static String toJson(CallGraph graph, int topLimit) {
        JsonObject root = new JsonObject();
        CallGraphSummary summary = graph.summary();
        root.add("summary", GSON.toJsonTree(summary));
        JsonArray edges = new JsonArray();
        for (CallEdge edge : graph.edges()) {
            edges.add(GSON.toJsonTree(edge));
        }
        root.add("edges", edges);
        JsonArray cycles = new JsonArray();
        graph.cycles().forEach(cycle -> cycles.add(ints(cycle)));
        root.add("cycles", cycles);
        root.add("roots", ints(graph.roots()));
        root.add("leaves", ints(graph.leaves()));
        root.add("unused", ints(graph.unused()));
        root.add("external", ints(graph.externalCallees()));
        root.add("mostCalled", counts(graph.mostCalled(topLimit)));
        root.add("mostCalling", counts(graph.mostCalling(topLimit)));
        return GSON.toJson(root);
    }

    public static String toJson(RewireResult result) {
        return GSON.toJson(GSON.toJsonTree(new RewireSummary(result.success(), result.instructions().size(),
                result.changes(), result.warnings(), result.errors())));
    }

    private record RewireSummary(boolean success, int instructionCount, List<String> changes, List<String> warnings,
                                 List<String> errors) {
    }

    private static JsonArray diagnostics(List<Diagnostic> diagnostics) {
        JsonArray array = new JsonArray();
        for (Diagnostic diagnostic : diagnostics) {
            JsonObject json = new JsonObject();
            json.addProperty("category", diagnostic.category().name());
            json.addProperty("group", diagnostic.category().group().name());
            json.addProperty("severity", diagnostic.severity().name());
            json.addProperty("position", diagnostic.position());
            json.addProperty("message", diagnostic.message());
            if (!diagnostic.suggestion().isEmpty()) {
                json.addProperty("suggestion", diagnostic.suggestion());
            }
            array.add(json);
        }
        return array;
    }

    private static JsonArray counts(List<CallCount> counts) {
        JsonArray array = new JsonArray();
        counts.forEach(c -> array.add(GSON.toJsonTree(c)));
        return array;
    }

    private static JsonArray ints(Collection<Integer> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        return array;
    }
}
