package org.bhavforge.analysis.callgraph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.bhavforge.test.utils.BehaviorTestUtils.F;
import static org.bhavforge.test.utils.BehaviorTestUtils.QUEUE;
import static org.bhavforge.test.utils.BehaviorTestUtils.STEP;
import static org.bhavforge.test.utils.BehaviorTestUtils.T;
import static org.bhavforge.test.utils.BehaviorTestUtils.call;
import static org.bhavforge.test.utils.BehaviorTestUtils.catalog;
import static org.bhavforge.test.utils.BehaviorTestUtils.graph;
import static org.bhavforge.test.utils.BehaviorTestUtils.ins;
import static org.bhavforge.test.utils.BehaviorTestUtils.pkg;

import java.util.List;
import java.util.Set;

import org.bhavforge.runtime.isa.CallKind;
import org.bhavforge.runtime.model.BehaviorScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Contains unit tests for the {@link CallGraph} queries.
 * <p>
 * Fixture:
 * <pre>
 *   0x1000 (entry) -> 0x1001 (two sites), 0x1002 (interaction)
 *   0x1001         -> 0x1003
 *   0x1004         -> 0x1003, 0x0100 (outside the package)
 * </pre>
 */
@Tag("unit")
class CallGraphTest {

    private CallGraph graph;

    @BeforeEach
    void setUp() {
        graph = new CallGraphBuilder(catalog()).build(pkg(Set.of(0x1000),
                graph(0x1000, ins(0x1001, 1, F), ins(0x1001, 2, F), call(QUEUE, 0x1002, T, F)),
                graph(0x1001, ins(0x1003, T, F)),
                graph(0x1002, ins(STEP, T, T)),
                graph(0x1003, ins(STEP, T, T)),
                graph(0x1004, ins(0x1003, 1, F), ins(0x0100, T, F))));
    }

    @Test
    void edges_aggregateCallSites() {
        assertThat(graph.edges()).hasSize(5);
        assertThat(graph.edges().get(0)).isEqualTo(new CallEdge(0x1000, 0x1001, CallKind.SUBROUTINE, List.of(0, 1)));
        assertThat(graph.edges().get(0).callCount()).isEqualTo(2);
        assertThat(graph.edgesFrom(0x1004)).extracting(CallEdge::calleeId).containsExactly(0x0100, 0x1003);
        assertThat(graph.edgesTo(0x1002)).extracting(CallEdge::kind).containsExactly(CallKind.INTERACTION);
    }

    @Test
    void adjacency_queries() {
        assertThat(graph.callersOf(0x1003)).containsExactly(0x1001, 0x1004);
        assertThat(graph.calleesOf(0x1000)).containsExactly(0x1001, 0x1002);
        assertThat(graph.calleesOf(0x1002)).isEmpty();
        assertThat(graph.externalCallees()).containsExactly(0x0100);
        assertThat(graph.isExternal(0x0100)).isTrue();
        assertThat(graph.isExternal(0x1003)).isFalse();
    }

    @Test
    void classification_ofBehaviors() {
        assertThat(graph.unused()).containsExactly(0x1004);
        assertThat(graph.roots()).containsExactly(0x1000, 0x1004);
        assertThat(graph.leaves()).containsExactly(0x1002, 0x1003);
        assertThat(graph.entryPoints()).containsExactly(0x1000);
    }

    @Test
    void reachability_queries() {
        assertThat(graph.callDepth(0x1000, 0x1003)).hasValue(2);
        assertThat(graph.callDepth(0x1003, 0x1000)).isEmpty();
        assertThat(graph.callDepth(0x1002, 0x1002)).hasValue(0);
        assertThat(graph.hasPath(0x1004, 0x0100)).isTrue();
        assertThat(graph.allDescendants(0x1000)).containsExactly(0x1001, 0x1002, 0x1003);
        assertThat(graph.allDescendants(0x1000, 1)).containsExactly(0x1001, 0x1002);
        assertThat(graph.allAncestors(0x1003)).containsExactly(0x1000, 0x1001, 0x1004);
        assertThat(graph.isRecursive(0x1000)).isFalse();
        assertThat(graph.cycles()).isEmpty();
    }

    @Test
    void ranking_byDistinctNeighbors() {
        assertThat(graph.mostCalled(1)).containsExactly(new CallCount(0x1003, 2));
        assertThat(graph.mostCalling(2)).containsExactly(new CallCount(0x1000, 2), new CallCount(0x1004, 2));
        assertThat(graph.mostCalled(0)).isEmpty();
    }

    @Test
    void callChains_enumerateSimplePaths() {
        assertThat(graph.callChains(0x1000, 8)).containsExactly(
                List.of(0x1000, 0x1001, 0x1003),
                List.of(0x1000, 0x1002));
        assertThat(graph.callChains(0x1000, 1)).containsExactly(
                List.of(0x1000, 0x1001),
                List.of(0x1000, 0x1002));
    }

    @Test
    void callSites_resolveSubroutinesOnly() {
        assertThat(graph.callSiteAt(0x1000, 2)).get().extracting(CallSite::kind).isEqualTo(CallKind.INTERACTION);
        assertThat(graph.subroutineTarget(0x1000, 0)).hasValue(0x1001);
        assertThat(graph.subroutineTarget(0x1000, 2)).isEmpty();
        assertThat(graph.subroutineTarget(0x1002, 0)).isEmpty();
    }

    @Test
    void summary_countsEverything() {
        CallGraphSummary summary = graph.summary();

        assertThat(summary.behaviors()).isEqualTo(5);
        assertThat(summary.edges()).isEqualTo(5);
        assertThat(summary.callSites()).isEqualTo(6);
        assertThat(summary.roots()).isEqualTo(2);
        assertThat(summary.leaves()).isEqualTo(2);
        assertThat(summary.unused()).isEqualTo(1);
        assertThat(summary.external()).isEqualTo(1);
        assertThat(summary.cycles()).isZero();
        assertThat(summary.scopeCounts()).containsEntry(BehaviorScope.PRIVATE, 5).containsEntry(BehaviorScope.GLOBAL, 0);
    }

    @Test
    void dotExport_stylesNodesAndEdges() {
        String dot = new CallGraphDotExporter().export(graph, "kitchen");

        assertThat(dot).startsWith("digraph \"kitchen\" {")
                .contains("b4096 [label=\"0x1000\", fillcolor=\"lightgreen\", penwidth=2, style=\"filled,bold\"];")
                .contains("b256 [label=\"0x0100\", fillcolor=\"white\", style=\"dashed\"];")
                .contains("b4096 -> b4097 [style=solid, label=\"x2\"];")
                .contains("b4096 -> b4098 [style=bold];")
                .endsWith("}\n");
    }

    @Test
    void dotExport_usesCustomLabels() {
        String dot = new CallGraphDotExporter(id -> "say \"" + id + "\"").export(graph, "p");

        assertThat(dot).contains("b4099 [label=\"say \\\"4099\\\"\"");
    }
}
