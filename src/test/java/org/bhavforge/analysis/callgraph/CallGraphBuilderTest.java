package org.bhavforge.analysis.callgraph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.bhavforge.test.utils.BehaviorTestUtils.F;
import static org.bhavforge.test.utils.BehaviorTestUtils.GOSUB;
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
import org.bhavforge.runtime.model.BehaviorPackage;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Contains unit tests for {@link CallGraphBuilder} extracting call sites.
 */
@Tag("unit")
class CallGraphBuilderTest {

    private final CallGraphBuilder builder = new CallGraphBuilder(catalog());

    @Test
    void scan_findsOpcodeAndOperandTargets() {
        List<CallSite> sites = builder.scan(graph(0x1000,
                ins(0x1001, 1, F),
                call(GOSUB, 0x1002, 2, F),
                call(QUEUE, 0x1003, 3, F),
                ins(STEP, T, T)));

        assertThat(sites).containsExactly(
                new CallSite(0x1000, 0, 0x1001, CallKind.SUBROUTINE),
                new CallSite(0x1000, 1, 0x1002, CallKind.SUBROUTINE),
                new CallSite(0x1000, 2, 0x1003, CallKind.INTERACTION));
    }

    @Test
    void scan_skipsOperandCallsWithoutTarget() {
        assertThat(builder.scan(graph(call(GOSUB, 0, T, F)))).isEmpty();
    }

    @Test
    void build_detectsMutualRecursionOnce() {
        BehaviorPackage pkg = pkg(Set.of(0x1000),
                graph(0x1000, ins(0x1001, T, F)),
                graph(0x1001, ins(0x1000, T, F)));

        CallGraph graph = builder.build(pkg);

        assertThat(graph.cycles()).containsExactly(List.of(0x1000, 0x1001, 0x1000));
        assertThat(graph.isRecursive(0x1000)).isTrue();
        assertThat(graph.isRecursive(0x1001)).isTrue();
    }

    @Test
    void build_detectsSelfRecursion() {
        CallGraph graph = builder.build(pkg(Set.of(), graph(0x1000, ins(0x1000, T, F))));

        assertThat(graph.cycles()).containsExactly(List.of(0x1000, 0x1000));
        assertThat(graph.roots()).containsExactly(0x1000);
        assertThat(graph.unused()).containsExactly(0x1000);
    }

    @Test
    void build_isDeterministicAcrossRuns() {
        BehaviorPackage pkg = pkg(Set.of(0x1000),
                graph(0x1000, ins(0x1001, 1, F), ins(0x1002, T, F)),
                graph(0x1001, ins(0x1002, T, F)),
                graph(0x1002, ins(STEP, T, T)));

        CallGraph first = builder.build(pkg);
        CallGraph second = builder.build(pkg);

        assertThat(second.edges()).isEqualTo(first.edges());
        assertThat(second.cycles()).isEqualTo(first.cycles());
    }
}
