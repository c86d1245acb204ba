package org.bhavforge.editor.rewire;

import static org.assertj.core.api.Assertions.assertThat;
import static org.bhavforge.test.utils.BehaviorTestUtils.E;
import static org.bhavforge.test.utils.BehaviorTestUtils.F;
import static org.bhavforge.test.utils.BehaviorTestUtils.STEP;
import static org.bhavforge.test.utils.BehaviorTestUtils.T;
import static org.bhavforge.test.utils.BehaviorTestUtils.TEST;
import static org.bhavforge.test.utils.BehaviorTestUtils.exits;
import static org.bhavforge.test.utils.BehaviorTestUtils.graph;
import static org.bhavforge.test.utils.BehaviorTestUtils.ins;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.bhavforge.analysis.diagnostics.Diagnostic;
import org.bhavforge.analysis.diagnostics.DiagnosticCategory;
import org.bhavforge.runtime.isa.ExitPointer;
import org.bhavforge.runtime.isa.Instruction;
import org.bhavforge.runtime.model.BehaviorGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Contains unit tests for {@link RewiringEngine}.
 * <p>
 * Most tests start from the three-instruction behavior
 * <pre>
 *   0: Step   T->1     F->1
 *   1: Test   T->2     F->FALSE
 *   2: Step   T->TRUE  F->TRUE
 * </pre>
 */
@Tag("unit")
class RewiringEngineTest {

    private RewiringEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RewiringEngine(graph(
                ins(STEP, 1, 1),
                ins(TEST, 2, F),
                ins(STEP, T, T)));
    }

    @Test
    void insert_shiftsExitsAtOrAfterInsertionPoint() {
        RewireResult result = engine.insert(1, List.of(ins(STEP, 2, 2)));

        assertThat(result.success()).isTrue();
        assertThat(exits(result.instructions())).containsExactly(
                new int[] {2, 2}, new int[] {2, 2}, new int[] {3, F}, new int[] {T, T});
        assertThat(result.instructions()).extracting(Instruction::position).containsExactly(0, 1, 2, 3);
        assertThat(result.changes()).containsExactly(
                "Instruction 0 true: 1 -> 2",
                "Instruction 0 false: 1 -> 2",
                "Instruction 1 true: 2 -> 3");
        assertThat(result.warnings()).isEmpty();
        assertThat(engine.validate()).isEmpty();
    }

    @Test
    void insert_atEndLeavesExitsUnchanged() {
        RewireResult result = engine.insert(3, List.of(ins(STEP, T, T)));

        assertThat(result.changes()).isEmpty();
        assertThat(engine.size()).isEqualTo(4);
    }

    @Test
    void insert_redirectsOutOfRangeExitsToError() {
        RewiringEngine corrupt = new RewiringEngine(graph(
                ins(STEP, 4, 4),
                ins(STEP, T, T),
                ins(STEP, T, T)));
        assertThat(corrupt.validate()).hasSize(2);

        RewireResult result = corrupt.insert(3, List.of(ins(STEP, T, T), ins(STEP, T, T)));

        assertThat(result.success()).isTrue();
        assertThat(exits(result.instructions())[0]).containsExactly(E, E);
        assertThat(result.warnings()).containsExactly(
                "Instruction 0 true pointer 4 is out of range -> ERROR",
                "Instruction 0 false pointer 4 is out of range -> ERROR");
        assertThat(result.changes()).containsExactly(
                "Instruction 0 true: 4 -> ERROR",
                "Instruction 0 false: 4 -> ERROR");
        assertThat(corrupt.validate()).isEmpty();
    }

    @Test
    void insert_rejectsInvalidIndexWithoutMutation() {
        List<Instruction> before = engine.instructions();

        RewireResult result = engine.insert(-1, List.of(ins(STEP, T, T)));

        assertThat(result.success()).isFalse();
        assertThat(result.errors()).containsExactly("Invalid insert index -1 (instruction count 3)");
        assertThat(engine.instructions()).isEqualTo(before);
    }

    @Test
    void insert_rejectsGrowingPastLimit() {
        List<Instruction> instructions = new ArrayList<>();
        for (int i = 0; i < BehaviorGraph.MAX_INSTRUCTIONS - 1; i++) {
            instructions.add(ins(STEP, T, T));
        }
        RewiringEngine full = new RewiringEngine(graph(instructions.toArray(new Instruction[0])));

        assertThat(full.insert(0, List.of(ins(STEP, T, T))).success()).isTrue();
        RewireResult rejected = full.insert(0, List.of(ins(STEP, T, T)));

        assertThat(rejected.success()).isFalse();
        assertThat(rejected.errors().get(0)).contains("limit is 253");
        assertThat(full.size()).isEqualTo(253);
    }

    @Test
    void delete_redirectsDanglingExitsToError() {
        RewireResult result = engine.delete(1);

        assertThat(result.success()).isTrue();
        assertThat(exits(result.instructions())).containsExactly(new int[] {E, E}, new int[] {T, T});
        assertThat(result.warnings()).containsExactly(
                "Instruction 0 true pointer to deleted instruction -> ERROR",
                "Instruction 0 false pointer to deleted instruction -> ERROR");
        assertThat(result.changes()).containsExactly(
                "Instruction 0 true: 1 -> ERROR",
                "Instruction 0 false: 1 -> ERROR");
        assertThat(result.hasWarnings()).isTrue();
    }

    @Test
    void delete_compactsSurvivors() {
        RewiringEngine chain = new RewiringEngine(graph(
                ins(STEP, 2, 2),
                ins(STEP, 2, 2),
                ins(TEST, 3, 0),
                ins(STEP, T, T)));

        RewireResult result = chain.delete(List.of(1, 1));

        assertThat(result.warnings()).isEmpty();
        assertThat(exits(result.instructions())).containsExactly(
                new int[] {1, 1}, new int[] {2, 0}, new int[] {T, T});
    }

    @Test
    void delete_emptySetIsNoOp() {
        RewireResult result = engine.delete(List.of());

        assertThat(result.success()).isTrue();
        assertThat(result.changes()).isEmpty();
        assertThat(engine.size()).isEqualTo(3);
    }

    @Test
    void delete_rejectsOutOfRangeIndex() {
        RewireResult result = engine.delete(0, 3);

        assertThat(result.success()).isFalse();
        assertThat(result.errors()).containsExactly("Invalid delete index 3 (instruction count 3)");
        assertThat(engine.size()).isEqualTo(3);
    }

    @Test
    void move_rewiresShiftedInstructions() {
        RewireResult result = engine.move(0, 2);

        assertThat(exits(result.instructions())).containsExactly(
                new int[] {1, F}, new int[] {T, T}, new int[] {0, 0});
        assertThat(result.instructions()).extracting(Instruction::opcode).containsExactly(TEST, STEP, STEP);
        assertThat(engine.validate()).isEmpty();
    }

    @Test
    void move_toSameIndexIsNoOp() {
        List<Instruction> before = engine.instructions();

        RewireResult result = engine.move(1, 1);

        assertThat(result.success()).isTrue();
        assertThat(result.changes()).isEmpty();
        assertThat(engine.instructions()).isEqualTo(before);
    }

    @Test
    void reorder_appliesPermutation() {
        RewireResult result = engine.reorder(new int[] {2, 0, 1});

        assertThat(exits(result.instructions())).containsExactly(
                new int[] {T, T}, new int[] {2, 2}, new int[] {0, F});
    }

    @Test
    void reorder_identityIsNoOp() {
        List<Instruction> before = engine.instructions();

        RewireResult result = engine.reorder(new int[] {0, 1, 2});

        assertThat(result.changes()).isEmpty();
        assertThat(engine.instructions()).isEqualTo(before);
        assertThat(engine.changesFromOriginal().isUnchanged()).isTrue();
    }

    @Test
    void reorder_rejectsMalformedPermutation() {
        List<Instruction> before = engine.instructions();

        RewireResult duplicate = engine.reorder(new int[] {0, 0, 1});
        RewireResult shortOrder = engine.reorder(new int[] {1, 0});

        assertThat(duplicate.errors()).containsExactly("Invalid order: must contain each index exactly once");
        assertThat(shortOrder.errors()).containsExactly("Order length 2 doesn't match instruction count 3");
        assertThat(engine.instructions()).isEqualTo(before);
    }

    @Test
    void reorder_preservesPointedToInstructions() {
        List<Instruction> instructions = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            instructions.add(ins(0x100 + i, (i * 5 + 3) % 12, i % 3 == 0 ? F : (i + 1) % 12));
        }
        BehaviorGraph source = graph(instructions.toArray(new Instruction[0]));
        Random random = new Random(42);

        for (int round = 0; round < 20; round++) {
            List<Integer> order = new ArrayList<>();
            for (int i = 0; i < source.size(); i++) {
                order.add(i);
            }
            Collections.shuffle(order, random);
            RewiringEngine shuffled = new RewiringEngine(source);
            List<Instruction> result = shuffled.reorder(order.stream().mapToInt(Integer::intValue).toArray())
                    .instructions();

            for (Instruction moved : result) {
                Instruction before = source.get(moved.opcode() - 0x100);
                assertPointsToSame(source, before.trueExit(), result, moved.trueExit());
                assertPointsToSame(source, before.falseExit(), result, moved.falseExit());
            }
        }
    }

    @Test
    void paste_rebasesPointersInsideBlock() {
        List<Instruction> block = List.of(engine.original().get(1), engine.original().get(2));

        RewireResult result = engine.paste(3, block);

        assertThat(result.success()).isTrue();
        assertThat(result.warnings()).isEmpty();
        assertThat(exits(result.instructions()).length).isEqualTo(5);
        assertThat(exits(result.instructions())[3]).containsExactly(4, F);
        assertThat(exits(result.instructions())[4]).containsExactly(T, T);
    }

    @Test
    void paste_redirectsPointersLeavingBlock() {
        RewireResult result = engine.paste(0, List.of(engine.original().get(0)));

        assertThat(exits(result.instructions())[0]).containsExactly(E, E);
        assertThat(result.warnings()).containsExactly(
                "Pasted instruction 0 true pointer 1 leaves the copied block -> ERROR",
                "Pasted instruction 0 false pointer 1 leaves the copied block -> ERROR");
        assertThat(exits(result.instructions())[1]).containsExactly(2, 2);
    }

    @Test
    void paste_rejectsRepeatedSourcePositions() {
        Instruction copied = engine.original().get(2);

        RewireResult result = engine.paste(0, List.of(copied, copied));

        assertThat(result.success()).isFalse();
        assertThat(engine.size()).isEqualTo(3);
    }

    @Test
    void changesFromOriginal_tracksEdits() {
        engine.insert(0, List.of(ins(STEP, 1, 1)));
        engine.delete(3);

        EditSummary summary = engine.changesFromOriginal();

        assertThat(summary.originalCount()).isEqualTo(3);
        assertThat(summary.currentCount()).isEqualTo(3);
        assertThat(summary.countChange()).isZero();
        assertThat(summary.inserted()).containsExactly(0);
        assertThat(summary.deleted()).containsExactly(2);
        assertThat(summary.relocated()).containsEntry(0, 1).containsEntry(1, 2);
        assertThat(summary.pointerChanges()).containsExactly("Instruction 2 true: 2 (deleted) -> ERROR");
    }

    @Test
    void changesFromOriginal_ignoresPureRelocation() {
        engine.move(0, 2);

        EditSummary summary = engine.changesFromOriginal();

        assertThat(summary.pointerChanges()).isEmpty();
        assertThat(summary.relocated()).containsEntry(0, 2).containsEntry(1, 0).containsEntry(2, 1);
    }

    @Test
    void reset_restoresSnapshot() {
        engine.delete(0, 1);

        engine.reset();

        assertThat(engine.currentGraph()).isEqualTo(engine.original());
        assertThat(engine.changesFromOriginal().isUnchanged()).isTrue();
    }

    @Test
    void validate_reportsDanglingExits() {
        RewiringEngine broken = new RewiringEngine(graph(ins(TEST, 9, F)));

        List<Diagnostic> problems = broken.validate();

        assertThat(problems).singleElement().satisfies(d -> {
            assertThat(d.category()).isEqualTo(DiagnosticCategory.INVALID_BRANCH_TARGET);
            assertThat(d.position()).isZero();
            assertThat(d.isError()).isTrue();
        });
    }

    private static void assertPointsToSame(BehaviorGraph source, int originalTarget, List<Instruction> result,
                                           int newTarget) {
        if (ExitPointer.isSentinel(originalTarget)) {
            assertThat(newTarget).isEqualTo(originalTarget);
        } else {
            assertThat(result.get(newTarget).opcode()).isEqualTo(source.get(originalTarget).opcode());
        }
    }
}
