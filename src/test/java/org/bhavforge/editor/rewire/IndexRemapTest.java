package org.bhavforge.editor.rewire;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.BitSet;

import org.bhavforge.runtime.isa.ExitPointer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Contains unit tests for {@link IndexRemap}.
 */
@Tag("unit")
class IndexRemapTest {

    @Test
    void forInsert_shiftsFromInsertionPoint() {
        IndexRemap remap = IndexRemap.forInsert(4, 2, 3);

        assertThat(remap.apply(0)).isEqualTo(0);
        assertThat(remap.apply(1)).isEqualTo(1);
        assertThat(remap.apply(2)).isEqualTo(5);
        assertThat(remap.apply(3)).isEqualTo(6);
    }

    @Test
    void forDelete_marksRemovedAndCompacts() {
        BitSet deleted = new BitSet();
        deleted.set(1);
        deleted.set(3);

        IndexRemap remap = IndexRemap.forDelete(5, deleted);

        assertThat(remap.apply(0)).isEqualTo(0);
        assertThat(remap.apply(1)).isEqualTo(IndexRemap.REMOVED);
        assertThat(remap.apply(2)).isEqualTo(1);
        assertThat(remap.apply(3)).isEqualTo(IndexRemap.REMOVED);
        assertThat(remap.apply(4)).isEqualTo(2);
    }

    @Test
    void forMove_shiftsInstructionsInBetween() {
        IndexRemap down = IndexRemap.forMove(5, 1, 3);
        IndexRemap up = IndexRemap.forMove(5, 3, 1);

        assertThat(new int[] {down.apply(0), down.apply(1), down.apply(2), down.apply(3), down.apply(4)})
                .containsExactly(0, 3, 1, 2, 4);
        assertThat(new int[] {up.apply(0), up.apply(1), up.apply(2), up.apply(3), up.apply(4)})
                .containsExactly(0, 2, 3, 1, 4);
    }

    @Test
    void forReorder_invertsNewOrder() {
        IndexRemap remap = IndexRemap.forReorder(new int[] {2, 0, 1});

        assertThat(remap.apply(2)).isEqualTo(0);
        assertThat(remap.apply(0)).isEqualTo(1);
        assertThat(remap.apply(1)).isEqualTo(2);
    }

    @Test
    void apply_leavesSentinelsAndOutOfRangeUntouched() {
        IndexRemap remap = IndexRemap.forInsert(3, 0, 10);

        assertThat(remap.apply(ExitPointer.ERROR)).isEqualTo(ExitPointer.ERROR);
        assertThat(remap.apply(ExitPointer.RETURN_TRUE)).isEqualTo(ExitPointer.RETURN_TRUE);
        assertThat(remap.apply(ExitPointer.RETURN_FALSE)).isEqualTo(ExitPointer.RETURN_FALSE);
        assertThat(remap.apply(7)).isEqualTo(7);
    }
}
