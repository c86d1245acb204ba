package org.bhavforge.editor.rewire;

import java.util.Arrays;
import java.util.BitSet;

import org.bhavforge.runtime.isa.ExitPointer;

/**
 * Total mapping from pre-edit to post-edit instruction indices.
 * <p>
 * Sentinels always map to themselves. Indices outside the pre-edit range (corrupt pointers)
 * are left untouched; the validator reports them. Deleted indices map to {@link #REMOVED}.
 */
public final class IndexRemap {

    /** Marker for an index whose instruction no longer exists. */
    public static final int REMOVED = -1;

    private final int[] mapping;

    private IndexRemap(int[] mapping) {
        this.mapping = mapping;
    }

    /**
     * Mapping for inserting {@code count} instructions before {@code at}.
     *
     * @param length pre-edit instruction count
     * @param at     insertion index
     * @param count  number of inserted instructions
     * @return the mapping {@code i < at -> i}, {@code i >= at -> i + count}
     */
    public static IndexRemap forInsert(int length, int at, int count) {
        int[] mapping = new int[length];
        for (int i = 0; i < length; i++) {
            mapping[i] = i < at ? i : i + count;
        }
        return new IndexRemap(mapping);
    }

    /**
     * Mapping for deleting a set of indices; survivors compact downward.
     *
     * @param length  pre-edit instruction count
     * @param deleted indices to delete, all within {@code [0, length)}
     * @return the mapping
     */
    public static IndexRemap forDelete(int length, BitSet deleted) {
        int[] mapping = new int[length];
        int next = 0;
        for (int i = 0; i < length; i++) {
            mapping[i] = deleted.get(i) ? REMOVED : next++;
        }
        return new IndexRemap(mapping);
    }

    /**
     * Mapping for moving one instruction; the instructions in between shift one slot toward
     * the vacated position.
     *
     * @param length pre-edit instruction count
     * @param from   current index of the moved instruction
     * @param to     index it ends up at
     * @return the mapping
     */
    public static IndexRemap forMove(int length, int from, int to) {
        int[] mapping = new int[length];
        for (int i = 0; i < length; i++) {
            if (i == from) {
                mapping[i] = to;
            } else if (from < to && i > from && i <= to) {
                mapping[i] = i - 1;
            } else if (from > to && i >= to && i < from) {
                mapping[i] = i + 1;
            } else {
                mapping[i] = i;
            }
        }
        return new IndexRemap(mapping);
    }

    /**
     * Mapping for a permutation given as {@code newOrder[newIndex] = oldIndex}.
     *
     * @param newOrder a permutation of {@code [0, newOrder.length)}
     * @return the mapping {@code old -> new}
     */
    public static IndexRemap forReorder(int[] newOrder) {
        int[] mapping = new int[newOrder.length];
        for (int newIndex = 0; newIndex < newOrder.length; newIndex++) {
            mapping[newOrder[newIndex]] = newIndex;
        }
        return new IndexRemap(mapping);
    }

    /**
     * Maps a successor pointer.
     *
     * @param pointer pre-edit pointer value
     * @return post-edit value, {@link #REMOVED} if the target was deleted; sentinels and
     *         out-of-range pointers are returned unchanged
     */
    public int apply(int pointer) {
        if (ExitPointer.isSentinel(pointer) || pointer < 0 || pointer >= mapping.length) {
            return pointer;
        }
        return mapping[pointer];
    }

    public int length() {
        return mapping.length;
    }

    @Override
    public String toString() {
        return "IndexRemap" + Arrays.toString(mapping);
    }
}
