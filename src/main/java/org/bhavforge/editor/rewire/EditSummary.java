package org.bhavforge.editor.rewire;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Difference between an engine's current sequence and the snapshot it was created from.
 *
 * @param originalCount  instruction count of the snapshot
 * @param currentCount   current instruction count
 * @param inserted       current positions of instructions that did not exist in the snapshot
 * @param deleted        snapshot positions of instructions that no longer exist
 * @param relocated      snapshot position to current position, for survivors whose index changed
 * @param pointerChanges exits of survivors that no longer point where the snapshot pointed
 */
public record EditSummary(int originalCount, int currentCount, List<Integer> inserted, List<Integer> deleted,
                          Map<Integer, Integer> relocated, List<String> pointerChanges) {

    public EditSummary {
        inserted = List.copyOf(inserted);
        deleted = List.copyOf(deleted);
        relocated = Collections.unmodifiableMap(new TreeMap<>(relocated));
        pointerChanges = List.copyOf(pointerChanges);
    }

    public int countChange() {
        return currentCount - originalCount;
    }

    public boolean isUnchanged() {
        return inserted.isEmpty() && deleted.isEmpty() && relocated.isEmpty() && pointerChanges.isEmpty();
    }
}
