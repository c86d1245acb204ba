package org.bhavforge.editor.rewire;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.bhavforge.analysis.diagnostics.Diagnostic;
import org.bhavforge.analysis.diagnostics.DiagnosticCategory;
import org.bhavforge.runtime.isa.ExitPointer;
import org.bhavforge.runtime.isa.Instruction;
import org.bhavforge.runtime.model.BehaviorGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Structural editor that keeps every successor pointer consistent across insert, delete,
 * move and reorder operations.
 * <p>
 * Each operation computes an {@link IndexRemap} and applies it to the exits of every
 * surviving instruction. Sentinel exits are never touched. Exits that were already out of range
 * before the operation become {@link ExitPointer#ERROR}, as do exits to deleted instructions;
 * both are reported as warnings and changes. Operations are transactional:
 * a failed precondition returns a rejected {@link RewireResult} and leaves the sequence as it was.
 * <p>
 * The engine keeps an immutable snapshot of the graph it was created with, for
 * {@link #reset()} and {@link #changesFromOriginal()}. Log entries name instructions by their
 * index before the operation.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Use one engine per graph and thread.
 */
public class RewiringEngine {

    private static final Logger log = LoggerFactory.getLogger(RewiringEngine.class);

    private static final int INSERTED = -1;

    private final BehaviorGraph original;
    private List<Instruction> current;
    private IntList origins;

    public RewiringEngine(BehaviorGraph graph) {
        this.original = graph;
        reset();
    }

    /**
     * Restores the snapshot taken at construction.
     */
    public void reset() {
        this.current = new ArrayList<>(original.instructions());
        this.origins = new IntArrayList(original.size());
        for (int i = 0; i < original.size(); i++) {
            origins.add(i);
        }
    }

    public List<Instruction> instructions() {
        return List.copyOf(current);
    }

    public int size() {
        return current.size();
    }

    public BehaviorGraph original() {
        return original;
    }

    /**
     * Wraps the current sequence in a graph with the snapshot's id and variable counts.
     *
     * @return the current graph
     */
    public BehaviorGraph currentGraph() {
        return original.withInstructions(current);
    }

    /**
     * Inserts instructions before {@code at}.
     * <p>
     * Existing exits are shifted; the new instructions are spliced in verbatim, so their exits
     * must already use post-insert indices.
     *
     * @param at               insertion index in {@code [0, size]}
     * @param newInstructions  instructions to insert
     * @return the result
     */
    public RewireResult insert(int at, List<Instruction> newInstructions) {
        int length = current.size();
        if (at < 0 || at > length) {
            return reject("Invalid insert index " + at + " (instruction count " + length + ")");
        }
        if (length + newInstructions.size() > BehaviorGraph.MAX_INSTRUCTIONS) {
            return reject("Insert would grow the behavior to " + (length + newInstructions.size())
                    + " instructions, limit is " + BehaviorGraph.MAX_INSTRUCTIONS);
        }
        if (newInstructions.isEmpty()) {
            return RewireResult.applied(current, List.of(), List.of());
        }

        IndexRemap remap = IndexRemap.forInsert(length, at, newInstructions.size());
        List<String> changes = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<Instruction> rewired = remapAll(remap, new BitSet(), changes, warnings);

        List<Instruction> next = new ArrayList<>(length + newInstructions.size());
        next.addAll(rewired.subList(0, at));
        next.addAll(newInstructions);
        next.addAll(rewired.subList(at, length));

        IntList nextOrigins = new IntArrayList(origins.subList(0, at));
        for (int i = 0; i < newInstructions.size(); i++) {
            nextOrigins.add(INSERTED);
        }
        nextOrigins.addAll(origins.subList(at, length));

        log.debug("Inserted {} instruction(s) at {} in behavior {}, {} pointer(s) updated",
                newInstructions.size(), at, original.id(), changes.size());
        return commit(next, nextOrigins, changes, warnings);
    }

    /**
     * Deletes a set of instructions. Exits that pointed at a deleted instruction become
     * {@link ExitPointer#ERROR} and are reported as warnings.
     * <p>
     * Duplicate indices are ignored; an empty collection is a successful no-op.
     *
     * @param indices indices to delete
     * @return the result
     */
    public RewireResult delete(Collection<Integer> indices) {
        int length = current.size();
        BitSet deleted = new BitSet(length);
        for (Integer index : indices) {
            if (index == null || index < 0 || index >= length) {
                return reject("Invalid delete index " + index + " (instruction count " + length + ")");
            }
            deleted.set(index);
        }
        if (deleted.isEmpty()) {
            return RewireResult.applied(current, List.of(), List.of());
        }

        IndexRemap remap = IndexRemap.forDelete(length, deleted);
        List<String> changes = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<Instruction> rewired = remapAll(remap, deleted, changes, warnings);

        List<Instruction> next = new ArrayList<>(length - deleted.cardinality());
        IntList nextOrigins = new IntArrayList(length - deleted.cardinality());
        for (int i = 0; i < length; i++) {
            if (!deleted.get(i)) {
                next.add(rewired.get(i));
                nextOrigins.add(origins.getInt(i));
            }
        }

        log.debug("Deleted {} instruction(s) from behavior {}, {} pointer(s) redirected to ERROR",
                deleted.cardinality(), original.id(), warnings.size());
        return commit(next, nextOrigins, changes, warnings);
    }

    public RewireResult delete(int... indices) {
        List<Integer> boxed = new ArrayList<>(indices.length);
        for (int index : indices) {
            boxed.add(index);
        }
        return delete(boxed);
    }

    /**
     * Moves one instruction; the instructions in between shift one slot toward the vacated position.
     *
     * @param from current index
     * @param to   target index
     * @return the result
     */
    public RewireResult move(int from, int to) {
        int length = current.size();
        if (from < 0 || from >= length) {
            return reject("Invalid move source " + from + " (instruction count " + length + ")");
        }
        if (to < 0 || to >= length) {
            return reject("Invalid move target " + to + " (instruction count " + length + ")");
        }
        if (from == to) {
            return RewireResult.applied(current, List.of(), List.of());
        }

        IndexRemap remap = IndexRemap.forMove(length, from, to);
        List<String> changes = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<Instruction> next = new ArrayList<>(remapAll(remap, new BitSet(), changes, warnings));
        IntList nextOrigins = new IntArrayList(origins);

        next.add(to, next.remove(from));
        nextOrigins.add(to, nextOrigins.removeInt(from));

        log.debug("Moved instruction {} to {} in behavior {}", from, to, original.id());
        return commit(next, nextOrigins, changes, warnings);
    }

    /**
     * Applies an arbitrary permutation.
     *
     * @param newOrder {@code newOrder[newIndex] = oldIndex}; must contain every index exactly once
     * @return the result
     */
    public RewireResult reorder(int[] newOrder) {
        int length = current.size();
        if (newOrder.length != length) {
            return reject("Order length " + newOrder.length + " doesn't match instruction count " + length);
        }
        BitSet seen = new BitSet(length);
        for (int oldIndex : newOrder) {
            if (oldIndex < 0 || oldIndex >= length || seen.get(oldIndex)) {
                return reject("Invalid order: must contain each index exactly once");
            }
            seen.set(oldIndex);
        }

        IndexRemap remap = IndexRemap.forReorder(newOrder);
        List<String> changes = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<Instruction> rewired = remapAll(remap, new BitSet(), changes, warnings);

        List<Instruction> next = new ArrayList<>(length);
        IntList nextOrigins = new IntArrayList(length);
        for (int oldIndex : newOrder) {
            next.add(rewired.get(oldIndex));
            nextOrigins.add(origins.getInt(oldIndex));
        }

        log.debug("Reordered behavior {}, {} pointer(s) updated", original.id(), changes.size());
        return commit(next, nextOrigins, changes, warnings);
    }

    /**
     * Pastes a block copied from this or another behavior.
     * <p>
     * Block instructions keep the positions they had where they were copied from. Exits that
     * target another block member are rebased to the paste location; exits that leave the block
     * become {@link ExitPointer#ERROR} with a warning.
     *
     * @param at    insertion index in {@code [0, size]}
     * @param block copied instructions, with their source positions
     * @return the result
     */
    public RewireResult paste(int at, List<Instruction> block) {
        Map<Integer, Integer> rebase = new HashMap<>();
        for (int k = 0; k < block.size(); k++) {
            if (rebase.put(block.get(k).position(), at + k) != null) {
                return reject("Pasted block contains source position " + block.get(k).position() + " more than once");
            }
        }

        List<String> pasteWarnings = new ArrayList<>();
        List<Instruction> rebased = new ArrayList<>(block.size());
        for (int k = 0; k < block.size(); k++) {
            Instruction source = block.get(k);
            int trueExit = rebaseExit(source.trueExit(), rebase, k, "true", pasteWarnings);
            int falseExit = rebaseExit(source.falseExit(), rebase, k, "false", pasteWarnings);
            rebased.add(source.withExits(trueExit, falseExit).withPosition(at + k));
        }

        RewireResult inserted = insert(at, rebased);
        if (!inserted.success()) {
            return inserted;
        }
        List<String> warnings = new ArrayList<>(pasteWarnings);
        warnings.addAll(inserted.warnings());
        return new RewireResult(true, inserted.instructions(), inserted.changes(), warnings, List.of());
    }

    /**
     * Checks that every non-sentinel exit addresses an existing instruction.
     *
     * @return one error per dangling exit; empty if the sequence is consistent
     */
    public List<Diagnostic> validate() {
        List<Diagnostic> problems = new ArrayList<>();
        int length = current.size();
        for (int i = 0; i < length; i++) {
            Instruction instruction = current.get(i);
            checkExit(problems, i, "true", instruction.trueExit(), length);
            checkExit(problems, i, "false", instruction.falseExit(), length);
        }
        return problems;
    }

    /**
     * Compares the current sequence with the snapshot.
     * <p>
     * An exit counts as changed when it does not point where the snapshot exit would point
     * after following every edit, i.e. when it was redirected by a delete or edited by hand.
     *
     * @return the difference
     */
    public EditSummary changesFromOriginal() {
        int[] currentPositionOf = new int[original.size()];
        Arrays.fill(currentPositionOf, IndexRemap.REMOVED);
        List<Integer> inserted = new ArrayList<>();
        Map<Integer, Integer> relocated = new HashMap<>();
        for (int pos = 0; pos < current.size(); pos++) {
            int origin = origins.getInt(pos);
            if (origin == INSERTED) {
                inserted.add(pos);
            } else {
                currentPositionOf[origin] = pos;
                if (origin != pos) {
                    relocated.put(origin, pos);
                }
            }
        }

        List<Integer> deleted = new ArrayList<>();
        for (int i = 0; i < currentPositionOf.length; i++) {
            if (currentPositionOf[i] == IndexRemap.REMOVED) {
                deleted.add(i);
            }
        }

        List<String> pointerChanges = new ArrayList<>();
        for (int pos = 0; pos < current.size(); pos++) {
            int origin = origins.getInt(pos);
            if (origin == INSERTED) {
                continue;
            }
            Instruction before = original.get(origin);
            Instruction now = current.get(pos);
            comparePointer(pointerChanges, pos, "true", before.trueExit(), now.trueExit(), currentPositionOf);
            comparePointer(pointerChanges, pos, "false", before.falseExit(), now.falseExit(), currentPositionOf);
        }

        return new EditSummary(original.size(), current.size(), inserted, deleted, relocated, pointerChanges);
    }

    private void comparePointer(List<String> out, int pos, String branch, int originalTarget, int now,
                                int[] currentPositionOf) {
        if (ExitPointer.isSentinel(originalTarget) || originalTarget >= currentPositionOf.length) {
            if (originalTarget != now) {
                out.add("Instruction " + pos + " " + branch + ": " + ExitPointer.describe(originalTarget)
                        + " -> " + ExitPointer.describe(now));
            }
            return;
        }
        int expected = currentPositionOf[originalTarget];
        if (expected == IndexRemap.REMOVED) {
            out.add("Instruction " + pos + " " + branch + ": " + originalTarget + " (deleted) -> "
                    + ExitPointer.describe(now));
        } else if (expected != now) {
            out.add("Instruction " + pos + " " + branch + ": " + expected + " -> " + ExitPointer.describe(now));
        }
    }

    private List<Instruction> remapAll(IndexRemap remap, BitSet skipped, List<String> changes,
                                       List<String> warnings) {
        List<Instruction> rewired = new ArrayList<>(current.size());
        for (int i = 0; i < current.size(); i++) {
            Instruction instruction = current.get(i);
            if (skipped.get(i)) {
                rewired.add(instruction);
                continue;
            }
            int trueExit = remapExit(remap, i, "true", instruction.trueExit(), current.size(), changes, warnings);
            int falseExit = remapExit(remap, i, "false", instruction.falseExit(), current.size(), changes, warnings);
            rewired.add(instruction.withExits(trueExit, falseExit));
        }
        return rewired;
    }

    private static int remapExit(IndexRemap remap, int index, String branch, int pointer, int length,
                                 List<String> changes, List<String> warnings) {
        // An out-of-range pointer could land on a real instruction once the behavior grows.
        if (!ExitPointer.isSentinel(pointer) && pointer >= length) {
            warnings.add("Instruction " + index + " " + branch + " pointer " + pointer + " is out of range -> ERROR");
            changes.add("Instruction " + index + " " + branch + ": " + pointer + " -> ERROR");
            return ExitPointer.ERROR;
        }
        int mapped = remap.apply(pointer);
        if (mapped == IndexRemap.REMOVED) {
            warnings.add("Instruction " + index + " " + branch + " pointer to deleted instruction -> ERROR");
            changes.add("Instruction " + index + " " + branch + ": " + pointer + " -> ERROR");
            return ExitPointer.ERROR;
        }
        if (mapped != pointer) {
            changes.add("Instruction " + index + " " + branch + ": " + pointer + " -> " + mapped);
        }
        return mapped;
    }

    private static int rebaseExit(int pointer, Map<Integer, Integer> rebase, int blockIndex, String branch,
                                  List<String> warnings) {
        if (ExitPointer.isSentinel(pointer)) {
            return pointer;
        }
        Integer target = rebase.get(pointer);
        if (target == null) {
            warnings.add("Pasted instruction " + blockIndex + " " + branch + " pointer " + pointer
                    + " leaves the copied block -> ERROR");
            return ExitPointer.ERROR;
        }
        return target;
    }

    private static void checkExit(List<Diagnostic> problems, int index, String branch, int pointer, int length) {
        if (!ExitPointer.isSentinel(pointer) && pointer >= length) {
            problems.add(Diagnostic.error(DiagnosticCategory.INVALID_BRANCH_TARGET, index,
                    "Instruction " + index + " " + branch + " pointer " + pointer + " is out of range (0-"
                            + (length - 1) + ")"));
        }
    }

    private RewireResult commit(List<Instruction> next, IntList nextOrigins, List<String> changes,
                                List<String> warnings) {
        List<Instruction> renumbered = new ArrayList<>(next.size());
        for (int i = 0; i < next.size(); i++) {
            renumbered.add(next.get(i).withPosition(i));
        }
        this.current = renumbered;
        this.origins = nextOrigins;
        for (String warning : warnings) {
            log.warn("Behavior {}: {}", original.id(), warning);
        }
        return RewireResult.applied(renumbered, changes, warnings);
    }

    private RewireResult reject(String error) {
        log.debug("Rejected edit on behavior {}: {}", original.id(), error);
        return RewireResult.rejected(current, error);
    }
}
