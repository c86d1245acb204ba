package org.bhavforge.analysis.validation.checks;

import java.util.BitSet;
import java.util.List;
import java.util.Locale;

import org.bhavforge.analysis.diagnostics.Diagnostic;
import org.bhavforge.analysis.diagnostics.DiagnosticCategory;
import org.bhavforge.analysis.validation.IValidationCheck;
import org.bhavforge.analysis.validation.ValidationContext;
import org.bhavforge.runtime.isa.Instruction;
import org.bhavforge.runtime.isa.OpcodeInfo;
import org.bhavforge.runtime.isa.OperandSchema;
import org.bhavforge.runtime.isa.VariableAccess;
import org.bhavforge.runtime.isa.VariableScope;
import org.bhavforge.runtime.isa.VariableSlot;
import org.bhavforge.runtime.model.BehaviorGraph;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;

/**
 * Checks local and argument references against the declared counts, and warns about locals
 * that may be read before any write.
 * <p>
 * The read-before-write analysis is a forward must-analysis from instruction 0: a local counts
 * as written at an instruction only if every path reaching it wrote the local. A true exit is
 * always followed; a false exit only when the opcode may branch. Within one instruction reads
 * happen before writes.
 */
public class VariableScopeCheck implements IValidationCheck {

    @Override
    public String name() {
        return "variable";
    }

    @Override
    public void check(BehaviorGraph graph, ValidationContext context, List<Diagnostic> diagnostics) {
        int size = graph.size();
        if (size == 0) {
            return;
        }
        int locals = graph.localCount();

        BitSet[] reads = new BitSet[size];
        BitSet[] writes = new BitSet[size];
        int[][] successors = new int[size][];
        for (Instruction instruction : graph.instructions()) {
            int pos = instruction.position();
            reads[pos] = new BitSet(locals);
            writes[pos] = new BitSet(locals);
            OpcodeInfo info = context.catalog().lookup(instruction.opcode());
            collectAccesses(graph, instruction, info.operandSchema(), reads[pos], writes[pos], diagnostics);
            successors[pos] = successors(graph, instruction, info.mayBranch());
        }

        BitSet[] written = solveMustWrite(size, locals, writes, successors);

        for (int pos = 0; pos < size; pos++) {
            if (written[pos] == null) {
                continue;
            }
            BitSet uninitialized = (BitSet) reads[pos].clone();
            uninitialized.andNot(written[pos]);
            for (int local = uninitialized.nextSetBit(0); local >= 0; local = uninitialized.nextSetBit(local + 1)) {
                diagnostics.add(Diagnostic.warning(DiagnosticCategory.VARIABLE_UNINITIALIZED, pos,
                        "Local " + local + " may be read before it is written")
                        .withSuggestion("initialize the local before the first branch that reaches this read"));
            }
        }
    }

    private static void collectAccesses(BehaviorGraph graph, Instruction instruction, OperandSchema schema,
                                        BitSet reads, BitSet writes, List<Diagnostic> diagnostics) {
        if (schema == null) {
            return;
        }
        for (VariableSlot slot : schema.slots()) {
            VariableScope scope = slot.scope(instruction);
            if (!scope.isBounded()) {
                continue;
            }
            int index = slot.index(instruction);
            int limit = scope == VariableScope.LOCAL ? graph.localCount() : graph.argumentCount();
            if (index >= limit) {
                diagnostics.add(Diagnostic.error(DiagnosticCategory.VARIABLE_OUT_OF_BOUNDS, instruction.position(),
                        String.format("%s references %s %d but only %d declared", slot.label(),
                                scope.name().toLowerCase(Locale.ROOT), index, limit)));
                continue;
            }
            if (scope == VariableScope.LOCAL) {
                if (slot.effectiveAccess(instruction) == VariableAccess.READ) {
                    reads.set(index);
                } else {
                    writes.set(index);
                }
            }
        }
    }

    private static int[] successors(BehaviorGraph graph, Instruction instruction, boolean mayBranch) {
        int trueExit = instruction.trueExit();
        int falseExit = instruction.falseExit();
        boolean followTrue = graph.isValidTarget(trueExit);
        boolean followFalse = mayBranch && falseExit != trueExit && graph.isValidTarget(falseExit);
        if (followTrue && followFalse) {
            return new int[] {trueExit, falseExit};
        }
        if (followTrue) {
            return new int[] {trueExit};
        }
        if (followFalse) {
            return new int[] {falseExit};
        }
        return new int[0];
    }

    /**
     * Computes, per instruction, the locals written on every path from the entry to it.
     * Unreachable instructions get {@code null}.
     */
    private static BitSet[] solveMustWrite(int size, int locals, BitSet[] writes, int[][] successors) {
        BitSet[] in = new BitSet[size];
        in[0] = new BitSet(locals);
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(0);
        while (!queue.isEmpty()) {
            int pos = queue.dequeueInt();
            BitSet out = (BitSet) in[pos].clone();
            out.or(writes[pos]);
            for (int next : successors[pos]) {
                BitSet merged;
                if (in[next] == null) {
                    merged = (BitSet) out.clone();
                } else {
                    merged = (BitSet) in[next].clone();
                    merged.and(out);
                }
                if (next == 0) {
                    merged.clear();
                }
                if (in[next] == null || !merged.equals(in[next])) {
                    in[next] = merged;
                    queue.enqueue(next);
                }
            }
        }
        return in;
    }
}
