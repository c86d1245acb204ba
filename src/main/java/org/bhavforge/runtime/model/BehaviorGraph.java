package org.bhavforge.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.bhavforge.runtime.isa.ExitPointer;
import org.bhavforge.runtime.isa.Instruction;

/**
 * An immutable behavior program: an ordered list of instructions plus the variable counts
 * declared in its header.
 * <p>
 * Positions are derived from list order: the constructor renumbers every instruction to its
 * index, so {@code get(i).position() == i} always holds. Successor pointers are taken as
 * given; out-of-range pointers are representable and reported by the validator.
 */
public final class BehaviorGraph {

    /** Pointer values 253-255 are sentinels, so a graph can address at most 253 instructions. */
    public static final int MAX_INSTRUCTIONS = ExitPointer.ERROR;

    private final int id;
    private final int localCount;
    private final int argumentCount;
    private final List<Instruction> instructions;

    /**
     * Creates a graph.
     *
     * @param id            behavior id (0-65535)
     * @param localCount    number of declared locals
     * @param argumentCount number of declared arguments
     * @param instructions  instructions in execution-index order
     * @throws IllegalArgumentException if a count is negative or there are too many instructions
     */
    public BehaviorGraph(int id, int localCount, int argumentCount, List<Instruction> instructions) {
        if (id < 0 || id > Instruction.MAX_OPCODE) {
            throw new IllegalArgumentException("Behavior id must be between 0 and " + Instruction.MAX_OPCODE + ", got: " + id);
        }
        if (localCount < 0 || argumentCount < 0) {
            throw new IllegalArgumentException("Variable counts must be non-negative, got locals=" + localCount
                    + ", args=" + argumentCount);
        }
        Objects.requireNonNull(instructions, "instructions");
        if (instructions.size() > MAX_INSTRUCTIONS) {
            throw new IllegalArgumentException("A behavior holds at most " + MAX_INSTRUCTIONS
                    + " instructions, got: " + instructions.size());
        }
        this.id = id;
        this.localCount = localCount;
        this.argumentCount = argumentCount;
        List<Instruction> renumbered = new ArrayList<>(instructions.size());
        for (int i = 0; i < instructions.size(); i++) {
            renumbered.add(instructions.get(i).withPosition(i));
        }
        this.instructions = Collections.unmodifiableList(renumbered);
    }

    public int id() {
        return id;
    }

    public int localCount() {
        return localCount;
    }

    public int argumentCount() {
        return argumentCount;
    }

    public List<Instruction> instructions() {
        return instructions;
    }

    public Instruction get(int position) {
        return instructions.get(position);
    }

    public int size() {
        return instructions.size();
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    public BehaviorScope scope() {
        return BehaviorScope.fromId(id);
    }

    /**
     * Checks whether a pointer addresses an instruction of this graph.
     *
     * @param pointer the pointer value
     * @return true if it is a valid index
     */
    public boolean isValidTarget(int pointer) {
        return ExitPointer.isInBounds(pointer, instructions.size());
    }

    /**
     * Returns a graph with the same header and different instructions.
     *
     * @param newInstructions the replacement instructions
     * @return the new graph
     */
    public BehaviorGraph withInstructions(List<Instruction> newInstructions) {
        return new BehaviorGraph(id, localCount, argumentCount, newInstructions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BehaviorGraph other)) {
            return false;
        }
        return id == other.id && localCount == other.localCount && argumentCount == other.argumentCount
                && instructions.equals(other.instructions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, localCount, argumentCount, instructions);
    }

    @Override
    public String toString() {
        return String.format("BehaviorGraph[id=0x%04X, instructions=%d, locals=%d, args=%d]",
                id, instructions.size(), localCount, argumentCount);
    }
}
