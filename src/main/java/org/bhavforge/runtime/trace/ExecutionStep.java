package org.bhavforge.runtime.trace;

/**
 * One instruction visited by the tracer.
 *
 * @param graphId     behavior the instruction belongs to
 * @param position    instruction index
 * @param opcode      instruction opcode
 * @param branch      exit taken
 * @param stackBefore abstract stack depth before the instruction
 * @param stackAfter  abstract stack depth after the instruction, never negative
 * @param callDepth   number of subroutine frames active, 0 in the entry behavior
 * @param pathIndex   index of the explored path, 0 for the primary path
 */
public record ExecutionStep(int graphId, int position, int opcode, BranchTaken branch,
                            int stackBefore, int stackAfter, int callDepth, int pathIndex) {

    public String format() {
        return String.format("%s[%d] 0x%04X:%-3d op=0x%04X %-5s stack %d->%d",
                "  ".repeat(callDepth), pathIndex, graphId, position, opcode, branch, stackBefore, stackAfter);
    }
}
