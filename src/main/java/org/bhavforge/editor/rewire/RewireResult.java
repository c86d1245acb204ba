package org.bhavforge.editor.rewire;

import java.util.List;

import org.bhavforge.runtime.isa.Instruction;

/**
 * Outcome of one rewiring operation.
 * <p>
 * On failure {@link #instructions()} is the unchanged sequence and {@link #errors()} explains why.
 *
 * @param success      whether the edit was applied
 * @param instructions the instruction sequence after the operation
 * @param changes      pointer change log, e.g. {@code "Instruction 3 true: 5 -> 6"}
 * @param warnings     non-fatal findings, e.g. pointers redirected to ERROR
 * @param errors       precondition failures; empty on success
 */
public record RewireResult(boolean success, List<Instruction> instructions, List<String> changes,
                           List<String> warnings, List<String> errors) {

    public RewireResult {
        instructions = List.copyOf(instructions);
        changes = List.copyOf(changes);
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
    }

    static RewireResult applied(List<Instruction> instructions, List<String> changes, List<String> warnings) {
        return new RewireResult(true, instructions, changes, warnings, List.of());
    }

    static RewireResult rejected(List<Instruction> unchanged, String error) {
        return new RewireResult(false, unchanged, List.of(), List.of(), List.of(error));
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
