package org.bhavforge.cli.commands;

import org.bhavforge.cli.CommandLineInterface;
import org.bhavforge.runtime.codec.InstructionCodec;
import org.bhavforge.runtime.isa.ExitPointer;
import org.bhavforge.runtime.isa.Instruction;
import org.bhavforge.runtime.model.BehaviorGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the rewire command end to end: parse the edit, apply it, print the change log and write the result.
 * <p>
 * Fixture: {@code 0: Expression 1/F}, {@code 1: Sleep 2/2}, {@code 2: Sleep T/T}.
 */
@Tag("unit")
class RewireCommandTest {

    private static final int T = ExitPointer.RETURN_TRUE;
    private static final int F = ExitPointer.RETURN_FALSE;

    @TempDir
    Path tempDir;

    private Path input;
    private Path output;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void writeBehavior() throws Exception {
        input = tempDir.resolve("4096.bhav");
        output = tempDir.resolve("edited.bhav");
        Files.write(input, InstructionCodec.encode(List.of(
                Instruction.of(0, 2, 1, F),
                Instruction.of(1, 0, 2, 2),
                Instruction.of(2, 0, T, T))));
    }

    @Test
    void rewire_deleteRedirectsDanglingPointersToError() throws Exception {
        int exitCode = run("rewire", "-f", input.toString(), "--delete", "1", "-o", output.toString());

        assertThat(exitCode)
            .describedAs("stderr: %s", err)
            .isEqualTo(0);
        assertThat(out.toString())
            .contains("Edit applied: 2 instruction(s)")
            .contains("  WARNING: Instruction 0 true pointer to deleted instruction -> ERROR");

        BehaviorGraph edited = read(output);
        assertThat(edited.size()).isEqualTo(2);
        assertThat(edited.get(0).trueExit()).isEqualTo(ExitPointer.ERROR);
        assertThat(edited.get(0).falseExit()).isEqualTo(F);
        assertThat(edited.get(1).trueExit()).isEqualTo(T);
    }

    @Test
    void rewire_insertShiftsPointersPastTheInsertionPoint() throws Exception {
        int exitCode = run("rewire", "-f", input.toString(), "--insert", "0:0000FEFE0000000000000000",
                "-o", output.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
            .contains("  Instruction 0 true: 1 -> 2")
            .contains("  Instruction 1 true: 2 -> 3")
            .contains("  Instruction 1 false: 2 -> 3");

        BehaviorGraph edited = read(output);
        assertThat(edited.size()).isEqualTo(4);
        assertThat(edited.get(0).opcode()).isZero();
        assertThat(edited.get(0).trueExit()).isEqualTo(T);
        assertThat(edited.get(1).trueExit()).isEqualTo(2);
    }

    @Test
    void rewire_pasteAppendsRebasedCopy() throws Exception {
        int exitCode = run("rewire", "-f", input.toString(), "--paste", "3:1-2", "-o", output.toString());

        assertThat(exitCode)
            .describedAs("stderr: %s", err)
            .isEqualTo(0);
        BehaviorGraph edited = read(output);
        assertThat(edited.size()).isEqualTo(5);
        assertThat(edited.get(3).trueExit()).isEqualTo(4);
        assertThat(edited.get(4).trueExit()).isEqualTo(T);
    }

    @Test
    void rewire_rejectedEditWritesNothing() {
        int exitCode = run("rewire", "-f", input.toString(), "--reorder", "0,0,1", "-o", output.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
            .contains("Edit rejected:")
            .contains("Invalid order: must contain each index exactly once");
        assertThat(output).doesNotExist();
    }

    @Test
    void rewire_malformedMoveExitsWithTwo() {
        int exitCode = run("rewire", "-f", input.toString(), "--move", "1", "-o", output.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--move expects A:B");
        assertThat(output).doesNotExist();
    }

    @Test
    void rewire_acceptsExactlyOneEdit() {
        int exitCode = run("rewire", "-f", input.toString(), "--delete", "1", "--move", "0:1",
                "-o", output.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("mutually exclusive");
    }

    private static BehaviorGraph read(Path file) throws Exception {
        return InstructionCodec.decode(0x1000, Files.readAllBytes(file), 0, 0);
    }

    private int run(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out, true));
        cmdLine.setErr(new PrintWriter(err, true));
        return cmdLine.execute(args);
    }
}
