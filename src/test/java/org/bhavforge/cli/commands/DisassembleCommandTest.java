package org.bhavforge.cli.commands;

import org.bhavforge.cli.CommandLineInterface;
import org.bhavforge.runtime.codec.InstructionCodec;
import org.bhavforge.runtime.isa.ExitPointer;
import org.bhavforge.runtime.isa.Instruction;
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
 * Smoke tests for the disasm command.
 */
@Tag("unit")
class DisassembleCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testCommandIsRegistered() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKeys("disasm", "validate", "analyze", "trace", "callgraph", "rewire");
    }

    @Test
    void testListingUsesOpcodeNamesAndDeclaredVariables() throws Exception {
        Path file = tempDir.resolve("0x2000.bhav");
        Files.write(file, InstructionCodec.encode(List.of(
                Instruction.of(0, 2, 1, ExitPointer.RETURN_FALSE),
                Instruction.of(1, 0, ExitPointer.RETURN_TRUE, ExitPointer.RETURN_TRUE))));

        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("disasm", "-f", file.toString(), "--locals", "3", "--args", "1");

        assertThat(exitCode)
            .describedAs("stderr: %s", err)
            .isEqualTo(0);
        assertThat(out.toString())
            .contains("; behavior 0x2000 (SEMI_GLOBAL) - 2 instructions, 3 locals, 1 args")
            .contains("Expression")
            .contains("Sleep");
    }

    @Test
    void testTruncatedFileIsReported() throws Exception {
        Path file = tempDir.resolve("4096.bhav");
        Files.write(file, new byte[] {0x02, 0x00, 0x01});

        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("disasm", "-f", file.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).startsWith("Error:");
    }
}
