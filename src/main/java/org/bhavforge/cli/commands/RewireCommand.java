package org.bhavforge.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.Callable;

import org.bhavforge.analysis.diagnostics.Diagnostic;
import org.bhavforge.cli.output.JsonReports;
import org.bhavforge.editor.rewire.RewireResult;
import org.bhavforge.editor.rewire.RewiringEngine;
import org.bhavforge.runtime.codec.InstructionCodec;
import org.bhavforge.runtime.isa.Instruction;
import org.bhavforge.runtime.model.BehaviorGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Applies one structural edit to a behavior file and writes the re-encoded result.
 * <p>
 * The pointer change log and any warnings are printed; a rejected edit writes nothing and exits with 1.
 */
@Command(
    name = "rewire",
    description = "Insert, delete, move or reorder instructions with automatic pointer fix-up"
)
public class RewireCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RewireCommand.class);

    /**
     * Exactly one edit per invocation.
     */
    static class Edit {
        @Option(
            names = {"--insert"},
            description = "AT:HEX - insert the 12-byte records given in hex before position AT"
        )
        String insert;

        @Option(
            names = {"--delete"},
            split = ",",
            description = "Comma-separated positions to delete"
        )
        List<Integer> delete;

        @Option(
            names = {"--move"},
            description = "FROM:TO - move one instruction"
        )
        String move;

        @Option(
            names = {"--reorder"},
            split = ",",
            description = "New order as comma-separated old positions"
        )
        int[] reorder;

        @Option(
            names = {"--paste"},
            description = "AT:FROM-TO - copy positions FROM..TO and paste them before AT"
        )
        String paste;
    }

    @Mixin
    private GraphFileOptions input;

    @ArgGroup(exclusive = true, multiplicity = "1")
    Edit edit;

    @Option(
        names = {"-o", "--output"},
        required = true,
        description = "File to write the edited behavior to"
    )
    private Path output;

    @Option(
        names = {"--format"},
        defaultValue = "TEXT",
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    private OutputFormat format;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        try {
            BehaviorGraph graph = input.load();
            RewiringEngine engine = new RewiringEngine(graph);
            RewireResult result = apply(engine, graph);

            if (format == OutputFormat.JSON) {
                out.println(JsonReports.toJson(result));
            } else {
                printResult(out, result);
            }
            if (!result.success()) {
                out.flush();
                return 1;
            }

            List<Diagnostic> problems = engine.validate();
            problems.forEach(d -> err.println("Warning: " + d.format()));
            Files.write(output, InstructionCodec.encode(engine.currentGraph()));
            log.info("Wrote {} instruction(s) to {}", engine.size(), output);
            out.flush();
            return 0;
        } catch (Exception e) {
            log.debug("Rewire failed", e);
            err.println("Error: " + e.getMessage());
            return 2;
        }
    }

    private RewireResult apply(RewiringEngine engine, BehaviorGraph graph) throws Exception {
        if (edit.insert != null) {
            String[] parts = splitPair(edit.insert, ":", "--insert");
            int at = Integer.parseInt(parts[0]);
            byte[] raw = HexFormat.of().parseHex(parts[1].replace(" ", ""));
            if (raw.length % InstructionCodec.RECORD_SIZE != 0) {
                throw new IllegalArgumentException("--insert data must be a multiple of "
                        + InstructionCodec.RECORD_SIZE + " bytes");
            }
            List<Instruction> records = new ArrayList<>();
            for (int i = 0; i < raw.length / InstructionCodec.RECORD_SIZE; i++) {
                byte[] record = new byte[InstructionCodec.RECORD_SIZE];
                System.arraycopy(raw, i * InstructionCodec.RECORD_SIZE, record, 0, record.length);
                records.add(InstructionCodec.decodeRecord(at + i, record));
            }
            return engine.insert(at, records);
        }
        if (edit.delete != null) {
            return engine.delete(edit.delete);
        }
        if (edit.move != null) {
            String[] parts = splitPair(edit.move, ":", "--move");
            return engine.move(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        }
        if (edit.reorder != null) {
            return engine.reorder(edit.reorder);
        }
        String[] parts = splitPair(edit.paste, ":", "--paste");
        String[] range = splitPair(parts[1], "-", "--paste");
        int from = Integer.parseInt(range[0]);
        int to = Integer.parseInt(range[1]);
        if (from < 0 || to >= graph.size() || from > to) {
            throw new IllegalArgumentException("--paste range " + from + "-" + to + " is outside the behavior");
        }
        return engine.paste(Integer.parseInt(parts[0]), graph.instructions().subList(from, to + 1));
    }

    private static String[] splitPair(String value, String separator, String option) {
        int index = value.indexOf(separator);
        if (index <= 0 || index == value.length() - 1) {
            throw new IllegalArgumentException(option + " expects A" + separator + "B, got '" + value + "'");
        }
        return new String[] {value.substring(0, index).trim(), value.substring(index + 1).trim()};
    }

    private static void printResult(PrintWriter out, RewireResult result) {
        if (!result.success()) {
            out.println("Edit rejected:");
            result.errors().forEach(e -> out.println("  " + e));
            return;
        }
        out.printf("Edit applied: %d instruction(s)%n", result.instructions().size());
        if (result.changes().isEmpty()) {
            out.println("No pointers changed");
        }
        result.changes().forEach(c -> out.println("  " + c));
        result.warnings().forEach(w -> out.println("  WARNING: " + w));
    }
}
