package org.bhavforge.cli.commands;

import java.util.concurrent.Callable;

import org.bhavforge.cli.CommandLineInterface;
import org.bhavforge.runtime.codec.Disassembler;
import org.bhavforge.runtime.model.BehaviorGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints a listing of a behavior file.
 */
@Command(
    name = "disasm",
    description = "Print the instruction listing of a behavior"
)
public class DisassembleCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DisassembleCommand.class);

    @Mixin
    private GraphFileOptions input;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        try {
            BehaviorGraph graph = input.load();
            out.print(new Disassembler(parent.getSettings().catalog()).disassemble(graph));
            out.flush();
            return 0;
        } catch (Exception e) {
            log.debug("Disassembly failed", e);
            err.println("Error: " + e.getMessage());
            return 2;
        }
    }
}
