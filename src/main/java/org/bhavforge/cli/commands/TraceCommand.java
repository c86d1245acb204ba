package org.bhavforge.cli.commands;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.bhavforge.analysis.callgraph.CallGraph;
import org.bhavforge.analysis.callgraph.CallGraphBuilder;
import org.bhavforge.cli.CommandLineInterface;
import org.bhavforge.cli.config.EngineSettings;
import org.bhavforge.cli.output.JsonReports;
import org.bhavforge.runtime.codec.PackageLoader;
import org.bhavforge.runtime.model.BehaviorGraph;
import org.bhavforge.runtime.model.BehaviorPackage;
import org.bhavforge.runtime.trace.ExecutionTrace;
import org.bhavforge.runtime.trace.ExecutionTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Statically traces a behavior, optionally following subroutine calls within a package.
 */
@Command(
    name = "trace",
    description = "Explore every execution path of a behavior"
)
public class TraceCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TraceCommand.class);

    /**
     * Either a single behavior file or a package directory, not both.
     */
    static class Source {
        @Option(
            names = {"-f", "--file"},
            description = "Raw behavior file; calls are treated as opaque"
        )
        Path file;

        @Option(
            names = {"-p", "--package"},
            description = "Package directory; subroutine calls inside the package are followed"
        )
        Path packageDir;
    }

    @ArgGroup(exclusive = true, multiplicity = "1")
    Source source;

    @Option(
        names = {"--id"},
        description = "Behavior id (required with --package; default for --file: parsed from the file name)"
    )
    private Integer id;

    @Option(
        names = {"--entry"},
        defaultValue = "0",
        description = "Entry position (default: ${DEFAULT-VALUE})"
    )
    private int entry;

    @Option(
        names = {"--steps"},
        description = "Print every traced step"
    )
    private boolean printSteps;

    @Option(
        names = {"--format"},
        defaultValue = "TEXT",
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    private OutputFormat format;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        try {
            EngineSettings settings = parent.getSettings();
            ExecutionTracer tracer = new ExecutionTracer(settings.catalog(), settings.tracer());
            ExecutionTrace trace;
            if (source.packageDir != null) {
                if (id == null) {
                    err.println("Error: --id is required with --package");
                    return 2;
                }
                BehaviorPackage pkg = PackageLoader.load(source.packageDir);
                CallGraph calls = new CallGraphBuilder(settings.catalog()).build(pkg);
                trace = tracer.trace(pkg, calls, id, entry);
            } else {
                GraphFileOptions fileOptions = new GraphFileOptions();
                fileOptions.file = source.file;
                fileOptions.id = id;
                BehaviorGraph graph = fileOptions.load();
                trace = tracer.trace(graph, entry);
            }

            if (format == OutputFormat.JSON) {
                out.println(JsonReports.toJson(trace));
            } else {
                out.print(trace.formatSummary());
                if (printSteps) {
                    out.print(trace.formatSteps());
                }
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.debug("Trace failed", e);
            err.println("Error: " + e.getMessage());
            return 2;
        }
    }
}
