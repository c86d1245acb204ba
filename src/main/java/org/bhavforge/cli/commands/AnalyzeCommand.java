package org.bhavforge.cli.commands;

import java.util.concurrent.Callable;

import org.bhavforge.analysis.flow.AnalyzerOptions;
import org.bhavforge.analysis.flow.FlowAnalyzer;
import org.bhavforge.analysis.flow.FlowReport;
import org.bhavforge.cli.CommandLineInterface;
import org.bhavforge.cli.config.EngineSettings;
import org.bhavforge.cli.output.JsonReports;
import org.bhavforge.runtime.model.BehaviorGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Reports dead code, loops, hot spots and complexity of a behavior.
 */
@Command(
    name = "analyze",
    description = "Report dead code, loops and complexity of a behavior"
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Mixin
    private GraphFileOptions input;

    @Option(
        names = {"--format"},
        defaultValue = "TEXT",
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    private OutputFormat format;

    @Option(
        names = {"--fallthrough"},
        description = "Treat position + 1 as a successor when computing reachability"
    )
    private boolean fallthrough;

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
            AnalyzerOptions options = fallthrough
                    ? settings.analyzer().withFollowFallthrough(true)
                    : settings.analyzer();
            BehaviorGraph graph = input.load();
            FlowReport report = new FlowAnalyzer(settings.catalog(), options).analyze(graph);
            out.println(format == OutputFormat.JSON ? JsonReports.toJson(report) : report.formatText());
            out.flush();
            return 0;
        } catch (Exception e) {
            log.debug("Analysis failed", e);
            err.println("Error: " + e.getMessage());
            return 2;
        }
    }
}
