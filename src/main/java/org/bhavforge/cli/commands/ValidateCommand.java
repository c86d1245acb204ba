package org.bhavforge.cli.commands;

import java.util.concurrent.Callable;

import org.bhavforge.analysis.validation.StructuralValidator;
import org.bhavforge.analysis.validation.ValidationReport;
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
 * Runs the structural validator. Exits with 1 when the behavior has errors.
 */
@Command(
    name = "validate",
    description = "Check a behavior for structural errors"
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Mixin
    private GraphFileOptions input;

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
            BehaviorGraph graph = input.load();
            ValidationReport report = new StructuralValidator(settings.catalog(), settings.validator()).validate(graph);
            out.println(format == OutputFormat.JSON ? JsonReports.toJson(report) : report.formatText());
            out.flush();
            return report.isValid() ? 0 : 1;
        } catch (Exception e) {
            log.debug("Validation failed", e);
            err.println("Error: " + e.getMessage());
            return 2;
        }
    }
}
