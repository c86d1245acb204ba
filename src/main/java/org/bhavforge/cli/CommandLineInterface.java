package org.bhavforge.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.bhavforge.cli.commands.AnalyzeCommand;
import org.bhavforge.cli.commands.CallGraphCommand;
import org.bhavforge.cli.commands.DisassembleCommand;
import org.bhavforge.cli.commands.RewireCommand;
import org.bhavforge.cli.commands.TraceCommand;
import org.bhavforge.cli.commands.ValidateCommand;
import org.bhavforge.cli.config.ConfigLoader;
import org.bhavforge.cli.config.EngineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "bhavforge",
    mixinStandardHelpOptions = true,
    version = "BHAV Forge 1.0",
    description = "BHAV Forge - analyze, trace and edit SimAntics behavior bytecode",
    subcommands = {
        DisassembleCommand.class,
        ValidateCommand.class,
        AnalyzeCommand.class,
        TraceCommand.class,
        CallGraphCommand.class,
        RewireCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/bhavforge.conf)"
    )
    private File configFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Enable debug logging"
    )
    private boolean verbose;

    private Config config;
    private EngineSettings settings;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("bhavforge");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        if (verbose) {
            setLogLevel(Level.DEBUG);
        }

        // Throws IllegalArgumentException / ConfigException; commands report them to stderr.
        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.info(message);
                case WARN -> logger.debug(message);
            }
        });
        this.settings = EngineSettings.fromConfig(config);
        initialized = true;
    }

    private void setLogLevel(Level level) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger("org.bhavforge").setLevel(level);
        }
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    public EngineSettings getSettings() {
        if (!initialized) {
            initialize();
        }
        return settings;
    }
}
