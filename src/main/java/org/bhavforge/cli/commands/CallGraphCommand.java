package org.bhavforge.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.bhavforge.analysis.callgraph.CallCount;
import org.bhavforge.analysis.callgraph.CallGraph;
import org.bhavforge.analysis.callgraph.CallGraphBuilder;
import org.bhavforge.analysis.callgraph.CallGraphDotExporter;
import org.bhavforge.analysis.callgraph.CallGraphSummary;
import org.bhavforge.cli.CommandLineInterface;
import org.bhavforge.cli.config.EngineSettings;
import org.bhavforge.cli.output.JsonReports;
import org.bhavforge.runtime.codec.PackageLoader;
import org.bhavforge.runtime.model.BehaviorPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Builds and reports the call graph of a package directory.
 */
@Command(
    name = "callgraph",
    description = "Cross-reference the calls between the behaviors of a package"
)
public class CallGraphCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CallGraphCommand.class);

    @Option(
        names = {"-p", "--package"},
        required = true,
        description = "Package directory with <id>.bhav files and optional package.conf"
    )
    private Path packageDir;

    @Option(
        names = {"--dot"},
        description = "Print Graphviz DOT instead of a report"
    )
    private boolean dot;

    @Option(
        names = {"--chains"},
        description = "Print the call chains starting at this behavior id"
    )
    private Integer chainsFrom;

    @Option(
        names = {"--max-depth"},
        defaultValue = "8",
        description = "Maximum chain length for --chains (default: ${DEFAULT-VALUE})"
    )
    private int maxDepth;

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
            BehaviorPackage pkg = PackageLoader.load(packageDir);
            CallGraph graph = new CallGraphBuilder(settings.catalog()).build(pkg);

            if (dot) {
                out.print(new CallGraphDotExporter().export(graph, pkg.name()));
            } else if (chainsFrom != null) {
                for (List<Integer> chain : graph.callChains(chainsFrom, maxDepth)) {
                    out.println(formatChain(chain));
                }
            } else if (format == OutputFormat.JSON) {
                out.println(JsonReports.toJson(graph, settings.topLimit()));
            } else {
                printReport(out, pkg, graph, settings.topLimit());
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.debug("Call graph failed", e);
            err.println("Error: " + e.getMessage());
            return 2;
        }
    }

    private static void printReport(PrintWriter out, BehaviorPackage pkg, CallGraph graph, int topLimit) {
        CallGraphSummary summary = graph.summary();
        out.printf("=== Call graph of package '%s' ===%n", pkg.name());
        out.printf("Behaviors: %d (%s)%n", summary.behaviors(), summary.scopeCounts());
        out.printf("Edges: %d, call sites: %d%n", summary.edges(), summary.callSites());
        out.printf("Roots: %s%n", graph.roots());
        out.printf("Leaves: %s%n", graph.leaves());
        out.printf("Unused: %s%n", graph.unused());
        out.printf("External: %s%n", graph.externalCallees());
        out.println("Cycles:");
        if (graph.cycles().isEmpty()) {
            out.println("  none");
        }
        for (List<Integer> cycle : graph.cycles()) {
            out.println("  " + formatChain(cycle));
        }
        out.println("Most called:");
        for (CallCount count : graph.mostCalled(topLimit)) {
            out.printf("  0x%04X by %d%n", count.behaviorId(), count.count());
        }
        out.println("Most calling:");
        for (CallCount count : graph.mostCalling(topLimit)) {
            out.printf("  0x%04X calls %d%n", count.behaviorId(), count.count());
        }
    }

    private static String formatChain(List<Integer> chain) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < chain.size(); i++) {
            if (i > 0) {
                sb.append(" -> ");
            }
            sb.append(String.format("0x%04X", chain.get(i)));
        }
        return sb.toString();
    }
}
