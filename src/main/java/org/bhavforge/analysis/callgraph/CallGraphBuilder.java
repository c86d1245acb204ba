package org.bhavforge.analysis.callgraph;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import org.bhavforge.runtime.isa.CallSpec;
import org.bhavforge.runtime.isa.IOpcodeCatalog;
import org.bhavforge.runtime.isa.Instruction;
import org.bhavforge.runtime.isa.OpcodeInfo;
import org.bhavforge.runtime.model.BehaviorGraph;
import org.bhavforge.runtime.model.BehaviorPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans a package for call instructions and assembles the {@link CallGraph}.
 * <p>
 * Behaviors are scanned in parallel; the per-behavior call-site lists are merged once, after
 * all scans completed. The callee of each call comes from the opcode's {@link CallSpec};
 * operand-encoded targets of zero are ignored.
 */
public class CallGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(CallGraphBuilder.class);

    private final IOpcodeCatalog catalog;

    public CallGraphBuilder(IOpcodeCatalog catalog) {
        this.catalog = catalog;
    }

    public CallGraph build(BehaviorPackage pkg) {
        List<List<CallSite>> perGraph = pkg.graphs().parallelStream()
                .map(this::scan)
                .toList();

        List<CallSite> sites = new ArrayList<>();
        perGraph.forEach(sites::addAll);

        CallGraph graph = new CallGraph(pkg.ids(), pkg.entryPoints(), sites);
        log.debug("Built call graph for package '{}': {} behaviors, {} call sites, {} edges",
                pkg.name(), pkg.size(), sites.size(), graph.edges().size());
        if (!graph.cycles().isEmpty()) {
            log.warn("Package '{}' contains {} recursion cycle(s): {}", pkg.name(), graph.cycles().size(),
                    graph.cycles());
        }
        if (!graph.externalCallees().isEmpty()) {
            log.debug("Package '{}' calls {} behavior(s) outside the package", pkg.name(),
                    graph.externalCallees().size());
        }
        return graph;
    }

    /**
     * Collects the call sites of one behavior.
     *
     * @param graph the behavior
     * @return its call sites in position order
     */
    public List<CallSite> scan(BehaviorGraph graph) {
        List<CallSite> sites = new ArrayList<>();
        for (Instruction instruction : graph.instructions()) {
            OpcodeInfo info = catalog.lookup(instruction.opcode());
            if (!info.isCallOpcode()) {
                continue;
            }
            OptionalInt target = info.callSpec().resolveTarget(instruction);
            if (target.isPresent()) {
                sites.add(new CallSite(graph.id(), instruction.position(), target.getAsInt(), info.callSpec().kind()));
            }
        }
        return sites;
    }
}
