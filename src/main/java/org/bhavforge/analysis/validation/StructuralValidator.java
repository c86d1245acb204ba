package org.bhavforge.analysis.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.bhavforge.analysis.diagnostics.Diagnostic;
import org.bhavforge.runtime.isa.IOpcodeCatalog;
import org.bhavforge.runtime.model.BehaviorGraph;
import org.bhavforge.runtime.model.BehaviorPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every registered {@link IValidationCheck} over a behavior and merges the findings.
 * <p>
 * Validation is read-only and never throws for malformed behaviors; every problem becomes a
 * {@link Diagnostic}. Thread-safe as long as the registry is not modified concurrently.
 */
public class StructuralValidator {

    private static final Logger log = LoggerFactory.getLogger(StructuralValidator.class);

    private final ValidationContext context;
    private final ValidationCheckRegistry registry;

    public StructuralValidator(IOpcodeCatalog catalog) {
        this(catalog, ValidatorOptions.defaults(), ValidationCheckRegistry.initializeWithDefaults());
    }

    public StructuralValidator(IOpcodeCatalog catalog, ValidatorOptions options) {
        this(catalog, options, ValidationCheckRegistry.initializeWithDefaults());
    }

    public StructuralValidator(IOpcodeCatalog catalog, ValidatorOptions options, ValidationCheckRegistry registry) {
        this.context = new ValidationContext(catalog, options);
        this.registry = registry;
    }

    public ValidationReport validate(BehaviorGraph graph) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (IValidationCheck check : registry.checks()) {
            int before = diagnostics.size();
            check.check(graph, context, diagnostics);
            log.debug("Check '{}' on behavior {}: {} finding(s)", check.name(), graph.id(), diagnostics.size() - before);
        }
        ValidationReport report = new ValidationReport(graph.id(), diagnostics);
        if (!report.isValid()) {
            log.debug("Behavior {} is invalid: {} error(s)", graph.id(), report.errors().size());
        }
        return report;
    }

    /**
     * Validates every behavior of a package.
     *
     * @param pkg the package
     * @return reports keyed by behavior id, ascending
     */
    public Map<Integer, ValidationReport> validateAll(BehaviorPackage pkg) {
        Map<Integer, ValidationReport> reports = new TreeMap<>();
        for (BehaviorGraph graph : pkg.graphs()) {
            reports.put(graph.id(), validate(graph));
        }
        return reports;
    }
}
