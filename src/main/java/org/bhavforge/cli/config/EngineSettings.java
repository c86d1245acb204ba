package org.bhavforge.cli.config;

import org.bhavforge.analysis.flow.AnalyzerOptions;
import org.bhavforge.analysis.validation.ValidatorOptions;
import org.bhavforge.runtime.isa.OpcodeCatalog;
import org.bhavforge.runtime.trace.TracerOptions;

import com.typesafe.config.Config;

/**
 * Engine components configured from the {@code bhavforge} block of the application config.
 *
 * @param catalog   opcode metadata
 * @param tracer    tracer budgets
 * @param validator validator tunables
 * @param analyzer  flow analyzer tunables
 * @param topLimit  entries listed by most-called / most-calling summaries
 */
public record EngineSettings(OpcodeCatalog catalog, TracerOptions tracer, ValidatorOptions validator,
                             AnalyzerOptions analyzer, int topLimit) {

    private static final String ROOT = "bhavforge";

    /**
     * Builds settings from a resolved application config.
     *
     * @param config the application config; must contain the {@code bhavforge} block of {@code reference.conf}
     * @return the settings
     * @throws com.typesafe.config.ConfigException if a value is missing or malformed
     */
    public static EngineSettings fromConfig(Config config) {
        Config root = config.getConfig(ROOT);
        return new EngineSettings(
                OpcodeCatalog.load(config),
                TracerOptions.fromConfig(root.getConfig("tracer")),
                ValidatorOptions.fromConfig(root.getConfig("validator")),
                AnalyzerOptions.fromConfig(root.getConfig("analyzer")),
                root.hasPath("callgraph.top-limit") ? root.getInt("callgraph.top-limit") : 10);
    }
}
