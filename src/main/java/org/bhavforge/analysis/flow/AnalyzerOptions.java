package org.bhavforge.analysis.flow;

import java.util.Set;

import com.typesafe.config.Config;

/**
 * Tunables of the flow analyzer.
 *
 * @param followFallthrough     treat {@code position + 1} as an implicit successor for reachability
 * @param deepNestingThreshold  nesting depth above which an INFO issue is raised
 * @param complexityThreshold   cyclomatic complexity above which an INFO issue is raised
 * @param expensiveOpcodes      opcodes reported as hot spots inside loops
 */
public record AnalyzerOptions(boolean followFallthrough, int deepNestingThreshold, int complexityThreshold,
                              Set<Integer> expensiveOpcodes) {

    public static final int DEFAULT_DEEP_NESTING_THRESHOLD = 5;
    public static final int DEFAULT_COMPLEXITY_THRESHOLD = 10;

    public AnalyzerOptions {
        expensiveOpcodes = Set.copyOf(expensiveOpcodes);
    }

    public static AnalyzerOptions defaults() {
        return new AnalyzerOptions(false, DEFAULT_DEEP_NESTING_THRESHOLD, DEFAULT_COMPLEXITY_THRESHOLD, Set.of());
    }

    /**
     * Reads the {@code bhavforge.analyzer} block; missing keys fall back to the defaults.
     *
     * @param config the {@code analyzer} block
     * @return the options
     */
    public static AnalyzerOptions fromConfig(Config config) {
        return new AnalyzerOptions(
                config.hasPath("follow-fallthrough") && config.getBoolean("follow-fallthrough"),
                config.hasPath("deep-nesting-threshold")
                        ? config.getInt("deep-nesting-threshold") : DEFAULT_DEEP_NESTING_THRESHOLD,
                config.hasPath("complexity-threshold")
                        ? config.getInt("complexity-threshold") : DEFAULT_COMPLEXITY_THRESHOLD,
                config.hasPath("expensive-opcodes")
                        ? Set.copyOf(config.getIntList("expensive-opcodes")) : Set.of());
    }

    public AnalyzerOptions withFollowFallthrough(boolean follow) {
        return new AnalyzerOptions(follow, deepNestingThreshold, complexityThreshold, expensiveOpcodes);
    }
}
