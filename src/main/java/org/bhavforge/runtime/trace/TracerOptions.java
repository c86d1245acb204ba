package org.bhavforge.runtime.trace;

import com.typesafe.config.Config;

/**
 * Budgets bounding a trace.
 *
 * @param maxSteps                 total steps across all paths
 * @param maxVisitsPerInstruction  visits of one (call stack, behavior, position) within a single path
 * @param maxCallDepth             nested subroutine frames
 */
public record TracerOptions(int maxSteps, int maxVisitsPerInstruction, int maxCallDepth) {

    public static final int DEFAULT_MAX_STEPS = 10_000;
    public static final int DEFAULT_MAX_VISITS_PER_INSTRUCTION = 64;
    public static final int DEFAULT_MAX_CALL_DEPTH = 16;

    public TracerOptions {
        if (maxSteps <= 0 || maxVisitsPerInstruction <= 0 || maxCallDepth < 0) {
            throw new IllegalArgumentException("Tracer budgets must be positive: steps=" + maxSteps
                    + ", visits=" + maxVisitsPerInstruction + ", callDepth=" + maxCallDepth);
        }
    }

    public static TracerOptions defaults() {
        return new TracerOptions(DEFAULT_MAX_STEPS, DEFAULT_MAX_VISITS_PER_INSTRUCTION, DEFAULT_MAX_CALL_DEPTH);
    }

    /**
     * Reads the {@code bhavforge.tracer} block; missing keys fall back to the defaults.
     *
     * @param config the {@code tracer} block
     * @return the options
     */
    public static TracerOptions fromConfig(Config config) {
        return new TracerOptions(
                config.hasPath("max-steps") ? config.getInt("max-steps") : DEFAULT_MAX_STEPS,
                config.hasPath("max-visits-per-instruction")
                        ? config.getInt("max-visits-per-instruction") : DEFAULT_MAX_VISITS_PER_INSTRUCTION,
                config.hasPath("max-call-depth") ? config.getInt("max-call-depth") : DEFAULT_MAX_CALL_DEPTH);
    }
}
