package org.bhavforge.analysis.validation;

import com.typesafe.config.Config;

/**
 * Tunables of the structural validator.
 *
 * @param stackDepthWarningThreshold abstract stack depth above which a warning is raised
 */
public record ValidatorOptions(int stackDepthWarningThreshold) {

    public static final int DEFAULT_STACK_DEPTH_WARNING_THRESHOLD = 20;

    public static ValidatorOptions defaults() {
        return new ValidatorOptions(DEFAULT_STACK_DEPTH_WARNING_THRESHOLD);
    }

    /**
     * Reads the {@code bhavforge.validator} block.
     *
     * @param config the {@code validator} block
     * @return the options
     */
    public static ValidatorOptions fromConfig(Config config) {
        return new ValidatorOptions(config.hasPath("stack-depth-warning-threshold")
                ? config.getInt("stack-depth-warning-threshold")
                : DEFAULT_STACK_DEPTH_WARNING_THRESHOLD);
    }
}
