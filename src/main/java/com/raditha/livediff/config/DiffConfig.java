package com.raditha.livediff.config;

/**
 * Configuration for dump comparison and rendering.
 *
 * @param maxChangedVarsPerBlock changed variables listed per block before the rest are elided
 * @param maxOnlyVarsShown       variables listed per "vars only in" line before the rest are elided
 * @param labelPrefix            conventional file name prefix dropped from file labels
 */
public record DiffConfig(int maxChangedVarsPerBlock, int maxOnlyVarsShown, String labelPrefix) {

    public static final int DEFAULT_MAX_CHANGED_VARS_PER_BLOCK = 25;
    public static final int DEFAULT_MAX_ONLY_VARS_SHOWN = 50;
    public static final String DEFAULT_LABEL_PREFIX = "debug_";

    /**
     * Validate configuration.
     */
    public DiffConfig {
        if (maxChangedVarsPerBlock < 0) {
            throw new IllegalArgumentException("maxChangedVarsPerBlock must be >= 0, got: " + maxChangedVarsPerBlock);
        }
        if (maxOnlyVarsShown < 0) {
            throw new IllegalArgumentException("maxOnlyVarsShown must be >= 0, got: " + maxOnlyVarsShown);
        }
        if (labelPrefix == null) {
            labelPrefix = "";
        }
    }

    public static DiffConfig defaults() {
        return new DiffConfig(
                DEFAULT_MAX_CHANGED_VARS_PER_BLOCK,
                DEFAULT_MAX_ONLY_VARS_SHOWN,
                DEFAULT_LABEL_PREFIX);
    }
}
