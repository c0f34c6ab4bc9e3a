package com.dredd.config;

import com.dredd.exception.RuleConfigurationException;

/**
 * Engine configuration.
 *
 * @param name            Engine name, used in logs
 * @param maxDepth        Deepest rule nesting a run may reach (roots are level 1), 0 for no limit
 * @param contextCapacity Initial capacity of contexts created by the runner
 * @param traceEnabled    Whether every rule fire is logged at TRACE level
 */
public record RuleEngineConfig(
        String name,
        int maxDepth,
        int contextCapacity,
        boolean traceEnabled
) {
    public static final String DEFAULT_NAME = "default-engine";
    public static final int UNLIMITED_DEPTH = 0;
    public static final int DEFAULT_CONTEXT_CAPACITY = 16;

    public RuleEngineConfig {
        if (name == null || name.isBlank()) {
            name = DEFAULT_NAME;
        }
        if (maxDepth < 0) {
            throw new RuleConfigurationException("max-depth must be >= 0 (0 = unlimited), got " + maxDepth);
        }
        if (contextCapacity < 0) {
            throw new RuleConfigurationException("context-capacity must be >= 0, got " + contextCapacity);
        }
    }

    public static RuleEngineConfig defaults() {
        return new RuleEngineConfig(DEFAULT_NAME, UNLIMITED_DEPTH, DEFAULT_CONTEXT_CAPACITY, false);
    }

    public boolean hasDepthLimit() {
        return maxDepth != UNLIMITED_DEPTH;
    }
}
