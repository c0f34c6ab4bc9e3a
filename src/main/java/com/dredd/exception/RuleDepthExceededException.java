package com.dredd.exception;

/**
 * Exception thrown when rule nesting goes deeper than the configured maximum.
 * Only raised when a depth limit was configured.
 */
public class RuleDepthExceededException extends RuleException {

    private final int maxDepth;

    public RuleDepthExceededException(int maxDepth) {
        super("max rule depth (" + maxDepth + ") exceeded");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
