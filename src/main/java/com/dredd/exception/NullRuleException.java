package com.dredd.exception;

/**
 * Exception thrown when a rule reference supplied to a runner, or added as a child, is null.
 */
public class NullRuleException extends RuleException {

    private final int index;

    public NullRuleException(int index) {
        super("rule at index " + index + " is null");
        this.index = index;
    }

    /**
     * Position of the offending reference in the supplied sequence (0-based).
     */
    public int getIndex() {
        return index;
    }
}
