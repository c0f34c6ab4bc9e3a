package com.dredd.exception;

/**
 * Exception thrown when a runner is invoked without a rule context.
 */
public class MissingRuleContextException extends RuleException {

    public MissingRuleContextException() {
        super("rule context cannot be null");
    }
}
