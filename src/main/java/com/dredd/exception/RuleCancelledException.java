package com.dredd.exception;

/**
 * Exception thrown when a rule is fired after its cancellation token was signalled.
 */
public class RuleCancelledException extends RuleException {

    public RuleCancelledException(String reason) {
        super(reason == null ? "rule execution cancelled" : "rule execution cancelled: " + reason);
    }
}
