package com.dredd.exception;

/**
 * Exception thrown when a rule is reached again while it is still firing,
 * i.e. it was attached as its own descendant.
 */
public class RuleCycleException extends RuleException {

    public RuleCycleException(String rule, int depth) {
        super("rule tree cycle: " + rule + " reached again at level " + depth + " while still firing");
    }
}
