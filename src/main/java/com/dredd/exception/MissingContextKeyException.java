package com.dredd.exception;

/**
 * Thrown by {@code RuleContext.mustGet} when the asserted key is absent.
 * Signals a programming error, not a recoverable condition.
 */
public class MissingContextKeyException extends RuleException {

    private final String key;

    public MissingContextKeyException(String key) {
        super("key '" + key + "' not found in rule context");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
