package com.dredd.exception;

/**
 * Exception thrown when a rule tree or engine configuration is invalid.
 * Raised at build time, results in fail-fast.
 */
public class RuleConfigurationException extends RuleException {

    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
