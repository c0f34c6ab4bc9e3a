package com.dredd.exception;

/**
 * Exception thrown when an evaluation hook reports an error.
 * The hook's own error is available as the cause.
 */
public class RuleEvaluationException extends RuleException {

    public RuleEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
