package com.dredd.exception;

import com.dredd.hook.ExecutionPhase;

/**
 * Exception thrown when a pre-execute, execute or post-execute hook reports an error.
 * The hook's own error is available as the cause.
 */
public class RuleExecutionException extends RuleException {

    private final ExecutionPhase phase;

    public RuleExecutionException(ExecutionPhase phase, Throwable cause) {
        super(phase.getDisplayName() + " failed: " + cause.getMessage(), cause);
        this.phase = phase;
    }

    /**
     * The lifecycle phase whose hook failed.
     */
    public ExecutionPhase getPhase() {
        return phase;
    }
}
