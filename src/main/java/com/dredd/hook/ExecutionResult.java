package com.dredd.hook;

/**
 * Outcome of a pre-execute, execute or post-execute hook.
 *
 * @param error error reported by the hook, or null on success
 */
public record ExecutionResult(Throwable error) {

    private static final ExecutionResult OK = new ExecutionResult(null);

    public static ExecutionResult ok() {
        return OK;
    }

    public static ExecutionResult failed(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new ExecutionResult(error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
