package com.dredd.hook;

/**
 * Outcome of a rule's evaluation hook.
 * <p>
 * {@code shouldExecute == false} with no error is a normal outcome: the rule declined.
 *
 * @param shouldExecute whether the rule's execute hooks and children should run
 * @param error         error reported by the hook, or null
 */
public record EvaluationResult(boolean shouldExecute, Throwable error) {

    private static final EvaluationResult PROCEED = new EvaluationResult(true, null);
    private static final EvaluationResult SKIP = new EvaluationResult(false, null);

    public static EvaluationResult proceed() {
        return PROCEED;
    }

    public static EvaluationResult skip() {
        return SKIP;
    }

    public static EvaluationResult of(boolean shouldExecute) {
        return shouldExecute ? PROCEED : SKIP;
    }

    public static EvaluationResult failed(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new EvaluationResult(false, error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
