package com.dredd.hook;

import com.dredd.core.RuleView;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Decides whether a rule should execute.
 *
 * @param <V> value type of the rule context
 */
@FunctionalInterface
public interface EvaluationHook<V> {

    EvaluationResult evaluate(RuleView<V> view);

    /**
     * Hook backed by a plain predicate; never reports an error.
     */
    static <V> EvaluationHook<V> simple(Predicate<RuleView<V>> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return view -> EvaluationResult.of(predicate.test(view));
    }

    /**
     * Hook that reports its own {@link EvaluationResult}, including errors.
     * <p>
     * Returns the hook unchanged; it exists to pair with {@link #simple} so both
     * conventions read alike at the call site.
     */
    static <V> EvaluationHook<V> detailed(EvaluationHook<V> hook) {
        return Objects.requireNonNull(hook, "hook");
    }
}
