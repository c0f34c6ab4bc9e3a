package com.dredd.hook;

import com.dredd.core.RuleView;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Action run in one of a rule's execution phases.
 *
 * @param <V> value type of the rule context
 */
@FunctionalInterface
public interface ExecutionHook<V> {

    ExecutionResult execute(RuleView<V> view);

    /**
     * Hook backed by a plain action; never reports an error.
     */
    static <V> ExecutionHook<V> simple(Consumer<RuleView<V>> action) {
        Objects.requireNonNull(action, "action");
        return view -> {
            action.accept(view);
            return ExecutionResult.ok();
        };
    }

    /**
     * Hook that reports its own {@link ExecutionResult}, including errors.
     * <p>
     * Returns the hook unchanged; it exists to pair with {@link #simple} so both
     * conventions read alike at the call site.
     */
    static <V> ExecutionHook<V> detailed(ExecutionHook<V> hook) {
        return Objects.requireNonNull(hook, "hook");
    }
}
