package com.dredd.core;

import com.dredd.exception.RuleConfigurationException;
import com.dredd.exception.RuleException;
import com.dredd.hook.EvaluationHook;
import com.dredd.hook.ExecutionHook;

import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Factory methods for {@link RuleOption}s, for use with {@link Rule#create(RuleType, RuleOption[])}.
 * <p>
 * Usage:
 * <pre>
 * Rule&lt;String&gt; rule = Rule.create(RuleType.BEST_FIRST,
 *         RuleOptions.evaluation(view -&gt; view.getRuleContext().exists("order")),
 *         RuleOptions.execution(view -&gt; view.getRuleContext().set("route", "express")),
 *         RuleOptions.children(vip, standard));
 * </pre>
 */
public final class RuleOptions {

    private RuleOptions() {
    }

    public static <V> RuleOption<V> name(String name) {
        return rule -> rule.named(name);
    }

    public static <V> RuleOption<V> evaluation(Predicate<RuleView<V>> predicate) {
        return rule -> rule.onEval(predicate);
    }

    public static <V> RuleOption<V> evaluationDetailed(EvaluationHook<V> hook) {
        return rule -> rule.onEvalDetailed(hook);
    }

    public static <V> RuleOption<V> preExecution(Consumer<RuleView<V>> action) {
        return rule -> rule.onPreExecute(action);
    }

    public static <V> RuleOption<V> preExecutionDetailed(ExecutionHook<V> hook) {
        return rule -> rule.onPreExecuteDetailed(hook);
    }

    public static <V> RuleOption<V> execution(Consumer<RuleView<V>> action) {
        return rule -> rule.onExecute(action);
    }

    public static <V> RuleOption<V> executionDetailed(ExecutionHook<V> hook) {
        return rule -> rule.onExecuteDetailed(hook);
    }

    public static <V> RuleOption<V> postExecution(Consumer<RuleView<V>> action) {
        return rule -> rule.onPostExecute(action);
    }

    public static <V> RuleOption<V> postExecutionDetailed(ExecutionHook<V> hook) {
        return rule -> rule.onPostExecuteDetailed(hook);
    }

    /**
     * Attach children at construction time.
     * A chain arity or null-child violation is a programming error and fails the construction.
     *
     * @throws RuleConfigurationException when applied, if the children violate a rule constraint
     */
    @SafeVarargs
    public static <V> RuleOption<V> children(Rule<V>... children) {
        return rule -> {
            try {
                rule.addChildren(children);
            } catch (RuleException e) {
                throw new RuleConfigurationException("Invalid children for " + rule + ": " + e.getMessage(), e);
            }
        };
    }
}
