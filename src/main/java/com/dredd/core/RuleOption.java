package com.dredd.core;

/**
 * Configuration step applied to a freshly constructed rule.
 *
 * @param <V> value type of the rule context
 * @see RuleOptions
 * @see Rule#create(RuleType, RuleOption[])
 */
@FunctionalInterface
public interface RuleOption<V> {

    void apply(Rule<V> rule);
}
