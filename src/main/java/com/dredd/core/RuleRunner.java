package com.dredd.core;

import com.dredd.config.RuleEngineConfig;
import com.dredd.context.RuleContext;
import com.dredd.exception.ChainArityException;
import com.dredd.exception.MissingRuleContextException;
import com.dredd.exception.NullRuleException;
import com.dredd.exception.RuleCycleException;
import com.dredd.exception.RuleDepthExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Runs a batch of rules under a traversal strategy.
 * <p>
 * Rules:
 * - {@link RuleType#CHAIN}: exactly one root, fired once
 * - {@link RuleType#BEST_FIRST}: roots fired in the given order; the first one that executes
 *   ends the batch, a rule that declines hands over to its next sibling
 * - an executed rule runs its own children through this runner, under its own type
 * - any error aborts the whole run and is thrown to the caller
 * - a rule reached again while it is still firing is a cycle and fails the run
 * <p>
 * The runner is stateless apart from its configuration and can be shared.
 */
public class RuleRunner {

    private static final Logger log = LoggerFactory.getLogger(RuleRunner.class);

    private static final RuleRunner DEFAULT = new RuleRunner(RuleEngineConfig.defaults());

    private final RuleEngineConfig config;

    public RuleRunner(RuleEngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        log.info("RuleRunner initialized with config: {} (max depth {}, trace {})", config.name(),
                config.hasDepthLimit() ? config.maxDepth() : "unlimited", config.traceEnabled());
    }

    /**
     * Shared runner with the default configuration.
     */
    public static RuleRunner defaults() {
        return DEFAULT;
    }

    public RuleEngineConfig getConfig() {
        return config;
    }

    /**
     * Create an empty context sized per configuration.
     */
    public <V> RuleContext<V> newContext() {
        return RuleContext.withCapacity(config.contextCapacity());
    }

    /**
     * Run rules under the given strategy.
     *
     * @param ruleType          traversal strategy of this batch
     * @param cancellationToken token checked before each rule fires; null means never cancelled
     * @param ruleContext       context bound to every fired rule
     * @param rules             roots of this batch
     * @throws MissingRuleContextException if ruleContext is null
     * @throws NullRuleException           if a rule is null (nothing is fired)
     * @throws ChainArityException         if a chain batch has more than one root (nothing is fired)
     * @throws com.dredd.exception.RuleException on cancellation or hook failure
     */
    @SafeVarargs
    public final <V> void run(RuleType ruleType, CancellationToken cancellationToken,
                              RuleContext<V> ruleContext, Rule<V>... rules) {
        run(ruleType, cancellationToken, ruleContext, rules == null ? List.of() : Arrays.asList(rules));
    }

    public <V> void run(RuleType ruleType, CancellationToken cancellationToken,
                        RuleContext<V> ruleContext, List<Rule<V>> rules) {
        Objects.requireNonNull(ruleType, "ruleType");
        CancellationToken token = cancellationToken != null ? cancellationToken : CancellationToken.none();
        log.debug("Running {} root rule(s) as {}", rules == null ? 0 : rules.size(), ruleType);
        Set<Rule<?>> activePath = Collections.newSetFromMap(new IdentityHashMap<>());
        runChildren(ruleType, token, ruleContext, rules == null ? List.of() : rules, 1, activePath);
    }

    @SafeVarargs
    public final <V> void chain(RuleContext<V> ruleContext, Rule<V>... rules) {
        run(RuleType.CHAIN, CancellationToken.none(), ruleContext, rules);
    }

    @SafeVarargs
    public final <V> void chain(CancellationToken cancellationToken, RuleContext<V> ruleContext, Rule<V>... rules) {
        run(RuleType.CHAIN, cancellationToken, ruleContext, rules);
    }

    @SafeVarargs
    public final <V> void bestFirst(RuleContext<V> ruleContext, Rule<V>... rules) {
        run(RuleType.BEST_FIRST, CancellationToken.none(), ruleContext, rules);
    }

    @SafeVarargs
    public final <V> void bestFirst(CancellationToken cancellationToken, RuleContext<V> ruleContext,
                                    Rule<V>... rules) {
        run(RuleType.BEST_FIRST, cancellationToken, ruleContext, rules);
    }

    boolean isTraceEnabled() {
        return config.traceEnabled();
    }

    /**
     * Run one batch at the given nesting level. Entry point for both roots and children.
     *
     * @param activePath rules currently firing in this run, compared by identity
     */
    <V> void runChildren(RuleType ruleType, CancellationToken token, RuleContext<V> ruleContext,
                         List<Rule<V>> rules, int depth, Set<Rule<?>> activePath) {
        if (ruleContext == null) {
            throw new MissingRuleContextException();
        }
        if (rules.isEmpty()) {
            return;
        }
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i) == null) {
                throw new NullRuleException(i);
            }
        }
        if (config.hasDepthLimit() && depth > config.maxDepth()) {
            log.warn("Max rule depth ({}) exceeded", config.maxDepth());
            throw new RuleDepthExceededException(config.maxDepth());
        }

        switch (ruleType) {
            case CHAIN -> {
                if (rules.size() > 1) {
                    throw ChainArityException.multipleRoots(rules.size());
                }
                fire(rules.get(0), token, ruleContext, depth, activePath);
            }
            case BEST_FIRST -> {
                for (int i = 0; i < rules.size(); i++) {
                    if (!fire(rules.get(i), token, ruleContext, depth, activePath)) {
                        if (isTraceEnabled()) {
                            log.trace("Level {}: sibling {} of {} executed, search satisfied",
                                    depth, i + 1, rules.size());
                        }
                        return;
                    }
                }
                if (isTraceEnabled()) {
                    log.trace("Level {}: no sibling of {} executed", depth, rules.size());
                }
            }
        }
    }

    private <V> boolean fire(Rule<V> rule, CancellationToken token, RuleContext<V> ruleContext,
                             int depth, Set<Rule<?>> activePath) {
        if (!activePath.add(rule)) {
            log.warn("Rule tree cycle at level {}: {} is already firing", depth, rule);
            throw new RuleCycleException(rule.toString(), depth);
        }
        try {
            rule.bind(ruleContext, token);
            return rule.fire(this, depth, activePath);
        } finally {
            activePath.remove(rule);
        }
    }
}
