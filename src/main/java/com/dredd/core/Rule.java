package com.dredd.core;

import com.dredd.context.RuleContext;
import com.dredd.exception.ChainArityException;
import com.dredd.exception.NullRuleException;
import com.dredd.exception.RuleCancelledException;
import com.dredd.exception.RuleEvaluationException;
import com.dredd.exception.RuleException;
import com.dredd.exception.RuleExecutionException;
import com.dredd.hook.EvaluationHook;
import com.dredd.hook.EvaluationResult;
import com.dredd.hook.ExecutionHook;
import com.dredd.hook.ExecutionPhase;
import com.dredd.hook.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A node of a rule tree.
 * <p>
 * A rule has a {@link RuleType}, up to four lifecycle hooks and an ordered list of children
 * it owns exclusively. Firing a rule:
 * <ol>
 *   <li>fails with {@link RuleCancelledException} if the bound token is already cancelled</li>
 *   <li>runs the evaluation hook (absent = proceed)</li>
 *   <li>if the rule declined, stops here without error</li>
 *   <li>otherwise runs pre-execute, execute and post-execute hooks in that order</li>
 *   <li>then runs the children under this rule's own type</li>
 * </ol>
 * Any hook error aborts the fire at that point.
 * <p>
 * Rules are built single-threaded, then run. Context and token are bound by the runner
 * on every invocation, so a tree can be run repeatedly against different contexts.
 *
 * @param <V> value type of the rule context
 */
public class Rule<V> implements RuleView<V> {

    private static final Logger log = LoggerFactory.getLogger(Rule.class);

    private final RuleType ruleType;
    private final List<Rule<V>> children = new ArrayList<>();
    private String name;

    private EvaluationHook<V> onEval;
    private ExecutionHook<V> onPreExecute;
    private ExecutionHook<V> onExecute;
    private ExecutionHook<V> onPostExecute;

    private RuleContext<V> ruleContext;
    private CancellationToken cancellationToken = CancellationToken.none();

    public Rule(RuleType ruleType) {
        this.ruleType = Objects.requireNonNull(ruleType, "ruleType");
    }

    public static <V> Rule<V> chain() {
        return new Rule<>(RuleType.CHAIN);
    }

    public static <V> Rule<V> bestFirst() {
        return new Rule<>(RuleType.BEST_FIRST);
    }

    /**
     * Create a rule and apply the given options in order.
     *
     * @throws com.dredd.exception.RuleConfigurationException if an option violates a rule constraint
     */
    @SafeVarargs
    public static <V> Rule<V> create(RuleType ruleType, RuleOption<V>... options) {
        Rule<V> rule = new Rule<>(ruleType);
        for (RuleOption<V> option : options) {
            option.apply(rule);
        }
        return rule;
    }

    // Hooks

    public Rule<V> onEval(Predicate<RuleView<V>> predicate) {
        return onEvalDetailed(EvaluationHook.simple(predicate));
    }

    public Rule<V> onEvalDetailed(EvaluationHook<V> hook) {
        this.onEval = Objects.requireNonNull(hook, "hook");
        return this;
    }

    public Rule<V> onPreExecute(Consumer<RuleView<V>> action) {
        return onPreExecuteDetailed(ExecutionHook.simple(action));
    }

    public Rule<V> onPreExecuteDetailed(ExecutionHook<V> hook) {
        this.onPreExecute = Objects.requireNonNull(hook, "hook");
        return this;
    }

    public Rule<V> onExecute(Consumer<RuleView<V>> action) {
        return onExecuteDetailed(ExecutionHook.simple(action));
    }

    public Rule<V> onExecuteDetailed(ExecutionHook<V> hook) {
        this.onExecute = Objects.requireNonNull(hook, "hook");
        return this;
    }

    public Rule<V> onPostExecute(Consumer<RuleView<V>> action) {
        return onPostExecuteDetailed(ExecutionHook.simple(action));
    }

    public Rule<V> onPostExecuteDetailed(ExecutionHook<V> hook) {
        this.onPostExecute = Objects.requireNonNull(hook, "hook");
        return this;
    }

    public Rule<V> named(String name) {
        this.name = name;
        return this;
    }

    // Children

    /**
     * Append child rules.
     * <p>
     * Nothing is added if any check fails.
     *
     * @throws NullRuleException   if a child is null (index within {@code rules})
     * @throws ChainArityException if this is a chain rule and it would own more than one child
     */
    @SafeVarargs
    public final void addChildren(Rule<V>... rules) {
        Objects.requireNonNull(rules, "rules");
        if (ruleType == RuleType.CHAIN && children.size() + rules.length > 1) {
            throw ChainArityException.multipleChildren();
        }
        for (int i = 0; i < rules.length; i++) {
            if (rules[i] == null) {
                throw new NullRuleException(i);
            }
        }
        Collections.addAll(children, rules);
    }

    /**
     * Fluent form of {@link #addChildren(Rule[])}.
     */
    @SafeVarargs
    public final Rule<V> withChildren(Rule<V>... rules) {
        addChildren(rules);
        return this;
    }

    public List<Rule<V>> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public int childrenCount() {
        return children.size();
    }

    // RuleView

    @Override
    public RuleContext<V> getRuleContext() {
        return ruleContext;
    }

    @Override
    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    @Override
    public RuleType getRuleType() {
        return ruleType;
    }

    @Override
    public String getName() {
        return name;
    }

    void bind(RuleContext<V> ruleContext, CancellationToken cancellationToken) {
        this.ruleContext = ruleContext;
        this.cancellationToken = cancellationToken;
    }

    /**
     * Fire this rule.
     *
     * @param runner     runner used for the children
     * @param depth      nesting level of this rule, 1 for roots
     * @param activePath rules currently firing in this run
     * @return true if sibling iteration should continue
     */
    boolean fire(RuleRunner runner, int depth, Set<Rule<?>> activePath) {
        if (cancellationToken.isCancelled()) {
            log.warn("{} not fired, token cancelled: {}", this, cancellationToken.getReason());
            throw new RuleCancelledException(cancellationToken.getReason());
        }

        EvaluationResult evaluation = onEval != null ? onEval.evaluate(this) : EvaluationResult.proceed();
        if (evaluation == null) {
            throw new RuleEvaluationException("evaluation hook of " + this + " returned null",
                    new NullPointerException("evaluation result"));
        }
        if (evaluation.isFailed()) {
            throw evaluationFailure(evaluation.error());
        }

        if (!evaluation.shouldExecute()) {
            if (runner.isTraceEnabled()) {
                log.trace("Level {}, {}: skipped", depth, this);
            }
            return true;
        }

        runPhase(ExecutionPhase.PRE_EXECUTE, onPreExecute);
        runPhase(ExecutionPhase.EXECUTE, onExecute);
        runPhase(ExecutionPhase.POST_EXECUTE, onPostExecute);
        if (runner.isTraceEnabled()) {
            log.trace("Level {}, {}: executed", depth, this);
        }

        runner.runChildren(ruleType, cancellationToken, ruleContext, children, depth + 1, activePath);

        // An executed best-first rule satisfies the search
        return ruleType == RuleType.CHAIN;
    }

    private void runPhase(ExecutionPhase phase, ExecutionHook<V> hook) {
        if (hook == null) {
            return;
        }
        ExecutionResult result = hook.execute(this);
        if (result == null) {
            throw new RuleExecutionException(phase, new NullPointerException(phase.getDisplayName() + " result"));
        }
        if (result.isFailed()) {
            if (result.error() instanceof RuleException ruleException) {
                throw ruleException;
            }
            throw new RuleExecutionException(phase, result.error());
        }
    }

    private RuleException evaluationFailure(Throwable error) {
        if (error instanceof RuleException ruleException) {
            return ruleException;
        }
        return new RuleEvaluationException("evaluation of " + this + " failed: " + error.getMessage(), error);
    }

    @Override
    public String toString() {
        return "Rule{" +
                (name != null ? "name='" + name + "', " : "") +
                "type=" + ruleType +
                ", children=" + children.size() +
                '}';
    }
}
