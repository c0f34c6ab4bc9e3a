package com.dredd.core;

import com.dredd.context.RuleContext;
import com.dredd.exception.ChainArityException;
import com.dredd.exception.NullRuleException;
import com.dredd.exception.RuleCancelledException;
import com.dredd.exception.RuleConfigurationException;
import com.dredd.exception.RuleEvaluationException;
import com.dredd.exception.RuleExecutionException;
import com.dredd.hook.EvaluationResult;
import com.dredd.hook.ExecutionPhase;
import com.dredd.hook.ExecutionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the rule firing lifecycle, hook errors and builder options.
 */
class RuleTest {

    private RuleRunner runner;
    private RuleContext<String> context;
    private List<String> events;

    @BeforeEach
    void setUp() {
        runner = RuleRunner.defaults();
        context = new RuleContext<>();
        events = new ArrayList<>();
    }

    // =====================================================================
    // Hook errors
    // =====================================================================

    @Test
    @DisplayName("Evaluation error should abort before any execute hook")
    void evaluationErrorShouldAbort() {
        IllegalStateException cause = new IllegalStateException("no rates loaded");
        Rule<String> rule = Rule.<String>chain()
                .onEvalDetailed(view -> EvaluationResult.failed(cause))
                .onPreExecute(view -> events.add("pre"))
                .onExecute(view -> events.add("execute"));
        rule.addChildren(Rule.<String>chain().onEval(view -> events.add("child")));

        RuleEvaluationException e = assertThrows(RuleEvaluationException.class, () -> runner.chain(context, rule));

        assertSame(cause, e.getCause());
        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("Execute error should skip post-execute and children")
    void executeErrorShouldSkipRest() {
        Rule<String> child = Rule.<String>chain().onExecute(view -> events.add("child"));
        Rule<String> rule = Rule.<String>chain()
                .onPreExecute(view -> events.add("pre"))
                .onExecuteDetailed(view -> ExecutionResult.failed(new RuntimeException("boom")))
                .onPostExecute(view -> events.add("post"))
                .withChildren(child);

        RuleExecutionException e = assertThrows(RuleExecutionException.class, () -> runner.chain(context, rule));

        assertEquals(ExecutionPhase.EXECUTE, e.getPhase());
        assertEquals("boom", e.getCause().getMessage());
        assertEquals(List.of("pre"), events);
    }

    @Test
    @DisplayName("Pre-execute error should skip execute")
    void preExecuteErrorShouldSkipExecute() {
        Rule<String> rule = Rule.<String>bestFirst()
                .onPreExecuteDetailed(view -> ExecutionResult.failed(new RuntimeException("pre")))
                .onExecute(view -> events.add("execute"));

        RuleExecutionException e = assertThrows(RuleExecutionException.class, () -> runner.bestFirst(context, rule));

        assertEquals(ExecutionPhase.PRE_EXECUTE, e.getPhase());
        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("Post-execute error should keep children from running")
    void postExecuteErrorShouldSkipChildren() {
        Rule<String> rule = Rule.<String>bestFirst()
                .onExecute(view -> events.add("execute"))
                .onPostExecuteDetailed(view -> ExecutionResult.failed(new RuntimeException("post")))
                .withChildren(Rule.<String>bestFirst().onExecute(view -> events.add("child")));

        RuleExecutionException e = assertThrows(RuleExecutionException.class, () -> runner.bestFirst(context, rule));

        assertEquals(ExecutionPhase.POST_EXECUTE, e.getPhase());
        assertEquals(List.of("execute"), events);
    }

    @Test
    @DisplayName("Error in a best-first sibling should abort the remaining siblings")
    void siblingErrorShouldAbortSearch() {
        Rule<String> failing = Rule.<String>bestFirst()
                .onEvalDetailed(view -> EvaluationResult.failed(new RuntimeException("bad input")));
        Rule<String> next = Rule.<String>bestFirst().onEval(view -> events.add("next"));

        assertThrows(RuleEvaluationException.class, () -> runner.bestFirst(context, failing, next));
        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("Child error should reach the caller unchanged")
    void childErrorShouldPropagateUnchanged() {
        RuleCancelledException own = new RuleCancelledException("hook gave up");
        Rule<String> child = Rule.<String>chain().onExecuteDetailed(view -> ExecutionResult.failed(own));
        Rule<String> root = Rule.<String>chain().withChildren(child);

        RuleCancelledException e = assertThrows(RuleCancelledException.class, () -> runner.chain(context, root));
        assertSame(own, e);
    }

    @Test
    @DisplayName("Exception thrown from a hook should propagate as is")
    void thrownExceptionShouldPropagate() {
        Rule<String> rule = Rule.<String>chain().onExecute(view -> {
            throw new IllegalArgumentException("thrown");
        });

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> runner.chain(context, rule));
        assertEquals("thrown", e.getMessage());
    }

    @Test
    @DisplayName("Hook should see the bound context and token")
    void hookShouldSeeBoundContextAndToken() {
        CancellationToken token = CancellationToken.create();
        Rule<String> rule = Rule.<String>chain().named("probe").onExecute(view -> {
            assertSame(context, view.getRuleContext());
            assertSame(token, view.getCancellationToken());
            assertEquals(RuleType.CHAIN, view.getRuleType());
            view.getRuleContext().set("seen-by", view.getName());
        });

        runner.chain(token, context, rule);

        assertEquals("probe", context.mustGet("seen-by"));
    }

    // =====================================================================
    // Children
    // =====================================================================

    @Test
    @DisplayName("Null child should be rejected with its index and leave children untouched")
    void nullChildShouldBeRejected() {
        Rule<String> parent = Rule.bestFirst();
        Rule<String> ok = Rule.bestFirst();

        NullRuleException e = assertThrows(NullRuleException.class, () -> parent.addChildren(ok, null));

        assertEquals(1, e.getIndex());
        assertEquals(0, parent.childrenCount());
    }

    @Test
    @DisplayName("Children list should be read-only")
    void childrenShouldBeReadOnly() {
        Rule<String> parent = Rule.<String>bestFirst().withChildren(Rule.<String>bestFirst());

        assertThrows(UnsupportedOperationException.class, () -> parent.getChildren().clear());
        assertEquals(1, parent.childrenCount());
    }

    // =====================================================================
    // Builder options
    // =====================================================================

    @Test
    @DisplayName("Options should configure hooks and children")
    void optionsShouldConfigureRule() {
        Rule<String> child = Rule.create(RuleType.CHAIN,
                RuleOptions.<String>execution(view -> events.add("child")));
        Rule<String> rule = Rule.create(RuleType.CHAIN,
                RuleOptions.<String>name("root"),
                RuleOptions.<String>evaluation(view -> view.getRuleContext().exists("go")),
                RuleOptions.<String>preExecution(view -> events.add("pre")),
                RuleOptions.<String>execution(view -> events.add("execute")),
                RuleOptions.<String>postExecution(view -> events.add("post")),
                RuleOptions.children(child));
        context.set("go", "yes");

        runner.chain(context, rule);

        assertEquals("root", rule.getName());
        assertEquals(List.of("pre", "execute", "post", "child"), events);
    }

    @Test
    @DisplayName("Detailed options should report hook errors")
    void detailedOptionsShouldReportErrors() {
        Rule<String> rule = Rule.create(RuleType.BEST_FIRST,
                RuleOptions.<String>evaluationDetailed(view -> EvaluationResult.proceed()),
                RuleOptions.<String>preExecutionDetailed(view -> ExecutionResult.ok()),
                RuleOptions.<String>executionDetailed(view -> ExecutionResult.ok()),
                RuleOptions.<String>postExecutionDetailed(view -> ExecutionResult.failed(new RuntimeException("audit"))));

        RuleExecutionException e = assertThrows(RuleExecutionException.class, () -> runner.bestFirst(context, rule));
        assertEquals(ExecutionPhase.POST_EXECUTE, e.getPhase());
    }

    @Test
    @DisplayName("Chain arity violation inside an option should fail construction")
    void arityViolationInOptionShouldFail() {
        RuleConfigurationException e = assertThrows(RuleConfigurationException.class,
                () -> Rule.create(RuleType.CHAIN,
                        RuleOptions.children(Rule.<String>chain(), Rule.<String>chain())));

        assertInstanceOf(ChainArityException.class, e.getCause());
    }

    @Test
    @DisplayName("Null child inside an option should fail construction with its index")
    void nullChildInOptionShouldFail() {
        RuleConfigurationException e = assertThrows(RuleConfigurationException.class,
                () -> Rule.create(RuleType.BEST_FIRST,
                        RuleOptions.children(Rule.<String>bestFirst(), null, Rule.<String>bestFirst())));

        NullRuleException cause = assertInstanceOf(NullRuleException.class, e.getCause());
        assertEquals(1, cause.getIndex());
    }

    @Test
    @DisplayName("Hook cancelling a run started without a token should not break the run")
    void cancellingNoneTokenFromHookShouldBeNoOp() {
        Rule<String> child = Rule.<String>chain().onExecute(view -> events.add("child"));
        Rule<String> rule = Rule.<String>chain()
                .onExecute(view -> events.add("cancelled=" + view.getCancellationToken().cancel()))
                .withChildren(child);

        assertDoesNotThrow(() -> runner.chain(context, rule));
        assertEquals(List.of("cancelled=false", "child"), events);
    }

    @Test
    @DisplayName("toString should describe type and children")
    void toStringShouldDescribeRule() {
        Rule<String> rule = Rule.<String>bestFirst().named("vip").withChildren(Rule.<String>chain());

        assertEquals("Rule{name='vip', type=BestFirstRule, children=1}", rule.toString());
    }
}
