package com.dredd.core;

import com.dredd.context.RuleContext;

/**
 * What a hook sees of the rule it runs for.
 *
 * @param <V> value type of the rule context
 */
public interface RuleView<V> {

    /**
     * The context bound by the runner for the current invocation.
     */
    RuleContext<V> getRuleContext();

    /**
     * The cancellation token bound by the runner for the current invocation.
     * Long-running hooks may poll it. A hook may also cancel it to stop the rest of the run;
     * when the run was started without a token this is {@link CancellationToken#none()},
     * on which cancelling has no effect.
     */
    CancellationToken getCancellationToken();

    RuleType getRuleType();

    /**
     * Optional rule name, null if none was given.
     */
    String getName();
}
