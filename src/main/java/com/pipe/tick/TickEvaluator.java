package com.pipe.tick;

import com.pipe.condition.ConditionContext;

import java.time.Duration;
import java.util.List;

/**
 * Evaluates the conditions of all configured tasks at a scheduler tick.
 * A failing condition is reported for its own task and never aborts the tick.
 */
public interface TickEvaluator {

    /**
     * Evaluate every task condition against the given context.
     *
     * @param context Evaluation context supplying the clock
     * @return Verdicts and the delay until the next useful check
     */
    TickReport evaluate(ConditionContext context);

    /**
     * Find the tasks whose condition cycle may overlap the horizon starting now.
     * Tasks whose cycle cannot be determined are always included.
     *
     * @param context Evaluation context supplying the clock
     * @param horizon Length of the planning horizon
     * @return Task names in configuration order
     */
    List<String> plan(ConditionContext context, Duration horizon);
}
