package com.pipe.condition;

import com.pipe.condition.impl.AllCondition;
import com.pipe.condition.impl.AnyCondition;
import com.pipe.condition.impl.NotCondition;
import com.pipe.time.TimeWindow;

import java.util.Optional;

/**
 * Represents a boolean condition that decides whether a task should fire.
 * <p>
 * Conditions are immutable and side-effect free. They read the current time
 * only through the {@link ConditionContext} passed to {@link #evaluate}, so the
 * same instance may be evaluated concurrently.
 */
public interface Condition {

    /**
     * Evaluate this condition.
     *
     * @param context Evaluation context supplying the clock
     * @return true if the condition holds
     * @throws com.pipe.exception.ConditionEvaluationException if the truth value cannot be determined
     */
    boolean evaluate(ConditionContext context);

    /**
     * Evaluate this condition against the system clock.
     */
    default boolean evaluate() {
        return evaluate(ConditionContext.systemDefault());
    }

    /**
     * Get the condition type.
     */
    ConditionType getType();

    /**
     * Combine with another condition using logical AND.
     */
    default Condition and(Condition other) {
        return AllCondition.of(this, other);
    }

    /**
     * Combine with another condition using logical OR.
     */
    default Condition or(Condition other) {
        return AnyCondition.of(this, other);
    }

    /**
     * Negate this condition.
     */
    default Condition not() {
        return NotCondition.of(this);
    }

    /**
     * Get the window during which this condition could possibly be true.
     * Conditions without temporal structure could be true at any time.
     */
    default TimeWindow cycle() {
        return TimeWindow.unbounded();
    }

    /**
     * Access this condition as the given type. Wrapping conditions forward the
     * request to the condition they wrap.
     *
     * @param type Requested type
     * @return This condition (or the wrapped one) as {@code type}, or empty
     */
    default <T> Optional<T> unwrap(Class<T> type) {
        return type.isInstance(this) ? Optional.of(type.cast(this)) : Optional.empty();
    }
}
