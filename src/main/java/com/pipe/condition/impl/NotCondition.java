package com.pipe.condition.impl;

import com.pipe.condition.ChangeEstimating;
import com.pipe.condition.Condition;
import com.pipe.condition.ConditionContext;
import com.pipe.condition.ConditionType;
import com.pipe.time.TimeWindow;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Logical NOT condition - negates the nested condition.
 * <p>
 * Negating a NOT yields the originally wrapped condition, never a double
 * wrapper. Requests for capabilities NOT does not specialize are forwarded
 * to the wrapped condition through {@link #unwrap(Class)}.
 */
public final class NotCondition extends CompositeCondition implements ChangeEstimating {

    private NotCondition(Condition condition) {
        super(List.of(condition));
    }

    /**
     * Negate a condition.
     *
     * @param condition Condition to negate
     * @return The wrapped condition if {@code condition} is itself a NOT, else a new NOT
     */
    public static Condition of(Condition condition) {
        if (condition == null) {
            throw new IllegalArgumentException("NOT condition requires a nested condition");
        }
        if (condition instanceof NotCondition not) {
            return not.getCondition();
        }
        return new NotCondition(condition);
    }

    public Condition getCondition() {
        return get(0);
    }

    @Override
    public boolean evaluate(ConditionContext context) {
        return !getCondition().evaluate(context);
    }

    @Override
    public Condition not() {
        return getCondition();
    }

    @Override
    public TimeWindow cycle() {
        if (getCondition() instanceof TimeCondition time) {
            return time.getWindow().complement();
        }
        return TimeWindow.unbounded();
    }

    @Override
    public Duration estimateTimeToNextPossibleChange(LocalDateTime now) {
        Condition condition = getCondition();
        if (condition instanceof TimeCondition time) {
            return time.getWindow().complement().rollForward(now)
                    .map(next -> next.distanceFrom(now))
                    .orElse(INDEFINITE);
        }
        return estimateOf(condition, now, Duration.ZERO);
    }

    @Override
    public <T> Optional<T> unwrap(Class<T> type) {
        if (type.isInstance(this)) {
            return Optional.of(type.cast(this));
        }
        return getCondition().unwrap(type);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.NOT;
    }

    @Override
    protected Condition rebuild(List<Condition> conditions) {
        return of(conditions.get(0));
    }

    @Override
    public String toString() {
        return "~" + getCondition();
    }
}
