package com.pipe.condition.impl;

import com.pipe.condition.ChangeEstimating;
import com.pipe.condition.Condition;
import com.pipe.condition.ConditionContext;
import com.pipe.condition.ConditionType;
import com.pipe.time.TimeWindow;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Logical OR condition - at least one nested condition must be true.
 * Nested OR conditions are absorbed at construction, so the tree stays flat.
 */
public final class AnyCondition extends CompositeCondition implements ChangeEstimating {

    private AnyCondition(List<Condition> conditions) {
        super(conditions);
    }

    public static AnyCondition of(Condition... conditions) {
        return of(Arrays.asList(conditions));
    }

    public static AnyCondition of(List<? extends Condition> conditions) {
        List<Condition> flat = new ArrayList<>();
        for (Condition condition : conditions) {
            if (condition == null) {
                throw new IllegalArgumentException("ANY condition cannot contain null");
            }
            if (condition instanceof AnyCondition any) {
                flat.addAll(any.subconditions());
            } else {
                flat.add(condition);
            }
        }
        if (flat.isEmpty()) {
            throw new IllegalArgumentException("ANY condition requires nested conditions");
        }
        return new AnyCondition(flat);
    }

    @Override
    public boolean evaluate(ConditionContext context) {
        // Stop at the first true child: later ones may be costly or unable to evaluate.
        for (Condition condition : subconditions()) {
            if (condition.evaluate(context)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Any branch changing is reason to re-check, so the soonest estimate wins.
     */
    @Override
    public Duration estimateTimeToNextPossibleChange(LocalDateTime now) {
        Duration soonest = null;
        for (Condition condition : subconditions()) {
            Duration estimate = estimateOf(condition, now, Duration.ZERO);
            if (soonest == null || estimate.compareTo(soonest) < 0) {
                soonest = estimate;
            }
        }
        return soonest;
    }

    @Override
    public TimeWindow cycle() {
        boolean allTemporal = subconditions().stream().allMatch(c -> c instanceof TimeCondition);
        if (!allTemporal) {
            return TimeWindow.unbounded();
        }
        return TimeWindow.any(subconditions().stream().map(Condition::cycle).collect(Collectors.toList()));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ANY;
    }

    @Override
    protected Condition rebuild(List<Condition> conditions) {
        return of(conditions);
    }

    @Override
    public String toString() {
        return subconditions().stream().map(String::valueOf).collect(Collectors.joining(" | ", "(", ")"));
    }
}
