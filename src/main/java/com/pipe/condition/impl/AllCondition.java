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
 * Logical AND condition - all nested conditions must be true.
 * Nested AND conditions are absorbed at construction, so the tree stays flat.
 */
public final class AllCondition extends CompositeCondition implements ChangeEstimating {

    private AllCondition(List<Condition> conditions) {
        super(conditions);
    }

    public static AllCondition of(Condition... conditions) {
        return of(Arrays.asList(conditions));
    }

    public static AllCondition of(List<? extends Condition> conditions) {
        List<Condition> flat = new ArrayList<>();
        for (Condition condition : conditions) {
            if (condition == null) {
                throw new IllegalArgumentException("ALL condition cannot contain null");
            }
            if (condition instanceof AllCondition all) {
                flat.addAll(all.subconditions());
            } else {
                flat.add(condition);
            }
        }
        if (flat.isEmpty()) {
            throw new IllegalArgumentException("ALL condition requires nested conditions");
        }
        return new AllCondition(flat);
    }

    @Override
    public boolean evaluate(ConditionContext context) {
        for (Condition condition : subconditions()) {
            if (!condition.evaluate(context)) {
                return false;
            }
        }
        return true;
    }

    /**
     * The conjunction cannot turn true before every branch could, so the
     * latest estimate wins. Branches that cannot estimate count as the
     * smallest positive resolution.
     */
    @Override
    public Duration estimateTimeToNextPossibleChange(LocalDateTime now) {
        Duration latest = null;
        for (Condition condition : subconditions()) {
            Duration estimate = estimateOf(condition, now, RESOLUTION);
            if (latest == null || estimate.compareTo(latest) > 0) {
                latest = estimate;
            }
        }
        return latest;
    }

    @Override
    public TimeWindow cycle() {
        return TimeWindow.all(subconditions().stream().map(Condition::cycle).collect(Collectors.toList()));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ALL;
    }

    @Override
    protected Condition rebuild(List<Condition> conditions) {
        return of(conditions);
    }

    @Override
    public String toString() {
        return subconditions().stream().map(String::valueOf).collect(Collectors.joining(" & ", "(", ")"));
    }
}
