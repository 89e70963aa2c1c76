package com.pipe.condition.impl;

import com.pipe.condition.ChangeEstimating;
import com.pipe.condition.Condition;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Base class for conditions built from sub-conditions.
 * The child list is immutable and keeps construction order.
 */
public abstract class CompositeCondition implements Condition {

    private final List<Condition> conditions;

    protected CompositeCondition(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    /**
     * Get the direct sub-conditions in evaluation order.
     */
    public List<Condition> subconditions() {
        return conditions;
    }

    public Condition get(int index) {
        return conditions.get(index);
    }

    public int size() {
        return conditions.size();
    }

    /**
     * Rebuild this condition tree with every leaf condition replaced by
     * {@code func(leaf)}. Nested composites are rebuilt recursively.
     *
     * @param func Transformation applied to each leaf
     * @return New condition of the same shape
     */
    public Condition apply(UnaryOperator<Condition> func) {
        List<Condition> rebuilt = new ArrayList<>(conditions.size());
        for (Condition condition : conditions) {
            if (condition instanceof CompositeCondition composite) {
                rebuilt.add(composite.apply(func));
            } else {
                rebuilt.add(func.apply(condition));
            }
        }
        return rebuild(rebuilt);
    }

    /**
     * Create a condition of this kind over the given children.
     */
    protected abstract Condition rebuild(List<Condition> conditions);

    /**
     * Estimate for a single child, or {@code fallback} when the child
     * cannot estimate itself.
     */
    protected static Duration estimateOf(Condition condition, LocalDateTime now, Duration fallback) {
        if (condition instanceof ChangeEstimating estimating) {
            return estimating.estimateTimeToNextPossibleChange(now);
        }
        return fallback;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return conditions.equals(((CompositeCondition) o).conditions);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + conditions.hashCode();
    }
}
