package com.pipe.condition.impl;

import com.pipe.condition.Condition;
import com.pipe.condition.ConditionContext;
import com.pipe.condition.ConditionType;

/**
 * Condition that always evaluates to true.
 * Identity of AND, and the default for an empty expression.
 */
public final class AlwaysTrueCondition implements Condition {

    public static final AlwaysTrueCondition INSTANCE = new AlwaysTrueCondition();

    private AlwaysTrueCondition() {}

    @Override
    public boolean evaluate(ConditionContext context) {
        return true;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ALWAYS_TRUE;
    }

    @Override
    public String toString() {
        return "true";
    }
}
