package com.pipe.condition.impl;

import com.pipe.condition.Condition;
import com.pipe.condition.ConditionContext;
import com.pipe.condition.ConditionType;

/**
 * Condition that always evaluates to false.
 */
public final class AlwaysFalseCondition implements Condition {

    public static final AlwaysFalseCondition INSTANCE = new AlwaysFalseCondition();

    private AlwaysFalseCondition() {}

    @Override
    public boolean evaluate(ConditionContext context) {
        return false;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ALWAYS_FALSE;
    }

    @Override
    public String toString() {
        return "false";
    }
}
