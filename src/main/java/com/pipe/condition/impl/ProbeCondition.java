package com.pipe.condition.impl;

import com.pipe.condition.Condition;
import com.pipe.condition.ConditionContext;
import com.pipe.condition.ConditionProbe;
import com.pipe.condition.ConditionType;
import com.pipe.exception.ConditionEvaluationException;

/**
 * Condition backed by an external check, e.g. "enough memory available".
 * A check that fails to run is reported as {@link ConditionEvaluationException}
 * rather than as a false result.
 */
public final class ProbeCondition implements Condition {

    private final String name;
    private final ConditionProbe probe;

    public ProbeCondition(String name, ConditionProbe probe) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("PROBE condition requires a name");
        }
        if (probe == null) {
            throw new IllegalArgumentException("PROBE condition requires a probe");
        }
        this.name = name;
        this.probe = probe;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean evaluate(ConditionContext context) {
        try {
            return probe.check(context);
        } catch (ConditionEvaluationException e) {
            throw e;
        } catch (Exception e) {
            throw new ConditionEvaluationException(name, String.valueOf(e.getMessage()), e);
        }
    }

    @Override
    public ConditionType getType() {
        return ConditionType.PROBE;
    }

    @Override
    public String toString() {
        return name;
    }
}
