package com.pipe.condition;

/**
 * External check backing a {@link com.pipe.condition.impl.ProbeCondition},
 * such as a resource-availability test.
 */
@FunctionalInterface
public interface ConditionProbe {

    /**
     * Run the check.
     *
     * @param context Evaluation context
     * @return Result of the check
     * @throws Exception if the check cannot be performed
     */
    boolean check(ConditionContext context) throws Exception;
}
