package com.pipe.exception;

/**
 * Exception thrown when a condition cannot determine its truth value,
 * typically because an external probe is unavailable.
 * Propagates through composite conditions unless a short-circuit
 * prevents the failing child from being reached.
 */
public class ConditionEvaluationException extends PipeException {

    private final String condition;

    public ConditionEvaluationException(String condition, String message) {
        super("Cannot evaluate " + condition + ": " + message);
        this.condition = condition;
    }

    public ConditionEvaluationException(String condition, String message, Throwable cause) {
        super("Cannot evaluate " + condition + ": " + message, cause);
        this.condition = condition;
    }

    /**
     * Get the description of the condition that failed.
     */
    public String getCondition() {
        return condition;
    }
}
