package com.pipe.tick;

import java.time.Duration;

/**
 * Result of evaluating one task's condition.
 *
 * @param task     Task name
 * @param status   Whether the task fires, waits or failed to evaluate
 * @param estimate Time until the condition might change (zero unless waiting)
 * @param error    Failure message for ERROR verdicts, otherwise null
 */
public record TaskVerdict(String task, VerdictStatus status, Duration estimate, String error) {

    public static TaskVerdict fire(String task) {
        return new TaskVerdict(task, VerdictStatus.FIRE, Duration.ZERO, null);
    }

    public static TaskVerdict waiting(String task, Duration estimate) {
        return new TaskVerdict(task, VerdictStatus.WAIT, estimate, null);
    }

    public static TaskVerdict failed(String task, String error) {
        return new TaskVerdict(task, VerdictStatus.ERROR, Duration.ZERO, error);
    }

    public boolean fires() {
        return status == VerdictStatus.FIRE;
    }
}
