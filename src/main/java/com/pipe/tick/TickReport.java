package com.pipe.tick;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of one scheduler tick.
 *
 * @param evaluatedAt    Instant the tick was evaluated at
 * @param verdicts       One verdict per task, in configuration order
 * @param nextCheckDelay How long the scheduler may sleep before the next tick
 */
public record TickReport(LocalDateTime evaluatedAt, List<TaskVerdict> verdicts, Duration nextCheckDelay) {

    public TickReport {
        verdicts = List.copyOf(verdicts);
    }

    /**
     * Names of the tasks whose condition held.
     */
    public List<String> firing() {
        return namesWith(VerdictStatus.FIRE);
    }

    /**
     * Names of the tasks whose condition could not be evaluated.
     */
    public List<String> failed() {
        return namesWith(VerdictStatus.ERROR);
    }

    public TaskVerdict verdictFor(String task) {
        return verdicts.stream()
                .filter(v -> v.task().equals(task))
                .findFirst()
                .orElse(null);
    }

    private List<String> namesWith(VerdictStatus status) {
        return verdicts.stream()
                .filter(v -> v.status() == status)
                .map(TaskVerdict::task)
                .collect(Collectors.toList());
    }
}
