package com.pipe.config;

import com.pipe.condition.impl.AlwaysTrueCondition;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * Root configuration for the conditions of a scheduler.
 *
 * @param name     Scheduler name identifier
 * @param zone     Time zone in which time windows are interpreted
 * @param minSleep Lower bound for the delay between two ticks
 * @param maxSleep Upper bound for the delay between two ticks
 * @param tasks    Task conditions in declaration order
 */
public record SchedulerConfig(
        String name,
        ZoneId zone,
        Duration minSleep,
        Duration maxSleep,
        List<TaskConfig> tasks
) {
    /**
     * Get task config by name.
     */
    public TaskConfig getTask(String taskName) {
        return tasks.stream()
                .filter(t -> t.name().equals(taskName))
                .findFirst()
                .orElse(null);
    }

    /**
     * Create a minimal configuration for testing.
     */
    public static SchedulerConfig minimal() {
        return new SchedulerConfig(
                "test-scheduler",
                ZoneId.systemDefault(),
                Duration.ofMillis(100),
                Duration.ofMinutes(1),
                List.of(new TaskConfig("default", "true", AlwaysTrueCondition.INSTANCE))
        );
    }
}
