package com.pipe;

import com.pipe.condition.ConditionContext;
import com.pipe.condition.DefaultConditionRegistry;
import com.pipe.config.ConfigLoader;
import com.pipe.config.SchedulerConfig;
import com.pipe.tick.DefaultTickEvaluator;
import com.pipe.tick.TickEvaluator;
import com.pipe.tick.TickReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests over the bundled scheduler configuration.
 * Tests cover:
 * - Which tasks fire at different times of the week
 * - Delay until the next useful tick
 * - Planning by condition cycle
 */
class PipeApplicationTest {

    private SchedulerConfig config;
    private TickEvaluator evaluator;

    @BeforeEach
    void setUp() {
        config = ConfigLoader.load("classpath:pipe-conditions.yaml", DefaultConditionRegistry.withDefaults());
        evaluator = new DefaultTickEvaluator(config);
    }

    // =====================================================================
    // Firing Tests
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Should fire the tasks whose conditions hold")
    @CsvSource(delimiter = ';', value = {
            "2024-01-15T09:00; office-report,heartbeat",
            "2024-01-15T23:00; nightly-cleanup,heartbeat",
            "2024-01-16T03:59; nightly-cleanup,heartbeat",
            "2024-01-20T12:30; heartbeat",
            "2024-01-20T14:00; weekend-maintenance,heartbeat",
            "2024-01-20T23:30; nightly-cleanup,weekend-maintenance,heartbeat"
    })
    void shouldFireMatchingTasks(String instant, String expected) {
        TickReport report = evaluator.evaluate(ConditionContext.fixed(LocalDateTime.parse(instant)));

        assertEquals(List.of(expected.split(",")), report.firing());
        assertTrue(report.failed().isEmpty());
    }

    // =====================================================================
    // Delay Tests
    // =====================================================================

    @Test
    @DisplayName("Should re-check quickly while a task fires")
    void shouldRecheckQuicklyWhileFiring() {
        TickReport report = evaluator.evaluate(ConditionContext.fixed(LocalDateTime.of(2024, 1, 15, 9, 0)));

        assertEquals(config.minSleep(), report.nextCheckDelay());
    }

    @Test
    @DisplayName("Should estimate waiting tasks")
    void shouldEstimateWaitingTasks() {
        TickReport report = evaluator.evaluate(ConditionContext.fixed(LocalDateTime.of(2024, 1, 15, 9, 0)));

        assertEquals(Duration.ofHours(13), report.verdictFor("nightly-cleanup").estimate());
        assertEquals(Duration.ofDays(4).plusHours(15), report.verdictFor("weekend-maintenance").estimate());
    }

    // =====================================================================
    // Planning Tests
    // =====================================================================

    @Test
    @DisplayName("Should plan tasks by cycle")
    void shouldPlanByCycle() {
        ConditionContext monday = ConditionContext.fixed(LocalDateTime.of(2024, 1, 15, 18, 0));

        assertEquals(List.of("heartbeat"), evaluator.plan(monday, Duration.ofHours(1)));
        assertEquals(List.of("nightly-cleanup", "heartbeat"), evaluator.plan(monday, Duration.ofHours(5)));
        assertEquals(List.of("office-report", "nightly-cleanup", "heartbeat"),
                evaluator.plan(monday, Duration.ofDays(1)));
        assertEquals(4, evaluator.plan(monday, Duration.ofDays(7)).size());
    }
}
