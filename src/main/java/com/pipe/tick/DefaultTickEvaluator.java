package com.pipe.tick;

import com.pipe.condition.ChangeEstimating;
import com.pipe.condition.Condition;
import com.pipe.condition.ConditionContext;
import com.pipe.condition.impl.TimeCondition;
import com.pipe.config.SchedulerConfig;
import com.pipe.config.TaskConfig;
import com.pipe.exception.ConditionEvaluationException;
import com.pipe.time.TimeInterval;
import com.pipe.time.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * TickEvaluator over the tasks of a {@link SchedulerConfig}.
 * Tasks are evaluated sequentially in configuration order.
 */
public class DefaultTickEvaluator implements TickEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DefaultTickEvaluator.class);

    private final SchedulerConfig config;

    public DefaultTickEvaluator(SchedulerConfig config) {
        this.config = config;
        log.info("DefaultTickEvaluator initialized for '{}' with {} tasks", config.name(), config.tasks().size());
    }

    @Override
    public TickReport evaluate(ConditionContext context) {
        LocalDateTime now = context.now();
        List<TaskVerdict> verdicts = new ArrayList<>(config.tasks().size());

        for (TaskConfig task : config.tasks()) {
            verdicts.add(evaluateTask(task, context));
        }

        Duration delay = nextCheckDelay(verdicts);
        log.debug("Tick at {}: {} tasks, next check in {}", now, verdicts.size(), delay);
        return new TickReport(now, verdicts, delay);
    }

    private TaskVerdict evaluateTask(TaskConfig task, ConditionContext context) {
        Condition condition = task.condition();
        try {
            if (condition.evaluate(context)) {
                log.debug("Task {} fires: {}", task.name(), condition);
                return TaskVerdict.fire(task.name());
            }
            // Estimate at the instant time conditions were evaluated at
            Duration estimate = condition instanceof ChangeEstimating estimating
                    ? estimating.estimateTimeToNextPossibleChange(context.now(TimeCondition.class))
                    : Duration.ZERO;
            log.debug("Task {} waits, next possible change in {}", task.name(), estimate);
            return TaskVerdict.waiting(task.name(), estimate);
        } catch (ConditionEvaluationException e) {
            log.warn("Task {} condition could not be evaluated: {}", task.name(), e.getMessage());
            return TaskVerdict.failed(task.name(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Task {} condition failed: {}", task.name(), condition, e);
            return TaskVerdict.failed(task.name(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Duration nextCheckDelay(List<TaskVerdict> verdicts) {
        Duration delay = config.maxSleep();
        for (TaskVerdict verdict : verdicts) {
            if (verdict.status() != VerdictStatus.WAIT) {
                return config.minSleep();
            }
            if (verdict.estimate().compareTo(delay) < 0) {
                delay = verdict.estimate();
            }
        }
        return delay.compareTo(config.minSleep()) < 0 ? config.minSleep() : delay;
    }

    @Override
    public List<String> plan(ConditionContext context, Duration horizon) {
        LocalDateTime now = context.now(TimeCondition.class);
        LocalDateTime until = now.plus(horizon);
        List<String> planned = new ArrayList<>();

        for (TaskConfig task : config.tasks()) {
            TimeWindow cycle = task.condition().cycle();
            if (cycle.isUnbounded()) {
                planned.add(task.name());
                continue;
            }
            Optional<TimeInterval> next = cycle.rollForward(now);
            if (next.isPresent() && next.get().start().isBefore(until)) {
                planned.add(task.name());
            } else {
                log.debug("Task {} pruned: cycle {} does not overlap next {}", task.name(), cycle, horizon);
            }
        }
        return planned;
    }
}
