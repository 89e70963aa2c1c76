package com.pipe;

import com.pipe.condition.ConditionContext;
import com.pipe.spring.EnableConditions;
import com.pipe.tick.TaskVerdict;
import com.pipe.tick.TickEvaluator;
import com.pipe.tick.TickReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.time.Duration;

/**
 * Example Spring Boot application that evaluates the configured task
 * conditions once and reports what a scheduler would do.
 */
@SpringBootApplication
@EnableConditions
public class PipeApplication {

    private static final Logger log = LoggerFactory.getLogger(PipeApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PipeApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(TickEvaluator tickEvaluator, Clock conditionClock) {
        return args -> {
            ConditionContext context = ConditionContext.of(conditionClock);

            log.info("=== Condition Demo Started ===");
            log.info("Tasks planned for the next 24h: {}", tickEvaluator.plan(context, Duration.ofHours(24)));

            TickReport report = tickEvaluator.evaluate(context);
            for (TaskVerdict verdict : report.verdicts()) {
                log.info("{} -> {} (estimate {})", verdict.task(), verdict.status(), verdict.estimate());
            }
            log.info("Next check in {}", report.nextCheckDelay());
        };
    }
}
