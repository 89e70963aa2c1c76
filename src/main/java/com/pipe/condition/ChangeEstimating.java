package com.pipe.condition;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Optional capability of a condition: estimating how long a scheduler can
 * sleep before the condition's value might change.
 */
public interface ChangeEstimating {

    /**
     * Smallest positive estimate, used where a branch cannot estimate itself.
     */
    Duration RESOLUTION = Duration.ofNanos(1);

    /**
     * Estimate for a condition that will never change again.
     */
    Duration INDEFINITE = ChronoUnit.FOREVER.getDuration();

    /**
     * Lower bound on the time until this condition could change its value.
     *
     * @param now Reference instant
     * @return Non-negative duration; zero means re-check immediately
     */
    Duration estimateTimeToNextPossibleChange(LocalDateTime now);
}
