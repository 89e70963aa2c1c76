package com.pipe.time;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A single occurrence of a time window, half-open {@code [start, end)}.
 * {@link LocalDateTime#MIN} and {@link LocalDateTime#MAX} stand for open sides.
 *
 * @param start First instant of the occurrence (inclusive)
 * @param end   End of the occurrence (exclusive)
 */
public record TimeInterval(LocalDateTime start, LocalDateTime end) {

    public TimeInterval {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Interval bounds cannot be null");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Interval start " + start + " must be before end " + end);
        }
    }

    public boolean contains(LocalDateTime instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    /**
     * Time from the given instant to the start of this interval, never negative.
     */
    public Duration distanceFrom(LocalDateTime instant) {
        if (!start.isAfter(instant)) {
            return Duration.ZERO;
        }
        return Duration.between(instant, start);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
