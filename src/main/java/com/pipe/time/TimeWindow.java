package com.pipe.time;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A set of local date-times, possibly unbounded and possibly recurring.
 * <p>
 * Windows are immutable and closed under complement, union ({@link #or})
 * and intersection ({@link #and}). {@link #unbounded()} contains every
 * instant and is the identity of intersection; {@link #empty()} contains none.
 */
public interface TimeWindow {

    /**
     * Check whether the instant falls inside this window.
     */
    boolean contains(LocalDateTime instant);

    /**
     * Get the window containing exactly the instants this one does not.
     */
    TimeWindow complement();

    /**
     * Get the occurrence of this window that contains the instant (clipped so
     * that it starts at the instant), or else the next occurrence after it.
     *
     * @param instant Reference instant
     * @return Next occurrence, or empty if the window never occurs again
     */
    Optional<TimeInterval> rollForward(LocalDateTime instant);

    default boolean isUnbounded() {
        return false;
    }

    default boolean isEmpty() {
        return false;
    }

    /**
     * Union of this window and another.
     */
    default TimeWindow or(TimeWindow other) {
        return any(this, other);
    }

    /**
     * Intersection of this window and another.
     */
    default TimeWindow and(TimeWindow other) {
        return all(this, other);
    }

    static TimeWindow unbounded() {
        return StaticInterval.UNBOUNDED;
    }

    static TimeWindow empty() {
        return EmptyWindow.INSTANCE;
    }

    static TimeWindow any(TimeWindow... windows) {
        return AnyWindow.of(Arrays.asList(windows));
    }

    static TimeWindow any(List<? extends TimeWindow> windows) {
        return AnyWindow.of(windows);
    }

    static TimeWindow all(TimeWindow... windows) {
        return AllWindow.of(Arrays.asList(windows));
    }

    static TimeWindow all(List<? extends TimeWindow> windows) {
        return AllWindow.of(windows);
    }
}
