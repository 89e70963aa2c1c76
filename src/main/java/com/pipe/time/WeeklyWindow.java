package com.pipe.time;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.TemporalAdjusters;

/**
 * Window repeating every week (Monday-based), {@code [start, end)} where both
 * bounds are a day of week and a time of day. Wraps past Sunday midnight when
 * the end is not after the start.
 */
public final class WeeklyWindow extends RecurringWindow {

    private static final Duration WEEK = Duration.ofDays(7);

    public WeeklyWindow(DayOfWeek startDay, LocalTime startTime, DayOfWeek endDay, LocalTime endTime) {
        this(offset(startDay, startTime), offset(endDay, endTime));
    }

    private WeeklyWindow(Duration startOffset, Duration endOffset) {
        super(startOffset, endOffset);
    }

    /**
     * Create a window covering whole days from {@code first} through {@code last}
     * (both inclusive). Monday through Sunday yields {@link TimeWindow#unbounded()}.
     */
    public static TimeWindow between(DayOfWeek first, DayOfWeek last) {
        DayOfWeek dayAfter = last.plus(1);
        if (first == dayAfter) {
            return TimeWindow.unbounded();
        }
        return new WeeklyWindow(first, LocalTime.MIDNIGHT, dayAfter, LocalTime.MIDNIGHT);
    }

    /**
     * Create a window covering one whole day of the week.
     */
    public static TimeWindow on(DayOfWeek day) {
        return between(day, day);
    }

    @Override
    protected LocalDateTime periodStart(LocalDateTime instant) {
        return instant.toLocalDate()
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                .atStartOfDay();
    }

    @Override
    protected Duration periodLength() {
        return WEEK;
    }

    @Override
    protected RecurringWindow withOffsets(Duration startOffset, Duration endOffset) {
        return new WeeklyWindow(startOffset, endOffset);
    }

    private static Duration offset(DayOfWeek day, LocalTime time) {
        if (day == null || time == null) {
            throw new IllegalArgumentException("Day of week and time cannot be null");
        }
        return Duration.ofDays(day.getValue() - 1L).plusNanos(time.toNanoOfDay());
    }

    private static String describe(Duration offset) {
        DayOfWeek day = DayOfWeek.of((int) offset.toDays() + 1);
        LocalTime time = LocalTime.ofNanoOfDay(offset.minusDays(offset.toDays()).toNanos());
        return day + " " + time;
    }

    @Override
    public String toString() {
        return "weekly between " + describe(getStartOffset()) + " and " + describe(getEndOffset());
    }
}
