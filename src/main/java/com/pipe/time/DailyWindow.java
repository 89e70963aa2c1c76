package com.pipe.time;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Time-of-day window repeating every day, {@code [start, end)}.
 * Wraps past midnight when {@code end} is not after {@code start}.
 */
public final class DailyWindow extends RecurringWindow {

    private static final Duration DAY = Duration.ofDays(1);

    public DailyWindow(LocalTime start, LocalTime end) {
        this(offset(start), offset(end));
    }

    private DailyWindow(Duration startOffset, Duration endOffset) {
        super(startOffset, endOffset);
    }

    /**
     * Create a daily window. Equal bounds cover the whole day and
     * yield {@link TimeWindow#unbounded()}.
     */
    public static TimeWindow between(LocalTime start, LocalTime end) {
        if (start.equals(end)) {
            return TimeWindow.unbounded();
        }
        return new DailyWindow(start, end);
    }

    public LocalTime getStart() {
        return LocalTime.ofNanoOfDay(getStartOffset().toNanos());
    }

    public LocalTime getEnd() {
        return LocalTime.ofNanoOfDay(getEndOffset().toNanos());
    }

    @Override
    protected LocalDateTime periodStart(LocalDateTime instant) {
        return instant.toLocalDate().atStartOfDay();
    }

    @Override
    protected Duration periodLength() {
        return DAY;
    }

    @Override
    protected RecurringWindow withOffsets(Duration startOffset, Duration endOffset) {
        return new DailyWindow(startOffset, endOffset);
    }

    private static Duration offset(LocalTime time) {
        if (time == null) {
            throw new IllegalArgumentException("Time of day cannot be null");
        }
        return Duration.ofNanos(time.toNanoOfDay());
    }

    @Override
    public String toString() {
        return "daily between " + getStart() + " and " + getEnd();
    }
}
