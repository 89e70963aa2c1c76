package com.pipe.time;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Window that repeats every period of fixed length (a day, a week).
 * <p>
 * The window is described by two offsets from the start of the period.
 * When the end offset is not after the start offset the window wraps into
 * the following period (e.g. daily 22:00 to 06:00).
 */
public abstract class RecurringWindow implements TimeWindow {

    private final Duration startOffset;
    private final Duration endOffset;

    protected RecurringWindow(Duration startOffset, Duration endOffset) {
        Duration period = periodLength();
        if (startOffset.isNegative() || startOffset.compareTo(period) >= 0
                || endOffset.isNegative() || endOffset.compareTo(period) >= 0) {
            throw new IllegalArgumentException("Offsets must lie within the period of " + period);
        }
        if (startOffset.equals(endOffset)) {
            throw new IllegalArgumentException("Recurring window start and end cannot be equal");
        }
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    /**
     * Get the first instant of the period that contains the given instant.
     */
    protected abstract LocalDateTime periodStart(LocalDateTime instant);

    protected abstract Duration periodLength();

    /**
     * Create a window of the same kind with the given offsets.
     */
    protected abstract RecurringWindow withOffsets(Duration startOffset, Duration endOffset);

    public Duration getStartOffset() {
        return startOffset;
    }

    public Duration getEndOffset() {
        return endOffset;
    }

    public boolean isWrapping() {
        return endOffset.compareTo(startOffset) < 0;
    }

    @Override
    public boolean contains(LocalDateTime instant) {
        Duration offset = Duration.between(periodStart(instant), instant);
        boolean afterStart = offset.compareTo(startOffset) >= 0;
        boolean beforeEnd = offset.compareTo(endOffset) < 0;
        return isWrapping() ? afterStart || beforeEnd : afterStart && beforeEnd;
    }

    @Override
    public TimeWindow complement() {
        return withOffsets(endOffset, startOffset);
    }

    @Override
    public Optional<TimeInterval> rollForward(LocalDateTime instant) {
        Duration period = periodLength();
        LocalDateTime current = periodStart(instant);
        // A wrapping occurrence that began in the previous period may still be open.
        for (int k = -1; k <= 1; k++) {
            LocalDateTime base = current.plus(period.multipliedBy(k));
            LocalDateTime start = base.plus(startOffset);
            LocalDateTime end = base.plus(endOffset);
            if (isWrapping()) {
                end = end.plus(period);
            }
            if (end.isAfter(instant)) {
                return Optional.of(new TimeInterval(start.isAfter(instant) ? start : instant, end));
            }
        }
        throw new IllegalStateException("No occurrence of " + this + " found after " + instant);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecurringWindow that = (RecurringWindow) o;
        return startOffset.equals(that.startOffset) && endOffset.equals(that.endOffset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), startOffset, endOffset);
    }
}
