package com.pipe.time;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Non-recurring window {@code [start, end)}. Either side may be open,
 * in which case it is {@link LocalDateTime#MIN} or {@link LocalDateTime#MAX}.
 */
public final class StaticInterval implements TimeWindow {

    static final StaticInterval UNBOUNDED = new StaticInterval(LocalDateTime.MIN, LocalDateTime.MAX);

    private final LocalDateTime start;
    private final LocalDateTime end;

    private StaticInterval(LocalDateTime start, LocalDateTime end) {
        this.start = start;
        this.end = end;
    }

    public static StaticInterval between(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Interval bounds cannot be null");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Interval start " + start + " must be before end " + end);
        }
        if (start.equals(LocalDateTime.MIN) && end.equals(LocalDateTime.MAX)) {
            return UNBOUNDED;
        }
        return new StaticInterval(start, end);
    }

    public static StaticInterval after(LocalDateTime start) {
        return between(start, LocalDateTime.MAX);
    }

    public static StaticInterval before(LocalDateTime end) {
        return between(LocalDateTime.MIN, end);
    }

    public LocalDateTime getStart() {
        return start;
    }

    public LocalDateTime getEnd() {
        return end;
    }

    @Override
    public boolean contains(LocalDateTime instant) {
        return !instant.isBefore(start) && (end.equals(LocalDateTime.MAX) || instant.isBefore(end));
    }

    @Override
    public TimeWindow complement() {
        if (isUnbounded()) {
            return TimeWindow.empty();
        }
        List<TimeWindow> parts = new ArrayList<>(2);
        if (!start.equals(LocalDateTime.MIN)) {
            parts.add(before(start));
        }
        if (!end.equals(LocalDateTime.MAX)) {
            parts.add(after(end));
        }
        return TimeWindow.any(parts);
    }

    @Override
    public Optional<TimeInterval> rollForward(LocalDateTime instant) {
        if (!instant.isBefore(end)) {
            return Optional.empty();
        }
        LocalDateTime from = instant.isAfter(start) ? instant : start;
        return Optional.of(new TimeInterval(from, end));
    }

    @Override
    public boolean isUnbounded() {
        return start.equals(LocalDateTime.MIN) && end.equals(LocalDateTime.MAX);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StaticInterval that)) return false;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        boolean openStart = start.equals(LocalDateTime.MIN);
        boolean openEnd = end.equals(LocalDateTime.MAX);
        if (openStart && openEnd) {
            return "any time";
        }
        if (openStart) {
            return "before " + end;
        }
        if (openEnd) {
            return "after " + start;
        }
        return "between " + start + " and " + end;
    }
}
