package com.pipe.condition.impl;

import com.pipe.condition.ChangeEstimating;
import com.pipe.condition.Condition;
import com.pipe.condition.ConditionContext;
import com.pipe.condition.ConditionType;
import com.pipe.time.DailyWindow;
import com.pipe.time.StaticInterval;
import com.pipe.time.TimeWindow;
import com.pipe.time.WeeklyWindow;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Condition that is true while the current time falls inside its window.
 */
public final class TimeCondition implements Condition, ChangeEstimating {

    private final TimeWindow window;

    private TimeCondition(TimeWindow window) {
        if (window == null) {
            throw new IllegalArgumentException("TIME condition requires a window");
        }
        this.window = window;
    }

    public static TimeCondition fromWindow(TimeWindow window) {
        return new TimeCondition(window);
    }

    public static TimeCondition daily(LocalTime start, LocalTime end) {
        return new TimeCondition(DailyWindow.between(start, end));
    }

    public static TimeCondition weekly(DayOfWeek first, DayOfWeek last) {
        return new TimeCondition(WeeklyWindow.between(first, last));
    }

    public static TimeCondition on(DayOfWeek day) {
        return new TimeCondition(WeeklyWindow.on(day));
    }

    public static TimeCondition between(LocalDateTime start, LocalDateTime end) {
        return new TimeCondition(StaticInterval.between(start, end));
    }

    public static TimeCondition after(LocalDateTime start) {
        return new TimeCondition(StaticInterval.after(start));
    }

    public static TimeCondition before(LocalDateTime end) {
        return new TimeCondition(StaticInterval.before(end));
    }

    public TimeWindow getWindow() {
        return window;
    }

    @Override
    public boolean evaluate(ConditionContext context) {
        return window.contains(context.now(TimeCondition.class));
    }

    @Override
    public TimeWindow cycle() {
        return window;
    }

    /**
     * Time until the next occurrence of the window starts; zero while inside it.
     */
    @Override
    public Duration estimateTimeToNextPossibleChange(LocalDateTime now) {
        return window.rollForward(now)
                .map(next -> next.distanceFrom(now))
                .orElse(INDEFINITE);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.TIME;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeCondition that)) return false;
        return window.equals(that.window);
    }

    @Override
    public int hashCode() {
        return window.hashCode();
    }

    @Override
    public String toString() {
        return "<is " + window + ">";
    }
}
