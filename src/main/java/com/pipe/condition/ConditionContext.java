package com.pipe.condition;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies the current time to conditions during evaluation.
 * <p>
 * Immutable. A context wraps a default clock and may pin a different clock
 * for a given condition class (and its subclasses), which lets tests freeze
 * time for one kind of condition without touching the clock used elsewhere.
 */
public final class ConditionContext {

    private static final ConditionContext SYSTEM = new ConditionContext(Clock.systemDefaultZone(), Map.of());

    private final Clock clock;
    private final Map<Class<?>, Clock> overrides;

    private ConditionContext(Clock clock, Map<Class<?>, Clock> overrides) {
        this.clock = clock;
        this.overrides = overrides;
    }

    /**
     * Context reading the system clock in the default time zone.
     */
    public static ConditionContext systemDefault() {
        return SYSTEM;
    }

    public static ConditionContext of(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        return new ConditionContext(clock, Map.of());
    }

    /**
     * Context frozen at the given local date-time.
     */
    public static ConditionContext fixed(LocalDateTime now) {
        return of(fixedClock(now));
    }

    /**
     * Create a copy of this context that uses {@code clock} for conditions of
     * the given type.
     */
    public ConditionContext withClockFor(Class<? extends Condition> type, Clock clock) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(clock, "clock");
        Map<Class<?>, Clock> copy = new HashMap<>(overrides);
        copy.put(type, clock);
        return new ConditionContext(this.clock, Map.copyOf(copy));
    }

    /**
     * Create a copy of this context in which conditions of the given type
     * see a frozen current time.
     */
    public ConditionContext withNowFor(Class<? extends Condition> type, LocalDateTime now) {
        return withClockFor(type, fixedClock(now));
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Get the clock for a condition type, falling back to the default clock.
     * Pins on the type, its superclasses and their interfaces are searched nearest first.
     */
    public Clock clockFor(Class<?> type) {
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            Clock pinned = overrides.get(c);
            if (pinned == null) {
                pinned = pinnedForInterfaces(c);
            }
            if (pinned != null) {
                return pinned;
            }
        }
        return clock;
    }

    private Clock pinnedForInterfaces(Class<?> type) {
        for (Class<?> iface : type.getInterfaces()) {
            Clock pinned = overrides.get(iface);
            if (pinned == null) {
                pinned = pinnedForInterfaces(iface);
            }
            if (pinned != null) {
                return pinned;
            }
        }
        return null;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * Current local date-time as seen by conditions of the given type.
     */
    public LocalDateTime now(Class<?> type) {
        return LocalDateTime.now(clockFor(type));
    }

    private static Clock fixedClock(LocalDateTime now) {
        Objects.requireNonNull(now, "now");
        return Clock.fixed(now.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    }

    @Override
    public String toString() {
        return "ConditionContext{clock=" + clock + ", overrides=" + overrides.keySet() + "}";
    }
}
