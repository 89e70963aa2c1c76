package com.pipe.time;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Intersection of windows: contains an instant if every member does.
 */
public final class AllWindow implements TimeWindow {

    // Members that never overlap would otherwise be searched forever.
    private static final int MAX_ITERATIONS = 1000;

    private final List<TimeWindow> windows;

    private AllWindow(List<TimeWindow> windows) {
        this.windows = List.copyOf(windows);
    }

    static TimeWindow of(List<? extends TimeWindow> members) {
        List<TimeWindow> flat = new ArrayList<>();
        for (TimeWindow window : members) {
            if (window.isEmpty()) {
                return TimeWindow.empty();
            }
            if (window.isUnbounded()) {
                continue;
            }
            if (window instanceof AllWindow all) {
                flat.addAll(all.windows);
            } else {
                flat.add(window);
            }
        }
        if (flat.isEmpty()) {
            return TimeWindow.unbounded();
        }
        return flat.size() == 1 ? flat.get(0) : new AllWindow(flat);
    }

    public List<TimeWindow> getWindows() {
        return windows;
    }

    @Override
    public boolean contains(LocalDateTime instant) {
        return windows.stream().allMatch(w -> w.contains(instant));
    }

    @Override
    public TimeWindow complement() {
        List<TimeWindow> complements = new ArrayList<>(windows.size());
        for (TimeWindow window : windows) {
            complements.add(window.complement());
        }
        return TimeWindow.any(complements);
    }

    @Override
    public Optional<TimeInterval> rollForward(LocalDateTime instant) {
        LocalDateTime candidate = instant;
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            LocalDateTime latestStart = candidate;
            LocalDateTime earliestEnd = LocalDateTime.MAX;
            for (TimeWindow window : windows) {
                Optional<TimeInterval> next = window.rollForward(candidate);
                if (next.isEmpty()) {
                    return Optional.empty();
                }
                if (next.get().start().isAfter(latestStart)) {
                    latestStart = next.get().start();
                }
                if (next.get().end().isBefore(earliestEnd)) {
                    earliestEnd = next.get().end();
                }
            }
            if (latestStart.equals(candidate)) {
                return Optional.of(new TimeInterval(candidate, earliestEnd));
            }
            candidate = latestStart;
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AllWindow that)) return false;
        return windows.equals(that.windows);
    }

    @Override
    public int hashCode() {
        return windows.hashCode();
    }

    @Override
    public String toString() {
        return windows.stream().map(String::valueOf).collect(Collectors.joining(" & ", "(", ")"));
    }
}
