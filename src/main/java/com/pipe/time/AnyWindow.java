package com.pipe.time;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Union of windows: contains an instant if any member does.
 */
public final class AnyWindow implements TimeWindow {

    private static final int MAX_MERGES = 64;

    private final List<TimeWindow> windows;

    private AnyWindow(List<TimeWindow> windows) {
        this.windows = List.copyOf(windows);
    }

    static TimeWindow of(List<? extends TimeWindow> members) {
        List<TimeWindow> flat = new ArrayList<>();
        for (TimeWindow window : members) {
            if (window.isUnbounded()) {
                return TimeWindow.unbounded();
            }
            if (window.isEmpty()) {
                continue;
            }
            if (window instanceof AnyWindow any) {
                flat.addAll(any.windows);
            } else {
                flat.add(window);
            }
        }
        if (flat.isEmpty()) {
            return TimeWindow.empty();
        }
        return flat.size() == 1 ? flat.get(0) : new AnyWindow(flat);
    }

    public List<TimeWindow> getWindows() {
        return windows;
    }

    @Override
    public boolean contains(LocalDateTime instant) {
        return windows.stream().anyMatch(w -> w.contains(instant));
    }

    @Override
    public TimeWindow complement() {
        List<TimeWindow> complements = new ArrayList<>(windows.size());
        for (TimeWindow window : windows) {
            complements.add(window.complement());
        }
        return TimeWindow.all(complements);
    }

    @Override
    public Optional<TimeInterval> rollForward(LocalDateTime instant) {
        TimeInterval earliest = null;
        for (TimeWindow window : windows) {
            Optional<TimeInterval> next = window.rollForward(instant);
            if (next.isPresent() && (earliest == null || next.get().start().isBefore(earliest.start()))) {
                earliest = next.get();
            }
        }
        if (earliest == null) {
            return Optional.empty();
        }

        // Extend over members that continue where the current occurrence ends.
        LocalDateTime end = earliest.end();
        for (int i = 0; i < MAX_MERGES && !end.equals(LocalDateTime.MAX); i++) {
            LocalDateTime extended = end;
            for (TimeWindow window : windows) {
                if (window.contains(end)) {
                    Optional<TimeInterval> next = window.rollForward(end);
                    if (next.isPresent() && next.get().end().isAfter(extended)) {
                        extended = next.get().end();
                    }
                }
            }
            if (extended.equals(end)) {
                break;
            }
            end = extended;
        }
        return Optional.of(new TimeInterval(earliest.start(), end));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnyWindow that)) return false;
        return windows.equals(that.windows);
    }

    @Override
    public int hashCode() {
        return windows.hashCode();
    }

    @Override
    public String toString() {
        return windows.stream().map(String::valueOf).collect(Collectors.joining(" | ", "(", ")"));
    }
}
