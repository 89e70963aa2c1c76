package com.pipe.time;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Window that contains no instant.
 */
public final class EmptyWindow implements TimeWindow {

    static final EmptyWindow INSTANCE = new EmptyWindow();

    private EmptyWindow() {}

    @Override
    public boolean contains(LocalDateTime instant) {
        return false;
    }

    @Override
    public TimeWindow complement() {
        return TimeWindow.unbounded();
    }

    @Override
    public Optional<TimeInterval> rollForward(LocalDateTime instant) {
        return Optional.empty();
    }

    @Override
    public boolean isEmpty() {
        return true;
    }

    @Override
    public String toString() {
        return "never";
    }
}
