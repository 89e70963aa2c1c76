package com.pipe.tick;

/**
 * Outcome of evaluating one task's condition in a tick.
 */
public enum VerdictStatus {
    FIRE,
    WAIT,
    ERROR
}
