package com.tickq;

/**
 * Worker lane of a registered function. {@code HIGH}, {@code NORMAL} and {@code LOW} share the
 * bounded pool; {@code LONG_RUNNING} bypasses it.
 */
public enum JobPriority {
    HIGH,
    NORMAL,
    LOW,
    LONG_RUNNING;

    public boolean isBounded() {
        return this != LONG_RUNNING;
    }
}
