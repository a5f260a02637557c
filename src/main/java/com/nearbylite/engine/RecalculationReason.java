package com.nearbylite.engine;

public enum RecalculationReason {
    FIRST_SAMPLE,
    ROSTER_CHANGED,
    TIME_ELAPSED,
    MOVED,
    /** Cached result is still fresh enough. */
    NONE;

    public boolean recompute() {
        return this != NONE;
    }
}
