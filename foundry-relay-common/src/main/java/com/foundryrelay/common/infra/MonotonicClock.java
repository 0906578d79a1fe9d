package com.foundryrelay.common.infra;

import java.util.function.LongSupplier;

/**
 * Millisecond clock for measuring ages and idle time. Unaffected by wall-clock
 * adjustments; values are only meaningful relative to each other.
 */
public final class MonotonicClock {

    private MonotonicClock() {
    }

    public static final LongSupplier SYSTEM = MonotonicClock::millis;

    public static long millis() {
        return System.nanoTime() / 1_000_000L;
    }
}
