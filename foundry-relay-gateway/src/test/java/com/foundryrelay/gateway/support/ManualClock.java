package com.foundryrelay.gateway.support;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Millisecond clock advanced by hand.
 */
public class ManualClock implements LongSupplier {

    private final AtomicLong now = new AtomicLong(1_000_000L);

    @Override
    public long getAsLong() {
        return now.get();
    }

    public void advance(long millis) {
        now.addAndGet(millis);
    }
}
