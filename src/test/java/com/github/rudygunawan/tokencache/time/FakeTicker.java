package com.github.rudygunawan.tokencache.time;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hand-driven {@link Ticker} for TTL and throttle tests. Starts at an arbitrary non-zero origin so
 * that "never drained" sentinels are not confused with time zero.
 */
public class FakeTicker implements Ticker {

    private final AtomicLong nanos = new AtomicLong(TimeUnit.HOURS.toNanos(1));

    public FakeTicker advance(long duration, TimeUnit unit) {
        return advance(unit.toNanos(duration));
    }

    public FakeTicker advance(Duration duration) {
        return advance(duration.toNanos());
    }

    /**
     * Moves time forward. Negative amounts are ignored, time never goes backwards.
     */
    public FakeTicker advance(long nanoseconds) {
        if (nanoseconds > 0) {
            nanos.addAndGet(nanoseconds);
        }
        return this;
    }

    @Override
    public long read() {
        return nanos.get();
    }

    @Override
    public String toString() {
        return "FakeTicker(" + nanos.get() + " ns)";
    }
}
