package com.github.rudygunawan.tokencache.time;

/**
 * A monotonic time source in nanoseconds.
 *
 * <p>Every age computation in the token cache (entry TTL, scheduler throttling, sweep ordering)
 * goes through a {@code Ticker} so tests can drive time by hand instead of sleeping:
 *
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 *
 * TokenCountCache cache = TokenCountCacheBuilder.newBuilder()
 *     .countFunction(fn)
 *     .ticker(ticker)
 *     .build();
 *
 * ticker.advance(6, TimeUnit.MINUTES);
 * cache.sweep();  // file entries older than the file TTL are gone
 * }</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns nanoseconds elapsed since an arbitrary fixed origin. Same contract as
     * {@link System#nanoTime()}: monotonic and unrelated to wall-clock time.
     *
     * @return the current reading in nanoseconds
     */
    long read();

    /**
     * Returns the ticker backed by {@link System#nanoTime()}, used when none is configured.
     *
     * @return the system ticker
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    /**
     * {@link System#nanoTime()} backed ticker.
     */
    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}
