package com.github.rudygunawan.tokencache.policy;

import com.github.rudygunawan.tokencache.config.CacheConfig;

/**
 * Computes the delay before the next scheduler tick.
 *
 * <p>Starting from the configured tick interval:
 * <ul>
 *   <li>a queue longer than the threshold doubles the delay, capped at the maximum interval</li>
 *   <li>a busy host stretches it by half again</li>
 *   <li>more than the configured number of consecutive empty ticks shrinks it to 80%, but never
 *       below the minimum interval</li>
 * </ul>
 * With adaptive scheduling disabled the tick interval is returned unchanged.
 */
public final class AdaptiveInterval {

    private AdaptiveInterval() {
    }

    /**
     * @param config the active configuration
     * @param queueSize current queue length
     * @param hostBusy whether the host reported itself busy
     * @param consecutiveEmptyTicks ticks in a row that found an empty queue
     * @return the next delay in nanoseconds
     */
    public static long nextDelayNanos(CacheConfig config, int queueSize, boolean hostBusy, int consecutiveEmptyTicks) {
        long base = config.getTickInterval().toNanos();
        if (!config.isAdaptiveScheduling()) {
            return base;
        }
        long ceiling = Math.max(base, config.getMaxTickInterval().toNanos());
        long floor = Math.min(base, config.getMinTickInterval().toNanos());

        double delay = base;
        if (queueSize > config.getQueueSizeThreshold()) {
            delay = Math.min(delay * 2, ceiling);
        }
        if (hostBusy) {
            delay = delay * 1.5;
        }
        if (consecutiveEmptyTicks > config.getIdleTicksBeforeSpeedup()) {
            delay = Math.max(delay * 0.8, floor);
        }
        return (long) delay;
    }
}
