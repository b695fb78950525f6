package com.github.rudygunawan.tokencache.impl;

import com.github.rudygunawan.tokencache.policy.ResourceGovernor;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Coalesces bursts of immediate-processing requests for the same key.
 *
 * <p>Each request (re)arms a per-key timer. Only when a key has been quiet for a whole window is it
 * moved to the front of the {@link WorkQueue} and a drain requested. The window is doubled while
 * the host reports itself busy.
 */
public class DebounceController {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.tokencache.Debounce");

    private final ScheduledExecutorService timer;
    private final WorkQueue queue;
    private final BackgroundScheduler scheduler;
    private final Supplier<ResourceGovernor> governor;
    private final ConcurrentHashMap<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();
    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicLong firedCount = new AtomicLong();

    public DebounceController(ScheduledExecutorService timer,
                              WorkQueue queue,
                              BackgroundScheduler scheduler,
                              Supplier<ResourceGovernor> governor) {
        this.timer = Objects.requireNonNull(timer, "timer cannot be null");
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.governor = Objects.requireNonNull(governor, "governor cannot be null");
    }

    /**
     * Arms or re-arms the timer for {@code key}.
     */
    public void request(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        requestCount.incrementAndGet();
        ResourceGovernor currentGovernor = governor.get();
        long windowNanos = currentGovernor.getConfig().getDebounceWindow().toNanos();
        if (currentGovernor.isHostBusy()) {
            windowNanos *= 2;
        }
        long delay = windowNanos;
        pending.compute(key, (k, previous) -> {
            if (previous != null) {
                previous.cancel(false);
            }
            try {
                return timer.schedule(() -> fire(k), delay, TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                LOGGER.fine("Scheduler is shut down, ignoring request for " + k);
                return null;
            }
        });
    }

    private void fire(String key) {
        // A newer timer may have replaced this one between expiry and removal
        ScheduledFuture<?> current = pending.get(key);
        if (current != null && current.getDelay(TimeUnit.NANOSECONDS) > 0) {
            return;
        }
        pending.remove(key, current);
        firedCount.incrementAndGet();
        if (queue.offerFirst(key)) {
            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer("Debounce expired for " + key + ", queued at front");
            }
            scheduler.requestDrain();
        } else if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Debounce expired for " + key + " while it is being processed");
        }
    }

    /**
     * Returns the number of keys with an armed timer.
     */
    public int pendingCount() {
        return pending.size();
    }

    /**
     * Disarms every timer. Keys already moved to the queue stay there.
     */
    public void cancelAll() {
        pending.forEach((key, future) -> {
            future.cancel(false);
            pending.remove(key, future);
        });
    }

    public boolean cancel(String key) {
        ScheduledFuture<?> future = pending.remove(key);
        if (future != null) {
            future.cancel(false);
            return true;
        }
        return false;
    }

    public long requestCount() {
        return requestCount.get();
    }

    /**
     * Returns how many timers expired and handed their key to the queue.
     */
    public long firedCount() {
        return firedCount.get();
    }
}
