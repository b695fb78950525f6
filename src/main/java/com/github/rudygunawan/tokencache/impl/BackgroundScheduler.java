package com.github.rudygunawan.tokencache.impl;

import com.github.rudygunawan.tokencache.config.CacheConfig;
import com.github.rudygunawan.tokencache.policy.AdaptiveInterval;
import com.github.rudygunawan.tokencache.policy.ResourceGovernor;
import com.github.rudygunawan.tokencache.time.Ticker;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains the {@link WorkQueue} into the {@link FileProcessor} in small batches.
 *
 * <p>While started, a timer tick fires on the scheduler thread, sweeps expired entries, drains
 * one batch and reschedules itself with a delay from {@link AdaptiveInterval}. A drain can also be
 * requested out of band with {@link #requestDrain()}; it runs on the same thread, so ticks never
 * overlap.
 *
 * <p>A tick does nothing when the host reports itself busy, when the queue is empty, or when the
 * previous drain happened less than one tick interval ago.
 */
public class BackgroundScheduler {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.tokencache.Scheduler");

    private final ScheduledExecutorService timer;
    private final WorkQueue queue;
    private final CacheStore store;
    private final FileProcessor processor;
    private final Supplier<ResourceGovernor> governor;
    private final Ticker ticker;

    private final AtomicBoolean ticking = new AtomicBoolean();
    private final Object stateLock = new Object();
    private ScheduledFuture<?> nextTick;
    private boolean active;

    private volatile boolean hasDrained;
    private volatile long lastDrainNanos;
    private volatile int consecutiveEmptyTicks;

    private final AtomicLong tickCount = new AtomicLong();
    private final AtomicLong busySkips = new AtomicLong();
    private final AtomicLong throttledTicks = new AtomicLong();
    private final AtomicLong dispatchedKeys = new AtomicLong();
    private final AtomicLong processFailures = new AtomicLong();

    public BackgroundScheduler(ScheduledExecutorService timer,
                               WorkQueue queue,
                               CacheStore store,
                               FileProcessor processor,
                               Supplier<ResourceGovernor> governor,
                               Ticker ticker) {
        this.timer = Objects.requireNonNull(timer, "timer cannot be null");
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.processor = Objects.requireNonNull(processor, "processor cannot be null");
        this.governor = Objects.requireNonNull(governor, "governor cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
    }

    /**
     * Starts the periodic tick. Does nothing if already started.
     */
    public void start() {
        synchronized (stateLock) {
            if (active) {
                return;
            }
            active = true;
            scheduleNext(governor.get().getConfig().getTickInterval().toNanos());
        }
        LOGGER.info("Token cache scheduler started");
    }

    /**
     * Cancels the periodic tick. Runs already dispatched to the processor finish on their own.
     */
    public void stop() {
        synchronized (stateLock) {
            if (!active) {
                return;
            }
            active = false;
            if (nextTick != null) {
                nextTick.cancel(false);
                nextTick = null;
            }
        }
        LOGGER.info("Token cache scheduler stopped");
    }

    /**
     * Stops and starts again so the next tick uses the current tick interval.
     */
    public void restart() {
        synchronized (stateLock) {
            if (!active) {
                return;
            }
            if (nextTick != null) {
                nextTick.cancel(false);
            }
            scheduleNext(governor.get().getConfig().getTickInterval().toNanos());
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Token cache scheduler restarted");
        }
    }

    public boolean isActive() {
        synchronized (stateLock) {
            return active;
        }
    }

    /**
     * Runs a tick on the scheduler thread as soon as possible. The throttle still applies.
     */
    public void requestDrain() {
        try {
            timer.execute(this::tick);
        } catch (RejectedExecutionException e) {
            LOGGER.fine("Scheduler is shut down, drain request ignored");
        }
    }

    /**
     * Drains at most one batch from the queue.
     *
     * @return the number of keys handed to the processor
     */
    public int tick() {
        if (!ticking.compareAndSet(false, true)) {
            return 0;
        }
        try {
            tickCount.incrementAndGet();
            ResourceGovernor currentGovernor = governor.get();
            CacheConfig config = currentGovernor.getConfig();
            if (currentGovernor.isHostBusy()) {
                busySkips.incrementAndGet();
                if (LOGGER.isLoggable(Level.FINER)) {
                    LOGGER.finer("Host busy, skipping tick");
                }
                return 0;
            }

            int queued = queue.size();
            if (queued == 0) {
                consecutiveEmptyTicks++;
                return 0;
            }
            consecutiveEmptyTicks = 0;

            long now = ticker.read();
            if (hasDrained && now - lastDrainNanos < config.getTickInterval().toNanos()) {
                throttledTicks.incrementAndGet();
                return 0;
            }

            int limit = Math.min(Math.min(config.getMaxBatchPerTick(), queued),
                    currentGovernor.spareCapacity(store.processingCount()));
            if (limit <= 0) {
                return 0;
            }
            List<String> batch = queue.poll(limit);
            lastDrainNanos = now;
            hasDrained = true;
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Draining " + batch.size() + " of " + queued + " queued keys");
            }
            for (String key : batch) {
                dispatch(key);
            }
            dispatchedKeys.addAndGet(batch.size());
            return batch.size();
        } finally {
            ticking.set(false);
        }
    }

    private void dispatch(String key) {
        CompletableFuture<?> run;
        try {
            run = processor.process(key);
        } catch (RuntimeException e) {
            processFailures.incrementAndGet();
            LOGGER.log(Level.WARNING, "Processor failed to start for " + key, e);
            return;
        }
        run.whenComplete((result, error) -> {
            if (error != null) {
                processFailures.incrementAndGet();
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Background processing of " + key + " failed: " + error);
                }
            }
        });
    }

    private void timerTick() {
        try {
            store.sweep(ticker.read());
            tick();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Scheduler tick failed", e);
        } finally {
            ResourceGovernor currentGovernor = governor.get();
            long delay = AdaptiveInterval.nextDelayNanos(currentGovernor.getConfig(), queue.size(),
                    currentGovernor.isHostBusy(), consecutiveEmptyTicks);
            synchronized (stateLock) {
                if (active) {
                    scheduleNext(delay);
                }
            }
        }
    }

    // Caller holds stateLock
    private void scheduleNext(long delayNanos) {
        try {
            nextTick = timer.schedule(this::timerTick, delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            active = false;
            nextTick = null;
            LOGGER.fine("Scheduler executor is shut down, periodic ticks stopped");
        }
    }

    public int consecutiveEmptyTicks() {
        return consecutiveEmptyTicks;
    }

    public long tickCount() {
        return tickCount.get();
    }

    public long busySkips() {
        return busySkips.get();
    }

    public long throttledTicks() {
        return throttledTicks.get();
    }

    public long dispatchedKeys() {
        return dispatchedKeys.get();
    }

    public long processFailures() {
        return processFailures.get();
    }
}
