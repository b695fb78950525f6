package com.github.rudygunawan.tokencache.impl;

import com.github.rudygunawan.tokencache.listener.UpdateEvent;
import com.github.rudygunawan.tokencache.listener.UpdateListener;
import com.github.rudygunawan.tokencache.model.EntryKind;
import com.github.rudygunawan.tokencache.time.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Collects "entry updated" events and delivers them to listeners at most once per window.
 *
 * <p>The first event after a flush schedules the next flush one window later; further events in
 * that window only join the batch. A steady stream of updates therefore produces one delivery per
 * window instead of one per file, and is never postponed indefinitely.
 *
 * <p>Deliveries run on the scheduler thread. Each listener is isolated: an exception is logged and
 * the remaining listeners are still called.
 */
public class NotificationBatcher {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.tokencache.Notifications");

    private final ScheduledExecutorService timer;
    private final Ticker ticker;
    private final List<UpdateListener> listeners = new CopyOnWriteArrayList<>();
    private final Object pendingLock = new Object();
    private final AtomicLong flushCount = new AtomicLong();
    private final AtomicLong listenerFailures = new AtomicLong();
    private List<UpdateEvent> pending = new ArrayList<>();
    private ScheduledFuture<?> flushTask;
    private volatile long windowNanos;

    public NotificationBatcher(ScheduledExecutorService timer, Ticker ticker, Duration window) {
        this.timer = Objects.requireNonNull(timer, "timer cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        setWindow(window);
    }

    void setWindow(Duration window) {
        this.windowNanos = Objects.requireNonNull(window, "window cannot be null").toNanos();
    }

    public void subscribe(UpdateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    /**
     * @return {@code true} if the listener was registered
     */
    public boolean unsubscribe(UpdateListener listener) {
        return listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Records that the entry for {@code key} changed. Returns immediately; listeners are called
     * later from the timer.
     */
    public void notifyUpdated(String key, EntryKind kind) {
        UpdateEvent event = new UpdateEvent(key, kind, ticker.read());
        synchronized (pendingLock) {
            pending.add(event);
            if (flushTask == null) {
                try {
                    flushTask = timer.schedule(this::flush, windowNanos, TimeUnit.NANOSECONDS);
                } catch (RejectedExecutionException e) {
                    LOGGER.fine("Scheduler is shut down, dropping update for " + key);
                    pending.clear();
                }
            }
        }
    }

    /**
     * Delivers whatever is pending right away, without waiting for the window to close.
     */
    public void flushNow() {
        synchronized (pendingLock) {
            if (flushTask != null) {
                flushTask.cancel(false);
            }
        }
        flush();
    }

    /**
     * Drops pending events and cancels the scheduled flush.
     */
    void cancel() {
        synchronized (pendingLock) {
            if (flushTask != null) {
                flushTask.cancel(false);
                flushTask = null;
            }
            pending = new ArrayList<>();
        }
    }

    public int pendingCount() {
        synchronized (pendingLock) {
            return pending.size();
        }
    }

    public long flushCount() {
        return flushCount.get();
    }

    public long listenerFailures() {
        return listenerFailures.get();
    }

    private void flush() {
        List<UpdateEvent> batch;
        synchronized (pendingLock) {
            batch = pending;
            pending = new ArrayList<>();
            flushTask = null;
        }
        if (batch.isEmpty()) {
            return;
        }
        flushCount.incrementAndGet();
        List<UpdateEvent> events = Collections.unmodifiableList(batch);
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Flushing " + events.size() + " updates to " + listeners.size() + " listeners");
        }
        for (UpdateListener listener : listeners) {
            try {
                listener.onBatch(events);
            } catch (Throwable e) {
                if (e instanceof VirtualMachineError) {
                    throw (VirtualMachineError) e;
                }
                listenerFailures.incrementAndGet();
                LOGGER.log(Level.WARNING, "UpdateListener threw exception for batch starting at "
                        + events.get(0).getKey(), e);
            }
        }
    }
}
