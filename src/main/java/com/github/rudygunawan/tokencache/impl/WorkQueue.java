package com.github.rudygunawan.tokencache.impl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ordered, de-duplicated backlog of keys waiting for the processor.
 *
 * <p>Background discovery appends with {@link #offer(String)} and is dropped silently once the
 * queue holds {@code maxQueueSize} keys. User-triggered requests go to the front with
 * {@link #offerFirst(String)} and are never dropped for size. A key that is currently being
 * processed is refused by both.
 *
 * <p>Guarded by the same lock as the {@link CacheStore} it is created for.
 */
public class WorkQueue {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.tokencache.Queue");

    private final ArrayDeque<String> order = new ArrayDeque<>();
    private final Set<String> members = new HashSet<>();
    private final CacheStore store;
    private final ReentrantLock lock;
    private final AtomicLong droppedCount = new AtomicLong();
    private volatile int maxQueueSize;

    public WorkQueue(CacheStore store, int maxQueueSize) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.lock = store.lock();
        setMaxQueueSize(maxQueueSize);
    }

    void setMaxQueueSize(int maxQueueSize) {
        if (maxQueueSize <= 0) {
            throw new IllegalArgumentException("max queue size must be positive");
        }
        this.maxQueueSize = maxQueueSize;
    }

    /**
     * Appends {@code key} for background processing.
     *
     * @return {@code true} if the key was added; {@code false} if it was already queued, is being
     *         processed, or the queue is full
     */
    public boolean offer(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            if (members.contains(key) || store.isProcessing(key)) {
                return false;
            }
            if (order.size() >= maxQueueSize) {
                droppedCount.incrementAndGet();
                if (LOGGER.isLoggable(Level.FINER)) {
                    LOGGER.finer("Queue full (" + order.size() + "), dropping background key " + key);
                }
                return false;
            }
            order.addLast(key);
            members.add(key);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts {@code key} at the front of the queue, moving it there if it was already queued.
     *
     * @return {@code true} if the key is now at the front; {@code false} if it is being processed
     */
    public boolean offerFirst(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            if (store.isProcessing(key)) {
                return false;
            }
            if (members.contains(key)) {
                order.remove(key);
            } else {
                members.add(key);
            }
            order.addFirst(key);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts {@code key} at the front like {@link #offerFirst(String)}, and tells whether it is new.
     *
     * @return {@code true} only if the key was neither queued nor being processed before
     */
    public boolean prioritize(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            if (store.isProcessing(key)) {
                return false;
            }
            boolean added = members.add(key);
            if (!added) {
                order.remove(key);
            }
            order.addFirst(key);
            return added;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns up to {@code max} keys from the front.
     */
    public List<String> poll(int max) {
        if (max <= 0) {
            return Collections.emptyList();
        }
        lock.lock();
        try {
            List<String> batch = new ArrayList<>(Math.min(max, order.size()));
            while (batch.size() < max && !order.isEmpty()) {
                String key = order.pollFirst();
                members.remove(key);
                batch.add(key);
            }
            return batch;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a queued key that has not started yet.
     *
     * @return {@code true} if the key was queued
     */
    public boolean remove(String key) {
        lock.lock();
        try {
            if (members.remove(key)) {
                order.remove(key);
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            order.clear();
            members.clear();
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String key) {
        lock.lock();
        try {
            return members.contains(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return order.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the queued keys, front first.
     */
    public List<String> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(order);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns how many background offers were dropped because the queue was full.
     */
    public long droppedCount() {
        return droppedCount.get();
    }
}
