package com.github.rudygunawan.tokencache.impl;

import com.github.rudygunawan.tokencache.config.CacheConfig;
import com.github.rudygunawan.tokencache.model.CountEntry;
import com.github.rudygunawan.tokencache.model.EntryKind;
import com.github.rudygunawan.tokencache.model.EntryStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The single source of truth for token counts: a map from absolute path to {@link CountEntry}
 * plus the set of keys currently being processed.
 *
 * <p>Reads never block: entries are immutable and live in a {@link ConcurrentHashMap}, so
 * {@link #getIfPresent(String)} takes no lock and does no I/O. Every mutation, of the entries as
 * well as of the processing set, happens under one {@link ReentrantLock} that is shared with the
 * {@link WorkQueue}, so the queue and the processing set never disagree about a key.
 *
 * <p>The store raises no notifications; that is the processor's job after a successful write.
 */
public class CacheStore {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.tokencache.Store");

    private final ConcurrentHashMap<String, CountEntry> entries = new ConcurrentHashMap<>();
    private final Set<String> processing = new HashSet<>();
    private final ReentrantLock lock;
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong expiredCount = new AtomicLong();
    private final AtomicLong evictionCount = new AtomicLong();
    private volatile CacheConfig config;

    public CacheStore(CacheConfig config) {
        this(config, new ReentrantLock());
    }

    CacheStore(CacheConfig config, ReentrantLock lock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.lock = Objects.requireNonNull(lock, "lock cannot be null");
    }

    ReentrantLock lock() {
        return lock;
    }

    void updateConfig(CacheConfig newConfig) {
        this.config = Objects.requireNonNull(newConfig, "config cannot be null");
    }

    /**
     * Returns the stored entry for {@code key}, fresh or stale, or {@code null}.
     */
    public CountEntry getIfPresent(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        return entries.get(key);
    }

    /**
     * Returns the stored entry for {@code key} if it is younger than the TTL of its kind.
     */
    public CountEntry getFresh(String key, long now) {
        CountEntry entry = getIfPresent(key);
        return entry != null && isFresh(entry, now) ? entry : null;
    }

    public boolean isFresh(CountEntry entry, long now) {
        return entry.ageNanos(now) < ttlNanos(entry.getKind());
    }

    /**
     * Stores {@code entry}, replacing any previous entry for {@code key}.
     *
     * @throws IllegalArgumentException if {@code entry} is a placeholder or belongs to another key
     */
    public void put(String key, CountEntry entry) {
        checkWritable(key, entry);
        lock.lock();
        try {
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores {@code entry} only if the store has not been cleared since {@code expectedGeneration}
     * was read. Processing runs that straddle {@link #invalidateAll()} are discarded this way.
     *
     * @return {@code true} if the entry was stored
     */
    public boolean putIfGeneration(String key, CountEntry entry, long expectedGeneration) {
        checkWritable(key, entry);
        lock.lock();
        try {
            if (generation.get() != expectedGeneration) {
                return false;
            }
            entries.put(key, entry);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the entry for {@code key}.
     *
     * @return the removed entry, or {@code null}
     */
    public CountEntry invalidate(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            return entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry and starts a new generation. Keys that are being processed stay in the
     * processing set until their run finishes, but their results are dropped.
     */
    public void invalidateAll() {
        lock.lock();
        try {
            entries.clear();
            generation.incrementAndGet();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes entries older than the TTL of their kind, then evicts the oldest entries (by
     * {@link CountEntry#getComputedAt()}, not by access) until at most {@code maxEntries} remain.
     *
     * @param now the current ticker reading
     * @return the number of entries removed
     */
    public int sweep(long now) {
        CacheConfig current = config;
        int removed = 0;
        lock.lock();
        try {
            Iterator<Map.Entry<String, CountEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                CountEntry entry = it.next().getValue();
                if (!isFresh(entry, now)) {
                    it.remove();
                    removed++;
                }
            }
            expiredCount.addAndGet(removed);

            long excess = entries.size() - current.getMaxEntries();
            if (excess > 0) {
                List<CountEntry> oldestFirst = new ArrayList<>(entries.values());
                oldestFirst.sort(Comparator.comparingLong(CountEntry::getComputedAt));
                for (int i = 0; i < excess; i++) {
                    entries.remove(oldestFirst.get(i).getKey());
                }
                evictionCount.addAndGet(excess);
                removed += (int) excess;
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Sweep removed " + removed + " entries, " + entries.size() + " remain");
        }
        return removed;
    }

    /**
     * Claims {@code key} for processing.
     *
     * @return {@code true} if the key was free and is now claimed, {@code false} if another run
     *         already holds it
     */
    public boolean beginProcessing(String key) {
        lock.lock();
        try {
            return processing.add(key);
        } finally {
            lock.unlock();
        }
    }

    public void endProcessing(String key) {
        lock.lock();
        try {
            processing.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public boolean isProcessing(String key) {
        lock.lock();
        try {
            return processing.contains(key);
        } finally {
            lock.unlock();
        }
    }

    public int processingCount() {
        lock.lock();
        try {
            return processing.size();
        } finally {
            lock.unlock();
        }
    }

    public long size() {
        return entries.size();
    }

    public long count(EntryKind kind) {
        return entries.values().stream().filter(e -> e.getKind() == kind).count();
    }

    /**
     * Returns the current generation; it changes on every {@link #invalidateAll()}.
     */
    public long generation() {
        return generation.get();
    }

    public long expiredCount() {
        return expiredCount.get();
    }

    public long evictionCount() {
        return evictionCount.get();
    }

    private long ttlNanos(EntryKind kind) {
        CacheConfig current = config;
        return kind == EntryKind.DIRECTORY ? current.getTtlDirectory().toNanos() : current.getTtlFile().toNanos();
    }

    private static void checkWritable(String key, CountEntry entry) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(entry, "entry cannot be null");
        if (entry.getStatus() == EntryStatus.PROCESSING) {
            throw new IllegalArgumentException("placeholder entries cannot be stored: " + key);
        }
        if (!key.equals(entry.getKey())) {
            throw new IllegalArgumentException("entry key " + entry.getKey() + " does not match " + key);
        }
    }
}
