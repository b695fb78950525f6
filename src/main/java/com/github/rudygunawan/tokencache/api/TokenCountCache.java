package com.github.rudygunawan.tokencache.api;

import com.github.rudygunawan.tokencache.config.CacheConfig;
import com.github.rudygunawan.tokencache.listener.UpdateListener;
import com.github.rudygunawan.tokencache.model.CacheStats;
import com.github.rudygunawan.tokencache.model.CountEntry;
import com.github.rudygunawan.tokencache.model.EntryKind;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A background-maintained cache of token counts for files and directories.
 *
 * <p>Lookups never block: a fresh entry is returned as is, anything else returns a placeholder
 * and schedules the work. Listeners registered with {@link #subscribe(UpdateListener)} hear about
 * new values in batches.
 *
 * <p>Implementations are thread-safe. Instances are inert until {@link #start()} and release
 * their timers on {@link #close()}.
 */
public interface TokenCountCache extends AutoCloseable {

    /**
     * Returns the cached entry for {@code key} without blocking.
     *
     * <p>A fresh entry is returned unchanged. A stale or missing entry yields a
     * {@link com.github.rudygunawan.tokencache.model.EntryStatus#PROCESSING PROCESSING} placeholder
     * carrying the configured placeholder text, and the key is scheduled: files through the
     * debounced fast path, directories through an aggregation. Keys that can never be counted
     * (wrong extension, ignored, caching disabled for the kind) return {@code null}.
     *
     * @param key absolute path
     * @param kind whether the key names a file or a directory
     * @return the entry, a placeholder, or {@code null}
     * @throws NullPointerException if {@code key} or {@code kind} is null
     * @throws IllegalStateException if the cache is closed
     */
    CountEntry lookup(String key, EntryKind kind);

    /**
     * Same as {@link #lookup(String, EntryKind)} with the kind read from the filesystem.
     */
    CountEntry lookup(String key);

    /**
     * Returns the stored entry for {@code key}, fresh or stale, or {@code null}. Never schedules
     * work and never touches the filesystem.
     */
    CountEntry getIfPresent(String key);

    /**
     * Asks for {@code key} to be processed soon. Bursts of calls for the same key within the
     * debounce window collapse into one run. Blank or ineligible keys are ignored.
     */
    void requestImmediate(String key);

    /**
     * Processes {@code key} right away, bypassing the queue and the debounce window.
     *
     * @return the written entry, or empty if the key was skipped (blank, ineligible or already
     *         being processed)
     */
    CompletableFuture<Optional<CountEntry>> processNow(String key);

    /**
     * Sums the counts of the files in {@code directory} and caches the total.
     */
    CompletableFuture<Long> computeDirectory(String directory, boolean recursive);

    /**
     * Queues the stale eligible files of {@code directory} for background processing.
     *
     * @return the number of files queued
     */
    CompletableFuture<Integer> queueDirectory(String directory, boolean recursive);

    /**
     * Discards the entry for {@code key} and any queued or debounced request for it.
     *
     * @param reprocess whether to put the key back at the front of the queue if it is eligible
     */
    void invalidate(String key, boolean reprocess);

    /**
     * Discards every entry, queued key and pending debounce. Runs already in flight finish but
     * their results are dropped.
     */
    void clearAll();

    /**
     * Removes expired entries and enforces the entry ceiling.
     *
     * @return the number of entries removed
     */
    int sweep();

    CacheStats stats();

    CacheConfig getConfig();

    /**
     * Replaces the configuration as a whole. The scheduler timer is restarted when the tick
     * interval changed.
     *
     * @throws IllegalArgumentException if {@code config} is null
     */
    void updateConfig(CacheConfig config);

    void subscribe(UpdateListener listener);

    boolean unsubscribe(UpdateListener listener);

    /**
     * Starts the periodic scheduler. Idempotent.
     */
    void start();

    /**
     * Stops the scheduler, cancels pending timers and shuts down executors owned by the cache.
     * Idempotent.
     */
    @Override
    void close();
}
