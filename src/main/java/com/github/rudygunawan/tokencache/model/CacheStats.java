package com.github.rudygunawan.tokencache.model;

import java.util.Objects;

/**
 * Point-in-time snapshot of a token cache. Instances are immutable.
 *
 * <ul>
 *   <li>{@code cachedFiles} / {@code cachedDirectories}: stored entries by kind, fresh or stale
 *   <li>{@code processingCount}: keys currently inside the processor
 *   <li>{@code queuedCount}: keys waiting in the work queue
 *   <li>{@code pendingDebounces}: debounce timers that have not fired yet
 *   <li>{@code schedulerActive}: whether the periodic scheduler timer is running
 * </ul>
 */
public class CacheStats {
    private final long cachedFiles;
    private final long cachedDirectories;
    private final int processingCount;
    private final int queuedCount;
    private final int pendingDebounces;
    private final boolean schedulerActive;

    public CacheStats(
            long cachedFiles,
            long cachedDirectories,
            int processingCount,
            int queuedCount,
            int pendingDebounces,
            boolean schedulerActive) {
        this.cachedFiles = cachedFiles;
        this.cachedDirectories = cachedDirectories;
        this.processingCount = processingCount;
        this.queuedCount = queuedCount;
        this.pendingDebounces = pendingDebounces;
        this.schedulerActive = schedulerActive;
    }

    /**
     * Returns the total number of stored entries. This is defined as
     * {@code cachedFiles + cachedDirectories}.
     */
    public long cachedCount() {
        return cachedFiles + cachedDirectories;
    }

    public long cachedFiles() {
        return cachedFiles;
    }

    public long cachedDirectories() {
        return cachedDirectories;
    }

    public int processingCount() {
        return processingCount;
    }

    public int queuedCount() {
        return queuedCount;
    }

    public int pendingDebounces() {
        return pendingDebounces;
    }

    public boolean schedulerActive() {
        return schedulerActive;
    }

    /**
     * Returns {@code true} when nothing is queued, processing or waiting on a debounce timer.
     */
    public boolean isIdle() {
        return processingCount == 0 && queuedCount == 0 && pendingDebounces == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cachedFiles, cachedDirectories, processingCount, queuedCount,
                pendingDebounces, schedulerActive);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheStats)) {
            return false;
        }
        CacheStats other = (CacheStats) obj;
        return cachedFiles == other.cachedFiles
                && cachedDirectories == other.cachedDirectories
                && processingCount == other.processingCount
                && queuedCount == other.queuedCount
                && pendingDebounces == other.pendingDebounces
                && schedulerActive == other.schedulerActive;
    }

    @Override
    public String toString() {
        return "CacheStats{"
                + "cachedFiles=" + cachedFiles
                + ", cachedDirectories=" + cachedDirectories
                + ", processingCount=" + processingCount
                + ", queuedCount=" + queuedCount
                + ", pendingDebounces=" + pendingDebounces
                + ", schedulerActive=" + schedulerActive
                + '}';
    }
}
