package com.github.rudygunawan.tokencache.metrics;

/**
 * Counters and gauges a token cache exposes for monitoring.
 * Used by {@link MicrometerCacheMetrics} to publish them.
 */
public interface CacheMetrics {

    /**
     * Returns the current number of entries, files and directories.
     */
    long size();

    /**
     * Returns the number of keys currently being processed.
     */
    int processingCount();

    /**
     * Returns the number of keys waiting in the queue.
     */
    int queueSize();

    /**
     * Returns how many file counts came from the count function.
     */
    long readyCount();

    /**
     * Returns how many file counts fell back to the local estimate.
     */
    long estimatedCount();

    /**
     * Returns how many files were estimated from a sample because they were too large.
     */
    long oversizedCount();

    long readFailureCount();

    /**
     * Returns how many background keys were dropped because the queue was full.
     */
    long queueDroppedCount();

    /**
     * Returns the number of entries removed by expiry and by the entry ceiling.
     */
    long evictionCount();

    long notificationFlushCount();
}
