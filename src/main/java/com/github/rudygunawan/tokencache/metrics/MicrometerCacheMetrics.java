package com.github.rudygunawan.tokencache.metrics;

import com.github.rudygunawan.tokencache.api.TokenCountCache;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Micrometer integration for the token cache.
 *
 * <p>Exposes the following metrics, all tagged with {@code cache=<name>}:
 * <ul>
 *   <li>token.cache.size - Current number of entries
 *   <li>token.cache.processing - Keys currently being processed
 *   <li>token.cache.queue.size - Keys waiting in the queue
 *   <li>token.cache.computations - File counts by {@code result}: ready, estimated, oversized
 *   <li>token.cache.read.failures - Files that could not be read
 *   <li>token.cache.queue.dropped - Background keys dropped by a full queue
 *   <li>token.cache.evictions - Entries removed by expiry or the entry ceiling
 *   <li>token.cache.notifications.flushed - Listener batches delivered
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * DefaultTokenCountCache cache = TokenCountCacheBuilder.newBuilder()
 *     .countFunction(tokenizer)
 *     .build();
 *
 * MicrometerCacheMetrics.monitor(registry, cache, "workspace");
 * }</pre>
 */
public class MicrometerCacheMetrics implements MeterBinder {

    private final CacheMetrics cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    /**
     * @param cache the cache to monitor
     * @param cacheName the name of the cache for metric tags
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerCacheMetrics(CacheMetrics cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Binds {@code cache} to {@code registry}.
     *
     * @return the cache (for chaining)
     */
    public static <C extends TokenCountCache & CacheMetrics> C monitor(
            MeterRegistry registry, C cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    public static <C extends TokenCountCache & CacheMetrics> C monitor(
            MeterRegistry registry, C cache, String cacheName, Iterable<Tag> tags) {
        new MicrometerCacheMetrics(cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        Gauge.builder("token.cache.size", cache, CacheMetrics::size)
                .tags(allTags)
                .description("Current number of cached entries")
                .register(registry);

        Gauge.builder("token.cache.processing", cache, CacheMetrics::processingCount)
                .tags(allTags)
                .description("Keys currently being processed")
                .register(registry);

        Gauge.builder("token.cache.queue.size", cache, CacheMetrics::queueSize)
                .tags(allTags)
                .description("Keys waiting for background processing")
                .register(registry);

        FunctionCounter.builder("token.cache.computations", cache, CacheMetrics::readyCount)
                .tags(allTags.and("result", "ready"))
                .description("File counts produced by the count function")
                .register(registry);

        FunctionCounter.builder("token.cache.computations", cache, CacheMetrics::estimatedCount)
                .tags(allTags.and("result", "estimated"))
                .description("File counts that fell back to the local estimate")
                .register(registry);

        FunctionCounter.builder("token.cache.computations", cache, CacheMetrics::oversizedCount)
                .tags(allTags.and("result", "oversized"))
                .description("Oversized files estimated from a sample")
                .register(registry);

        FunctionCounter.builder("token.cache.read.failures", cache, CacheMetrics::readFailureCount)
                .tags(allTags)
                .description("Files that could not be read")
                .register(registry);

        FunctionCounter.builder("token.cache.queue.dropped", cache, CacheMetrics::queueDroppedCount)
                .tags(allTags)
                .description("Background keys dropped because the queue was full")
                .register(registry);

        FunctionCounter.builder("token.cache.evictions", cache, CacheMetrics::evictionCount)
                .tags(allTags)
                .description("Entries removed by expiry or the entry ceiling")
                .register(registry);

        FunctionCounter.builder("token.cache.notifications.flushed", cache, CacheMetrics::notificationFlushCount)
                .tags(allTags)
                .description("Update batches delivered to listeners")
                .register(registry);
    }
}
