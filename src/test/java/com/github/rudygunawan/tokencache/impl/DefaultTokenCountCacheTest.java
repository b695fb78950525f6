package com.github.rudygunawan.tokencache.impl;

import com.github.rudygunawan.tokencache.builder.TokenCountCacheBuilder;
import com.github.rudygunawan.tokencache.config.CacheConfig;
import com.github.rudygunawan.tokencache.listener.UpdateListener;
import com.github.rudygunawan.tokencache.model.CacheStats;
import com.github.rudygunawan.tokencache.model.CountEntry;
import com.github.rudygunawan.tokencache.model.EntryKind;
import com.github.rudygunawan.tokencache.model.EntryStatus;
import com.github.rudygunawan.tokencache.time.FakeTicker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(20)
class DefaultTokenCountCacheTest {

    @TempDir
    Path dir;

    private final FakeTicker ticker = new FakeTicker();
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
    private final AtomicInteger computeCalls = new AtomicInteger();

    private DefaultTokenCountCache cache;

    @AfterEach
    void shutdown() {
        if (cache != null) {
            cache.close();
        }
        timer.shutdownNow();
    }

    private DefaultTokenCountCache cache(CacheConfig config) {
        cache = TokenCountCacheBuilder.newBuilder()
                .config(config)
                .countFunction((content, encoding) -> {
                    computeCalls.incrementAndGet();
                    return CompletableFuture.completedFuture((long) content.length);
                })
                .ticker(ticker)
                .scheduler(timer)
                .executor(Runnable::run)
                .build();
        return cache;
    }

    private DefaultTokenCountCache cache() {
        return cache(CacheConfig.builder().debounceWindow(20, TimeUnit.MILLISECONDS).build());
    }

    private String write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file.toString();
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(condition.getAsBoolean(), "condition not met in time");
    }

    @Test
    void testLookupReturnsPlaceholderThenValue() throws IOException {
        cache();
        String key = write("a.txt", "twelve chars");

        CountEntry first = cache.lookup(key, EntryKind.FILE);
        assertEquals(EntryStatus.PROCESSING, first.getStatus());
        assertFalse(first.hasValue());
        assertEquals("⋯", first.getDisplayText());

        CountEntry computed = cache.processNow(key).join().get();
        assertEquals(12L, computed.getValue());
        assertSame(computed, cache.lookup(key, EntryKind.FILE));
        assertSame(computed, cache.getIfPresent(key));
    }

    @Test
    void testLookupSchedulesBackgroundCount() throws Exception {
        cache();
        String key = write("a.txt", "hello");

        assertFalse(cache.lookup(key, EntryKind.FILE).hasValue());

        await(() -> cache.getIfPresent(key) != null);
        assertEquals(5L, cache.lookup(key, EntryKind.FILE).getValue());
        assertEquals(1, computeCalls.get());
    }

    @Test
    void testLookupDetectsKind() throws IOException {
        cache();
        String file = write("a.txt", "abc");
        write("b.txt", "defg");

        assertEquals(EntryKind.DIRECTORY, cache.lookup(dir.toString()).getKind());

        // the directory was aggregated on the calling thread
        CountEntry directory = cache.getIfPresent(dir.toString());
        assertEquals(EntryKind.DIRECTORY, directory.getKind());
        assertEquals(7L, directory.getValue());

        CountEntry child = cache.lookup(file);
        assertEquals(EntryKind.FILE, child.getKind());
        assertEquals(3L, child.getValue());
        assertNull(cache.lookup(dir.resolve("missing.txt").toString()));
    }

    @Test
    void testIneligibleKeysIgnored() throws IOException {
        cache();
        String image = write("photo.png", "binary");

        assertNull(cache.lookup(image, EntryKind.FILE));
        assertNull(cache.lookup("  ", EntryKind.FILE));
        cache.requestImmediate(image);
        assertEquals(0, cache.debounceController().pendingCount());
    }

    @Test
    void testBlankKeysSkippedQuietly() {
        cache();

        cache.requestImmediate("");
        cache.requestImmediate("  ");
        assertEquals(0, cache.debounceController().pendingCount());

        assertFalse(cache.processNow("").join().isPresent());
        assertFalse(cache.processNow("  ").join().isPresent());
        assertEquals(0, cache.size());
        assertEquals(0, computeCalls.get());
    }

    @Test
    void testFrequentLookupsStillGetCounted() throws Exception {
        cache(CacheConfig.builder()
                .debounceWindow(100, TimeUnit.MILLISECONDS)
                .tickInterval(200, TimeUnit.MILLISECONDS)
                .build());
        String key = write("a.txt", "polled");

        // a status line redrawing faster than the debounce window
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        CountEntry entry = cache.lookup(key, EntryKind.FILE);
        while (!entry.hasValue() && System.nanoTime() < deadline) {
            Thread.sleep(20);
            entry = cache.lookup(key, EntryKind.FILE);
        }

        assertEquals(6L, entry.getValue());
        assertEquals(1, computeCalls.get());
        assertEquals(1, cache.debounceController().requestCount());
    }

    @Test
    void testDisabledCachingReturnsStoredEntry() throws IOException {
        cache(CacheConfig.builder().fileCachingEnabled(false).build());
        String key = write("a.txt", "abc");

        assertNull(cache.lookup(key, EntryKind.FILE));
        assertEquals(0, cache.debounceController().pendingCount());

        cache.processNow(key).join();
        ticker.advance(10, TimeUnit.MINUTES);
        // stale, but still returned as is
        assertEquals(3L, cache.lookup(key, EntryKind.FILE).getValue());
    }

    @Test
    void testInvalidate() throws Exception {
        cache();
        String key = write("a.txt", "abc");
        cache.processNow(key).join();

        cache.invalidate(key, false);
        assertNull(cache.getIfPresent(key));
        assertFalse(cache.workQueue().contains(key));

        cache.processNow(key).join();
        cache.invalidate(key, true);
        await(() -> cache.getIfPresent(key) != null);
        assertEquals(3, computeCalls.get());
    }

    @Test
    void testClearAll() throws IOException {
        cache(CacheConfig.builder().debounceWindow(5, TimeUnit.SECONDS).build());
        String key = write("a.txt", "abc");
        cache.processNow(key).join();
        cache.computeDirectory(dir.toString(), false).join();
        cache.workQueue().offer(write("b.txt", "defg"));
        cache.lookup(write("c.txt", "x"), EntryKind.FILE);

        CacheStats before = cache.stats();
        assertEquals(1, before.cachedFiles());
        // b.txt offered in the background, c.txt queued by the lookup
        assertEquals(2, before.queuedCount());
        assertEquals(1, before.pendingDebounces());
        assertEquals(1, before.cachedDirectories());

        cache.clearAll();

        CacheStats after = cache.stats();
        assertEquals(0, after.cachedCount());
        assertEquals(0, after.queuedCount());
        assertEquals(0, after.pendingDebounces());
        assertNull(cache.getIfPresent(key));
    }

    @Test
    void testSweepRemovesExpiredEntries() throws IOException {
        cache();
        cache.processNow(write("a.txt", "abc")).join();
        cache.computeDirectory(dir.toString(), false).join();

        ticker.advance(6, TimeUnit.MINUTES);
        assertEquals(1, cache.sweep());
        assertEquals(0, cache.stats().cachedFiles());
        assertEquals(1, cache.stats().cachedDirectories());

        ticker.advance(5, TimeUnit.MINUTES);
        assertEquals(1, cache.sweep());
        assertEquals(2, cache.evictionCount());
    }

    @Test
    void testStartAndStats() {
        cache();
        assertFalse(cache.stats().schedulerActive());

        cache.start();
        assertTrue(cache.stats().schedulerActive());
        assertTrue(cache.stats().isIdle());
    }

    @Test
    void testUpdateConfig() {
        cache();
        assertThrows(IllegalArgumentException.class, () -> cache.updateConfig(null));

        CacheConfig smaller = CacheConfig.builder().maxQueueSize(1).tickInterval(5, TimeUnit.SECONDS).build();
        cache.start();
        cache.updateConfig(smaller);

        assertSame(smaller, cache.getConfig());
        assertTrue(cache.stats().schedulerActive());
        assertTrue(cache.workQueue().offer("/tmp/first.txt"));
        assertFalse(cache.workQueue().offer("/tmp/second.txt"));
    }

    @Test
    void testBackgroundOverflowDroppedButPriorityAccepted() throws Exception {
        cache(CacheConfig.builder().maxQueueSize(2).debounceWindow(20, TimeUnit.MILLISECONDS).build());
        for (int i = 0; i < 4; i++) {
            write("bulk" + i + ".txt", "bulk");
        }

        assertEquals(2, cache.queueDirectory(dir.toString(), false).join());
        assertEquals(2, cache.queueDroppedCount());

        String urgent = write("urgent.txt", "now please");
        cache.requestImmediate(urgent);

        await(() -> cache.getIfPresent(urgent) != null);
        assertEquals(10L, cache.getIfPresent(urgent).getValue());
    }

    @Test
    void testSubscriberNotified() throws Exception {
        cache(CacheConfig.builder().notificationBatchWindow(50, TimeUnit.MILLISECONDS).build());
        List<String> updated = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch delivered = new CountDownLatch(1);
        UpdateListener listener = (key, kind) -> {
            updated.add(key);
            delivered.countDown();
        };
        cache.subscribe(listener);

        String key = write("a.txt", "abc");
        cache.processNow(key).join();

        assertTrue(delivered.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(key), updated);
        assertEquals(1, cache.notificationFlushCount());
        assertTrue(cache.unsubscribe(listener));
    }

    @Test
    void testClosedCacheRejectsCalls() throws IOException {
        cache();
        String key = write("a.txt", "abc");
        cache.close();
        cache.close();

        assertTrue(cache.isClosed());
        assertThrows(IllegalStateException.class, () -> cache.lookup(key, EntryKind.FILE));
        assertThrows(IllegalStateException.class, () -> cache.processNow(key));
        assertThrows(IllegalStateException.class, () -> cache.clearAll());
        assertThrows(IllegalStateException.class, () -> cache.start());
        // the caller's scheduler is left running
        assertFalse(timer.isShutdown());
    }

    @Test
    void testOwnedExecutorsShutDownOnClose() throws Exception {
        DefaultTokenCountCache owned = TokenCountCacheBuilder.newBuilder()
                .countFunction((content, encoding) -> CompletableFuture.completedFuture(1L))
                .build();
        String key = write("a.txt", "abc");

        assertEquals(1L, owned.processNow(key).get(5, TimeUnit.SECONDS).get().getValue());
        owned.start();
        owned.close();

        assertTrue(owned.isClosed());
        assertFalse(owned.stats().schedulerActive());
    }
}
