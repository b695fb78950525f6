package com.github.rudygunawan.tokencache.impl;

import com.github.rudygunawan.tokencache.api.ActivePredicate;
import com.github.rudygunawan.tokencache.api.CountFunction;
import com.github.rudygunawan.tokencache.config.CacheConfig;
import com.github.rudygunawan.tokencache.policy.ResourceGovernor;
import com.github.rudygunawan.tokencache.time.FakeTicker;
import com.github.rudygunawan.tokencache.time.Ticker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class BackgroundSchedulerTest {

    @TempDir
    Path dir;

    private final FakeTicker ticker = new FakeTicker();
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
    private final AtomicBoolean hostBusy = new AtomicBoolean();

    private CacheConfig config = CacheConfig.builder()
            .tickInterval(1, TimeUnit.SECONDS)
            .maxBatchPerTick(2)
            .maxConcurrentJobs(3)
            .build();
    private CountFunction countFunction = (content, encoding) -> CompletableFuture.completedFuture((long) content.length);
    private Executor ioExecutor = Runnable::run;

    private CacheStore store;
    private WorkQueue queue;
    private BackgroundScheduler scheduler;

    @AfterEach
    void shutdown() {
        timer.shutdownNow();
    }

    private BackgroundScheduler scheduler(Ticker clock) {
        store = new CacheStore(config);
        queue = new WorkQueue(store, config.getMaxQueueSize());
        ResourceGovernor governor = new ResourceGovernor(config, hostBusy::get);
        NotificationBatcher notifier = new NotificationBatcher(timer, clock, config.getNotificationBatchWindow());
        FileProcessor processor = new FileProcessor(store, () -> governor, countFunction, ActivePredicate.none(),
                notifier, ioExecutor, clock);
        scheduler = new BackgroundScheduler(timer, queue, store, processor, () -> governor, clock);
        return scheduler;
    }

    private List<String> files(int count) throws IOException {
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Path file = dir.resolve("file" + i + ".txt");
            Files.writeString(file, "content " + i);
            keys.add(file.toString());
        }
        return keys;
    }

    @Test
    void testTickDrainsOneBoundedBatch() throws IOException {
        scheduler(ticker);
        List<String> keys = files(5);
        keys.forEach(queue::offer);

        assertEquals(2, scheduler.tick());
        assertEquals(3, queue.size());
        assertNotNull(store.getIfPresent(keys.get(0)));
        assertNotNull(store.getIfPresent(keys.get(1)));
        assertNull(store.getIfPresent(keys.get(2)));
        assertEquals(2, scheduler.dispatchedKeys());
    }

    @Test
    void testTickThrottledWithinInterval() throws IOException {
        scheduler(ticker);
        files(4).forEach(queue::offer);

        assertEquals(2, scheduler.tick());
        assertEquals(0, scheduler.tick());
        assertEquals(1, scheduler.throttledTicks());

        ticker.advance(999, TimeUnit.MILLISECONDS);
        assertEquals(0, scheduler.tick());

        ticker.advance(1, TimeUnit.MILLISECONDS);
        assertEquals(2, scheduler.tick());
        assertEquals(0, queue.size());
    }

    @Test
    void testTickBoundedBySpareCapacity() throws IOException {
        config = config.toBuilder().maxBatchPerTick(10).build();
        List<CompletableFuture<Long>> pending = new ArrayList<>();
        countFunction = (content, encoding) -> {
            CompletableFuture<Long> future = new CompletableFuture<>();
            pending.add(future);
            return future;
        };
        scheduler(ticker);
        files(5).forEach(queue::offer);

        assertEquals(3, scheduler.tick());
        assertEquals(3, store.processingCount());

        ticker.advance(2, TimeUnit.SECONDS);
        assertEquals(0, scheduler.tick());
        assertEquals(2, queue.size());

        pending.forEach(future -> future.complete(1L));
        assertEquals(0, store.processingCount());
        assertEquals(2, scheduler.tick());
    }

    @Test
    void testBusyHostSkipsTick() throws IOException {
        scheduler(ticker);
        files(2).forEach(queue::offer);
        hostBusy.set(true);

        assertEquals(0, scheduler.tick());
        assertEquals(1, scheduler.busySkips());
        assertEquals(2, queue.size());

        hostBusy.set(false);
        assertEquals(2, scheduler.tick());
    }

    @Test
    void testEmptyTicksCounted() throws IOException {
        scheduler(ticker);
        scheduler.tick();
        scheduler.tick();
        assertEquals(2, scheduler.consecutiveEmptyTicks());

        files(1).forEach(queue::offer);
        scheduler.tick();
        assertEquals(0, scheduler.consecutiveEmptyTicks());
    }

    @Test
    void testFailureDoesNotStopBatch() throws IOException {
        config = config.toBuilder().maxBatchPerTick(3).build();
        List<String> keys = files(3);
        Path doomed = Path.of(keys.get(0));
        AtomicInteger tasks = new AtomicInteger();
        // the second task is the read of the first key
        ioExecutor = task -> {
            if (tasks.incrementAndGet() == 2) {
                try {
                    Files.deleteIfExists(doomed);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
            task.run();
        };
        scheduler(ticker);
        keys.forEach(queue::offer);

        assertEquals(3, scheduler.tick());

        assertNull(store.getIfPresent(keys.get(0)));
        assertNotNull(store.getIfPresent(keys.get(1)));
        assertNotNull(store.getIfPresent(keys.get(2)));
        assertEquals(1, scheduler.processFailures());
    }

    @Test
    void testPeriodicTicksDrainQueue() throws Exception {
        config = CacheConfig.builder()
                .tickInterval(20, TimeUnit.MILLISECONDS)
                .minTickInterval(10, TimeUnit.MILLISECONDS)
                .maxTickInterval(50, TimeUnit.MILLISECONDS)
                .maxBatchPerTick(2)
                .build();
        scheduler(Ticker.systemTicker());
        List<String> keys = files(5);
        keys.forEach(queue::offer);

        assertFalse(scheduler.isActive());
        scheduler.start();
        assertTrue(scheduler.isActive());

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (store.size() < keys.size() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(keys.size(), store.size());
        assertTrue(scheduler.tickCount() >= 3);

        scheduler.stop();
        assertFalse(scheduler.isActive());
    }

    @Test
    void testRequestDrainRunsOnScheduler() throws Exception {
        scheduler(ticker);
        List<String> keys = files(1);
        queue.offerFirst(keys.get(0));

        scheduler.requestDrain();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (store.getIfPresent(keys.get(0)) == null && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertNotNull(store.getIfPresent(keys.get(0)));
    }
}
