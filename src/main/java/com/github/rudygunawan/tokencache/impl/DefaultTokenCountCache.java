package com.github.rudygunawan.tokencache.impl;

import com.github.rudygunawan.tokencache.api.TokenCountCache;
import com.github.rudygunawan.tokencache.builder.TokenCountCacheBuilder;
import com.github.rudygunawan.tokencache.config.CacheConfig;
import com.github.rudygunawan.tokencache.listener.UpdateListener;
import com.github.rudygunawan.tokencache.metrics.CacheMetrics;
import com.github.rudygunawan.tokencache.model.CacheStats;
import com.github.rudygunawan.tokencache.model.CountEntry;
import com.github.rudygunawan.tokencache.model.EntryKind;
import com.github.rudygunawan.tokencache.policy.ResourceGovernor;
import com.github.rudygunawan.tokencache.time.Ticker;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The default {@link TokenCountCache}: one context object owning the store, queue, processor,
 * scheduler, debounce controller, notification batcher and directory aggregator.
 *
 * <p>Construction starts no threads. Executors the cache creates for itself are shut down by
 * {@link #close()}; executors passed to the builder are left running.
 */
public class DefaultTokenCountCache implements TokenCountCache, CacheMetrics {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.tokencache.Cache");

    private final Ticker ticker;
    private final BooleanSupplier hostBusy;
    private final ScheduledExecutorService timer;
    private final Executor ioExecutor;
    private final boolean ownsTimer;
    private final boolean ownsIoExecutor;

    private final CacheStore store;
    private final WorkQueue queue;
    private final NotificationBatcher notifier;
    private final FileProcessor processor;
    private final BackgroundScheduler scheduler;
    private final DebounceController debounce;
    private final DirectoryAggregator aggregator;

    private final Object configLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile ResourceGovernor governor;

    public DefaultTokenCountCache(TokenCountCacheBuilder builder) {
        CacheConfig config = builder.getConfig();
        this.ticker = builder.getTicker();
        this.hostBusy = builder.getHostBusy();
        this.governor = new ResourceGovernor(config, hostBusy);

        if (builder.getScheduler() != null) {
            this.timer = builder.getScheduler();
            this.ownsTimer = false;
        } else {
            this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "token-cache-scheduler");
                t.setDaemon(true);
                return t;
            });
            this.ownsTimer = true;
        }
        if (builder.getExecutor() != null) {
            this.ioExecutor = builder.getExecutor();
            this.ownsIoExecutor = false;
        } else {
            AtomicInteger threadNumber = new AtomicInteger();
            this.ioExecutor = Executors.newFixedThreadPool(config.getMaxConcurrentJobs(), r -> {
                Thread t = new Thread(r, "token-cache-io-" + threadNumber.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            this.ownsIoExecutor = true;
        }

        this.store = new CacheStore(config);
        this.queue = new WorkQueue(store, config.getMaxQueueSize());
        this.notifier = new NotificationBatcher(timer, ticker, config.getNotificationBatchWindow());
        this.processor = new FileProcessor(store, this::governor, builder.getCountFunction(),
                builder.getActivePredicate(), notifier, ioExecutor, ticker);
        this.scheduler = new BackgroundScheduler(timer, queue, store, processor, this::governor, ticker);
        this.debounce = new DebounceController(timer, queue, scheduler, this::governor);
        this.aggregator = new DirectoryAggregator(store, queue, processor, notifier, this::governor,
                ioExecutor, ticker);
    }

    private ResourceGovernor governor() {
        return governor;
    }

    @Override
    public CountEntry lookup(String key, EntryKind kind) {
        checkOpen();
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        if (key.isBlank()) {
            return null;
        }
        ResourceGovernor currentGovernor = governor;
        CacheConfig config = currentGovernor.getConfig();
        long now = ticker.read();

        CountEntry entry = store.getIfPresent(key);
        if (entry != null && entry.getKind() == kind && store.isFresh(entry, now)) {
            return entry;
        }
        boolean enabled = kind == EntryKind.FILE ? config.isFileCachingEnabled() : config.isDirectoryCachingEnabled();
        if (!enabled) {
            // Stale values are better than nothing when caching is switched off
            return entry;
        }

        if (kind == EntryKind.FILE) {
            if (!currentGovernor.checkName(key).isEligible()) {
                return null;
            }
            // Queue right away; only a newly queued key arms the debounced drain, so repeated
            // lookups cannot keep pushing the drain back
            if (queue.prioritize(key)) {
                debounce.request(key);
            }
        } else {
            aggregator.computeDirectory(key, false).whenComplete((total, error) -> {
                if (error != null && LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Directory lookup for " + key + " failed: " + error);
                }
            });
        }
        return CountEntry.placeholder(key, kind, config.getPlaceholderText(), now);
    }

    @Override
    public CountEntry lookup(String key) {
        checkOpen();
        Objects.requireNonNull(key, "key cannot be null");
        Path path;
        try {
            path = Paths.get(key);
        } catch (InvalidPathException e) {
            return null;
        }
        if (Files.isDirectory(path)) {
            return lookup(key, EntryKind.DIRECTORY);
        }
        if (Files.isRegularFile(path)) {
            return lookup(key, EntryKind.FILE);
        }
        return null;
    }

    @Override
    public CountEntry getIfPresent(String key) {
        return store.getIfPresent(key);
    }

    @Override
    public void requestImmediate(String key) {
        checkOpen();
        Objects.requireNonNull(key, "key cannot be null");
        if (!governor.checkName(key).isEligible()) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Ignoring immediate request for ineligible key " + key);
            }
            return;
        }
        debounce.request(key);
    }

    @Override
    public CompletableFuture<Optional<CountEntry>> processNow(String key) {
        checkOpen();
        Objects.requireNonNull(key, "key cannot be null");
        queue.remove(key);
        return processor.process(key);
    }

    @Override
    public CompletableFuture<Long> computeDirectory(String directory, boolean recursive) {
        checkOpen();
        return aggregator.computeDirectory(directory, recursive);
    }

    @Override
    public CompletableFuture<Integer> queueDirectory(String directory, boolean recursive) {
        checkOpen();
        return aggregator.queueDirectory(directory, recursive);
    }

    @Override
    public void invalidate(String key, boolean reprocess) {
        checkOpen();
        checkKey(key);
        store.invalidate(key);
        debounce.cancel(key);
        queue.remove(key);
        if (reprocess && governor.checkName(key).isEligible() && queue.offerFirst(key)) {
            scheduler.requestDrain();
        }
    }

    @Override
    public void clearAll() {
        checkOpen();
        debounce.cancelAll();
        queue.clear();
        store.invalidateAll();
        notifier.cancel();
        LOGGER.info("Token cache cleared");
    }

    @Override
    public int sweep() {
        checkOpen();
        return store.sweep(ticker.read());
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(
                store.count(EntryKind.FILE),
                store.count(EntryKind.DIRECTORY),
                store.processingCount(),
                queue.size(),
                debounce.pendingCount(),
                scheduler.isActive());
    }

    @Override
    public CacheConfig getConfig() {
        return governor.getConfig();
    }

    @Override
    public void updateConfig(CacheConfig config) {
        checkOpen();
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        boolean tickChanged;
        synchronized (configLock) {
            CacheConfig previous = governor.getConfig();
            governor = new ResourceGovernor(config, hostBusy);
            store.updateConfig(config);
            queue.setMaxQueueSize(config.getMaxQueueSize());
            notifier.setWindow(config.getNotificationBatchWindow());
            tickChanged = !previous.getTickInterval().equals(config.getTickInterval());
        }
        if (tickChanged) {
            scheduler.restart();
        }
        LOGGER.info("Token cache configuration updated: " + config);
    }

    @Override
    public void subscribe(UpdateListener listener) {
        checkOpen();
        notifier.subscribe(listener);
    }

    @Override
    public boolean unsubscribe(UpdateListener listener) {
        return notifier.unsubscribe(listener);
    }

    @Override
    public void start() {
        checkOpen();
        scheduler.start();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        scheduler.stop();
        debounce.cancelAll();
        notifier.cancel();
        if (ownsTimer) {
            timer.shutdownNow();
        }
        if (ownsIoExecutor) {
            ((ExecutorService) ioExecutor).shutdown();
        }
        LOGGER.info("Token cache closed");
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("token cache is closed");
        }
    }

    private static void checkKey(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key cannot be blank");
        }
    }

    // Package-private views for tests in this package

    CacheStore store() {
        return store;
    }

    WorkQueue workQueue() {
        return queue;
    }

    BackgroundScheduler backgroundScheduler() {
        return scheduler;
    }

    DebounceController debounceController() {
        return debounce;
    }

    NotificationBatcher notificationBatcher() {
        return notifier;
    }

    // CacheMetrics

    @Override
    public long size() {
        return store.size();
    }

    @Override
    public int processingCount() {
        return store.processingCount();
    }

    @Override
    public int queueSize() {
        return queue.size();
    }

    @Override
    public long readyCount() {
        return processor.readyCount();
    }

    @Override
    public long estimatedCount() {
        return processor.estimatedCount();
    }

    @Override
    public long oversizedCount() {
        return processor.oversizedCount();
    }

    @Override
    public long readFailureCount() {
        return processor.readFailureCount();
    }

    @Override
    public long queueDroppedCount() {
        return queue.droppedCount();
    }

    @Override
    public long evictionCount() {
        return store.expiredCount() + store.evictionCount();
    }

    @Override
    public long notificationFlushCount() {
        return notifier.flushCount();
    }
}
