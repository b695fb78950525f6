package com.github.rudygunawan.tokencache.builder;

import com.github.rudygunawan.tokencache.api.ActivePredicate;
import com.github.rudygunawan.tokencache.api.CountFunction;
import com.github.rudygunawan.tokencache.config.CacheConfig;
import com.github.rudygunawan.tokencache.impl.DefaultTokenCountCache;
import com.github.rudygunawan.tokencache.time.Ticker;

import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.BooleanSupplier;

/**
 * A builder of {@link DefaultTokenCountCache} instances.
 *
 * <p>Only the count function is required. Everything else has a default: {@link CacheConfig#defaults()},
 * no active files, a host that is never busy, the system ticker, and executors owned by the cache.
 *
 * <p>Usage example:
 * <pre>{@code
 * DefaultTokenCountCache cache = TokenCountCacheBuilder.newBuilder()
 *     .config(CacheConfig.builder()
 *         .tickInterval(2, TimeUnit.SECONDS)
 *         .maxConcurrentJobs(3)
 *         .build())
 *     .countFunction((content, encoding) -> tokenizer.countAsync(content, encoding))
 *     .activePredicate(editor::isOpen)
 *     .hostBusy(editor::isTyping)
 *     .build();
 * cache.start();
 * }</pre>
 *
 * <p>The built cache starts no threads until it is used; call {@code start()} to begin background
 * draining.
 */
public final class TokenCountCacheBuilder {

    private CacheConfig config = CacheConfig.defaults();
    private CountFunction countFunction;
    private ActivePredicate activePredicate = ActivePredicate.none();
    private BooleanSupplier hostBusy = () -> false;
    private Ticker ticker = Ticker.systemTicker();
    private ScheduledExecutorService scheduler;
    private Executor executor;

    private TokenCountCacheBuilder() {
    }

    public static TokenCountCacheBuilder newBuilder() {
        return new TokenCountCacheBuilder();
    }

    public TokenCountCacheBuilder config(CacheConfig config) {
        if (config == null) {
            throw new NullPointerException("config cannot be null");
        }
        this.config = config;
        return this;
    }

    /**
     * Sets the function that counts the tokens of a file's content. Required.
     */
    public TokenCountCacheBuilder countFunction(CountFunction countFunction) {
        if (countFunction == null) {
            throw new NullPointerException("countFunction cannot be null");
        }
        this.countFunction = countFunction;
        return this;
    }

    /**
     * Sets the predicate naming files in active use. Active files are counted even above the size
     * ceiling.
     */
    public TokenCountCacheBuilder activePredicate(ActivePredicate activePredicate) {
        if (activePredicate == null) {
            throw new NullPointerException("activePredicate cannot be null");
        }
        this.activePredicate = activePredicate;
        return this;
    }

    /**
     * Sets the host's "busy" signal, for example "the user is typing". While it returns
     * {@code true} scheduler ticks are skipped and debounce windows are doubled.
     */
    public TokenCountCacheBuilder hostBusy(BooleanSupplier hostBusy) {
        if (hostBusy == null) {
            throw new NullPointerException("hostBusy cannot be null");
        }
        this.hostBusy = hostBusy;
        return this;
    }

    public TokenCountCacheBuilder ticker(Ticker ticker) {
        if (ticker == null) {
            throw new NullPointerException("ticker cannot be null");
        }
        this.ticker = ticker;
        return this;
    }

    /**
     * Specifies the scheduled executor for ticks, debounce timers and notification flushes.
     *
     * <p>It should be single-threaded: ticks rely on it to never overlap. A scheduler supplied here
     * is not shut down when the cache is closed.
     */
    public TokenCountCacheBuilder scheduler(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new NullPointerException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
        return this;
    }

    /**
     * Specifies the executor for file reads and directory scans. An executor supplied here is not
     * shut down when the cache is closed.
     */
    public TokenCountCacheBuilder executor(Executor executor) {
        if (executor == null) {
            throw new NullPointerException("executor cannot be null");
        }
        this.executor = executor;
        return this;
    }

    /**
     * @throws IllegalStateException if no count function was set
     */
    public DefaultTokenCountCache build() {
        if (countFunction == null) {
            throw new IllegalStateException("countFunction is required");
        }
        return new DefaultTokenCountCache(this);
    }

    public CacheConfig getConfig() {
        return config;
    }

    public CountFunction getCountFunction() {
        return countFunction;
    }

    public ActivePredicate getActivePredicate() {
        return activePredicate;
    }

    public BooleanSupplier getHostBusy() {
        return hostBusy;
    }

    public Ticker getTicker() {
        return ticker;
    }

    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    public Executor getExecutor() {
        return executor;
    }
}
