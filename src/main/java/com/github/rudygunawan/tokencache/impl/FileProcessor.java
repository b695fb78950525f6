package com.github.rudygunawan.tokencache.impl;

import com.github.rudygunawan.tokencache.api.ActivePredicate;
import com.github.rudygunawan.tokencache.api.CountFunction;
import com.github.rudygunawan.tokencache.config.CacheConfig;
import com.github.rudygunawan.tokencache.model.CountEntry;
import com.github.rudygunawan.tokencache.model.EntryKind;
import com.github.rudygunawan.tokencache.model.TokenCount;
import com.github.rudygunawan.tokencache.policy.Eligibility;
import com.github.rudygunawan.tokencache.policy.FallbackEstimator;
import com.github.rudygunawan.tokencache.policy.ResourceGovernor;
import com.github.rudygunawan.tokencache.time.Ticker;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes the token count of one file and writes it to the {@link CacheStore}.
 *
 * <p>A run is a chain of asynchronous steps: claim the key, read the file on the I/O executor,
 * call the {@link CountFunction}, write the entry, release the key, notify listeners. Only the name
 * rules are checked on the calling thread; the file system checks, the active predicate and the
 * read run on the I/O executor.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>key already being processed, or not eligible: the future completes with an empty
 *       {@link Optional} and nothing is written</li>
 *   <li>file over the size ceiling and not active: a small sample is read and extrapolated into an
 *       {@code OVERSIZED} entry; the count function is not called</li>
 *   <li>read failure: the future completes exceptionally with {@link UncheckedIOException} and the
 *       store is left untouched</li>
 *   <li>count function failure, timeout, {@code null} or negative result: a local estimate is
 *       written as an {@code ESTIMATED} entry</li>
 * </ul>
 */
public class FileProcessor {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.tokencache.Processor");

    // Active files above this size are still counted, with a warning
    private static final long LARGE_ACTIVE_FILE_BYTES = 10L * 1024 * 1024;

    private static final CompletableFuture<Optional<CountEntry>> SKIPPED = CompletableFuture.completedFuture(Optional.empty());

    private enum Step {
        SKIP,
        SAMPLE,
        READ,
        // Oversized but open in the host, so read in full
        READ_ALL
    }

    private final CacheStore store;
    private final Supplier<ResourceGovernor> governor;
    private final CountFunction countFunction;
    private final ActivePredicate activePredicate;
    private final NotificationBatcher notifier;
    private final Executor ioExecutor;
    private final Ticker ticker;

    private final AtomicLong readyCount = new AtomicLong();
    private final AtomicLong estimatedCount = new AtomicLong();
    private final AtomicLong oversizedCount = new AtomicLong();
    private final AtomicLong readFailureCount = new AtomicLong();
    private final AtomicLong computeCalls = new AtomicLong();

    public FileProcessor(CacheStore store,
                         Supplier<ResourceGovernor> governor,
                         CountFunction countFunction,
                         ActivePredicate activePredicate,
                         NotificationBatcher notifier,
                         Executor ioExecutor,
                         Ticker ticker) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.governor = Objects.requireNonNull(governor, "governor cannot be null");
        this.countFunction = Objects.requireNonNull(countFunction, "countFunction cannot be null");
        this.activePredicate = Objects.requireNonNull(activePredicate, "activePredicate cannot be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier cannot be null");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
    }

    /**
     * Processes {@code key} once.
     *
     * @param key the absolute path of a file
     * @return a future with the written entry, or empty if the run was skipped
     */
    public CompletableFuture<Optional<CountEntry>> process(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (key.isBlank()) {
            return SKIPPED;
        }

        ResourceGovernor currentGovernor = governor.get();
        CacheConfig config = currentGovernor.getConfig();
        Eligibility byName = currentGovernor.checkName(key);
        if (!byName.isEligible()) {
            logSkip(key, byName);
            return SKIPPED;
        }
        if (!store.beginProcessing(key)) {
            return SKIPPED;
        }
        long generation = store.generation();

        CompletableFuture<Optional<CountEntry>> run;
        try {
            run = CompletableFuture.supplyAsync(() -> plan(key, currentGovernor), ioExecutor)
                    .thenCompose(step -> execute(key, step, config, generation));
        } catch (RejectedExecutionException e) {
            store.endProcessing(key);
            return CompletableFuture.failedFuture(e);
        }
        return finish(key, run);
    }

    // Runs on the I/O executor: stats the file and asks the host whether it is open
    private Step plan(String key, ResourceGovernor currentGovernor) {
        Eligibility eligibility = currentGovernor.check(key);
        if (eligibility == Eligibility.OVERSIZED) {
            return isActive(key) ? Step.READ_ALL : Step.SAMPLE;
        }
        if (!eligibility.isEligible()) {
            logSkip(key, eligibility);
            return Step.SKIP;
        }
        return Step.READ;
    }

    private CompletableFuture<Optional<CountEntry>> execute(String key, Step step, CacheConfig config, long generation) {
        switch (step) {
            case SKIP:
                return SKIPPED;
            case SAMPLE:
                return CompletableFuture.supplyAsync(() -> sampleEstimate(key, config.getOversizedSampleBytes()), ioExecutor)
                        .thenApply(estimate -> {
                            oversizedCount.incrementAndGet();
                            return Optional.of(write(key, TokenCount.oversized(estimate), generation));
                        });
            default:
                long limit = step == Step.READ_ALL ? Long.MAX_VALUE : config.getMaxFileSizeBytes();
                return CompletableFuture.supplyAsync(() -> readContent(key, limit), ioExecutor)
                        .thenCompose(content -> content.length == 0
                                ? CompletableFuture.completedFuture(TokenCount.ZERO)
                                : countTokens(key, content, config))
                        .thenApply(count -> Optional.of(write(key, count, generation)));
        }
    }

    private static void logSkip(String key, Eligibility eligibility) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Skipping " + key + ": " + eligibility);
        }
    }

    private CompletableFuture<Optional<CountEntry>> finish(String key, CompletableFuture<Optional<CountEntry>> run) {
        return run.whenComplete((result, error) -> {
            store.endProcessing(key);
            if (error != null) {
                readFailureCount.incrementAndGet();
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.log(Level.FINE, "Processing failed for " + key + ", leaving entry absent", unwrap(error));
                }
                return;
            }
            // Runs discarded by a clear are not announced
            if (result.isPresent() && store.getIfPresent(key) == result.get()) {
                notifier.notifyUpdated(key, EntryKind.FILE);
            }
        });
    }

    private CompletableFuture<TokenCount> countTokens(String key, byte[] content, CacheConfig config) {
        computeCalls.incrementAndGet();
        CompletableFuture<Long> computed = new CompletableFuture<>();
        try {
            CompletionStage<Long> stage = countFunction.compute(content, config.getEncodingHint());
            if (stage == null) {
                computed.completeExceptionally(new IllegalStateException("count function returned no result"));
            } else {
                // Copy so the timeout below never completes the caller's own future
                stage.whenComplete((value, error) -> {
                    if (error != null) {
                        computed.completeExceptionally(error);
                    } else {
                        computed.complete(value);
                    }
                });
            }
        } catch (RuntimeException e) {
            computed.completeExceptionally(e);
        }

        return computed
                .orTimeout(config.getComputeTimeout().toNanos(), TimeUnit.NANOSECONDS)
                .handle((value, error) -> {
                    if (error == null && value != null && value >= 0) {
                        readyCount.incrementAndGet();
                        return TokenCount.exact(value);
                    }
                    long estimate = FallbackEstimator.estimate(content);
                    estimatedCount.incrementAndGet();
                    LOGGER.warning("Count function failed for " + key + ", using estimate " + estimate
                            + ": " + describeFailure(value, error));
                    return TokenCount.estimated(estimate);
                });
    }

    private CountEntry write(String key, TokenCount count, long generation) {
        CountEntry entry = CountEntry.of(key, EntryKind.FILE, count, ticker.read());
        if (!store.putIfGeneration(key, entry, generation)) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Cache was cleared while processing " + key + ", result not stored");
            }
        } else if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Stored " + entry);
        }
        return entry;
    }

    private boolean isActive(String key) {
        try {
            return activePredicate.isActive(key);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Active predicate threw for " + key + ", treating as inactive", e);
            return false;
        }
    }

    private static byte[] readContent(String key, long limit) {
        Path path = Paths.get(key);
        try (InputStream in = Files.newInputStream(path)) {
            if (limit >= Integer.MAX_VALUE) {
                long size = Files.size(path);
                if (size > LARGE_ACTIVE_FILE_BYTES) {
                    LOGGER.warning(String.format("Processing very large active file: %s (%.1fMB)",
                            key, size / (1024.0 * 1024.0)));
                }
                return in.readAllBytes();
            }
            return in.readNBytes((int) limit);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + key, e);
        }
    }

    private static long sampleEstimate(String key, int sampleBytes) {
        Path path = Paths.get(key);
        try (InputStream in = Files.newInputStream(path)) {
            long size = Files.size(path);
            byte[] sample = in.readNBytes(sampleBytes);
            long estimate = FallbackEstimator.extrapolate(sample, size);
            LOGGER.info("Estimated oversized file " + key + " (" + size + " bytes) at " + estimate + " tokens");
            return estimate;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot sample " + key, e);
        }
    }

    private static String describeFailure(Long value, Throwable error) {
        if (error != null) {
            Throwable cause = unwrap(error);
            if (cause instanceof TimeoutException) {
                return "timed out";
            }
            return String.valueOf(cause);
        }
        return value == null ? "no count returned" : "invalid count " + value;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    public long readyCount() {
        return readyCount.get();
    }

    public long estimatedCount() {
        return estimatedCount.get();
    }

    public long oversizedCount() {
        return oversizedCount.get();
    }

    public long readFailureCount() {
        return readFailureCount.get();
    }

    /**
     * Returns how many times the count function was invoked.
     */
    public long computeCalls() {
        return computeCalls.get();
    }
}
