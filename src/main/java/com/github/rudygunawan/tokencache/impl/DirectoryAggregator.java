package com.github.rudygunawan.tokencache.impl;

import com.github.rudygunawan.tokencache.model.CountEntry;
import com.github.rudygunawan.tokencache.model.EntryKind;
import com.github.rudygunawan.tokencache.model.TokenCount;
import com.github.rudygunawan.tokencache.policy.ResourceGovernor;
import com.github.rudygunawan.tokencache.time.Ticker;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes a directory's count as the sum of its eligible children.
 *
 * <p>Children that are fresh in the store are reused as they are; the others go through the
 * {@link FileProcessor}, at most {@code maxConcurrentJobs} at a time. A child that fails or is not
 * eligible contributes nothing. In recursive mode files in non-hidden subdirectories are included.
 *
 * <p>Concurrent requests for the same directory share one computation.
 */
public class DirectoryAggregator {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.tokencache.Directory");

    private final CacheStore store;
    private final WorkQueue queue;
    private final FileProcessor processor;
    private final NotificationBatcher notifier;
    private final Supplier<ResourceGovernor> governor;
    private final Executor ioExecutor;
    private final Ticker ticker;
    private final ConcurrentHashMap<String, CompletableFuture<Long>> inFlight = new ConcurrentHashMap<>();

    public DirectoryAggregator(CacheStore store,
                               WorkQueue queue,
                               FileProcessor processor,
                               NotificationBatcher notifier,
                               Supplier<ResourceGovernor> governor,
                               Executor ioExecutor,
                               Ticker ticker) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.processor = Objects.requireNonNull(processor, "processor cannot be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier cannot be null");
        this.governor = Objects.requireNonNull(governor, "governor cannot be null");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
    }

    /**
     * Sums the counts of the files in {@code directory} and stores the total as a
     * {@link EntryKind#DIRECTORY} entry.
     *
     * @param directory absolute path of the directory
     * @param recursive whether to descend into non-hidden subdirectories
     * @return the total; completes exceptionally with {@link UncheckedIOException} if the directory
     *         cannot be listed
     */
    public CompletableFuture<Long> computeDirectory(String directory, boolean recursive) {
        checkKey(directory);
        CompletableFuture<Long> created = new CompletableFuture<>();
        CompletableFuture<Long> existing = inFlight.putIfAbsent(directory, created);
        if (existing != null) {
            return existing;
        }

        long generation = store.generation();
        CompletableFuture<List<String>> listing;
        try {
            listing = CompletableFuture.supplyAsync(() -> listFiles(directory, recursive), ioExecutor);
        } catch (RejectedExecutionException e) {
            inFlight.remove(directory, created);
            created.completeExceptionally(e);
            return created;
        }
        listing.thenCompose(this::sumChildren)
                .thenApply(total -> store(directory, total, generation))
                .whenComplete((total, error) -> {
                    inFlight.remove(directory, created);
                    if (error != null) {
                        if (LOGGER.isLoggable(Level.FINE)) {
                            LOGGER.fine("Cannot aggregate " + directory + ": " + error);
                        }
                        created.completeExceptionally(error);
                    } else {
                        created.complete(total);
                    }
                });
        return created;
    }

    /**
     * Appends every eligible child file without a fresh entry to the back of the queue. Keys past
     * the queue limit are dropped silently.
     *
     * @return the number of keys queued
     */
    public CompletableFuture<Integer> queueDirectory(String directory, boolean recursive) {
        checkKey(directory);
        return CompletableFuture.supplyAsync(() -> {
            ResourceGovernor currentGovernor = governor.get();
            long now = ticker.read();
            int queued = 0;
            for (String child : listFiles(directory, recursive)) {
                if (!currentGovernor.checkName(child).isEligible() || store.getFresh(child, now) != null) {
                    continue;
                }
                if (queue.offer(child)) {
                    queued++;
                }
            }
            if (queued > 0) {
                LOGGER.info("Queued " + queued + " files from directory: " + directory);
            }
            return queued;
        }, ioExecutor);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private CompletableFuture<TokenCount> sumChildren(List<String> files) {
        ResourceGovernor currentGovernor = governor.get();
        long now = ticker.read();

        TokenCount reused = TokenCount.ZERO;
        List<String> stale = new ArrayList<>();
        for (String child : files) {
            if (!currentGovernor.checkName(child).isEligible()) {
                continue;
            }
            CountEntry fresh = store.getFresh(child, now);
            if (fresh != null && fresh.hasValue()) {
                reused = reused.plus(fresh.getCount());
            } else {
                stale.add(child);
            }
        }

        // Run the stale children in waves so no more than maxConcurrentJobs are in flight
        int parallelism = currentGovernor.getConfig().getMaxConcurrentJobs();
        CompletableFuture<TokenCount> total = CompletableFuture.completedFuture(reused);
        for (int start = 0; start < stale.size(); start += parallelism) {
            List<String> wave = stale.subList(start, Math.min(start + parallelism, stale.size()));
            total = total.thenCompose(sum -> sumWave(wave).thenApply(sum::plus));
        }
        return total;
    }

    private CompletableFuture<TokenCount> sumWave(List<String> wave) {
        List<CompletableFuture<TokenCount>> contributions = new ArrayList<>(wave.size());
        for (String child : wave) {
            contributions.add(contribution(child));
        }
        return CompletableFuture.allOf(contributions.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    TokenCount sum = TokenCount.ZERO;
                    for (CompletableFuture<TokenCount> contribution : contributions) {
                        sum = sum.plus(contribution.join());
                    }
                    return sum;
                });
    }

    private CompletableFuture<TokenCount> contribution(String child) {
        CompletableFuture<Optional<CountEntry>> run;
        try {
            run = processor.process(child);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Processor failed to start for " + child, e);
            return CompletableFuture.completedFuture(TokenCount.ZERO);
        }
        return run.handle((result, error) -> {
            if (error != null) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Child " + child + " contributes nothing: " + error);
                }
                return TokenCount.ZERO;
            }
            if (result.isPresent() && result.get().hasValue()) {
                return result.get().getCount();
            }
            // Skipped because another run holds the key; fall back to whatever is stored
            CountEntry stored = store.getIfPresent(child);
            return stored != null && stored.hasValue() ? stored.getCount() : TokenCount.ZERO;
        });
    }

    private long store(String directory, TokenCount total, long generation) {
        if (!governor.get().getConfig().isDirectoryCachingEnabled()) {
            return total.getValue();
        }
        CountEntry entry = CountEntry.of(directory, EntryKind.DIRECTORY, total, ticker.read());
        if (store.putIfGeneration(directory, entry, generation)) {
            notifier.notifyUpdated(directory, EntryKind.DIRECTORY);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Directory " + directory + " totals " + entry.getDisplayText());
            }
        }
        return total.getValue();
    }

    private static void checkKey(String directory) {
        Objects.requireNonNull(directory, "directory cannot be null");
        if (directory.isBlank()) {
            throw new IllegalArgumentException("directory cannot be blank");
        }
    }

    private static List<String> listFiles(String directory, boolean recursive) {
        Path root = Paths.get(directory);
        if (!Files.isDirectory(root)) {
            throw new UncheckedIOException(new NotDirectoryException(directory));
        }
        List<String> files = new ArrayList<>();
        try {
            collect(root, recursive, files);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan directory " + directory, e);
        }
        files.sort(null);
        return files;
    }

    private static void collect(Path directory, boolean recursive, List<String> files) throws IOException {
        List<Path> subdirectories = new ArrayList<>();
        try (DirectoryStream<Path> children = Files.newDirectoryStream(directory)) {
            for (Path child : children) {
                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                    if (recursive && !child.getFileName().toString().startsWith(".")) {
                        subdirectories.add(child);
                    }
                } else if (Files.isRegularFile(child)) {
                    files.add(child.toAbsolutePath().toString());
                }
            }
        }
        for (Path subdirectory : subdirectories) {
            collect(subdirectory, true, files);
        }
    }
}
