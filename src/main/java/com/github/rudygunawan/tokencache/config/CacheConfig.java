package com.github.rudygunawan.tokencache.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Immutable configuration of a token cache. Use {@link #builder()} to create instances; a running
 * cache accepts a whole new configuration through
 * {@link com.github.rudygunawan.tokencache.api.TokenCountCache#updateConfig(CacheConfig)}.
 *
 * <p>Usage example:
 * <pre>{@code
 * CacheConfig config = CacheConfig.builder()
 *     .tickInterval(1, TimeUnit.SECONDS)
 *     .ttlFile(2, TimeUnit.MINUTES)
 *     .maxFileSizeBytes(1024 * 1024)
 *     .build();
 * }</pre>
 */
public final class CacheConfig {

    /**
     * Extensions counted by default. Matching is case-insensitive.
     */
    public static final Set<String> DEFAULT_EXTENSIONS = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            "lua", "py", "js", "ts", "java", "c", "cpp", "rs", "go", "rb", "php", "swift", "kt", "scala",
            "clj", "hs", "vim", "sh", "zsh", "fish", "ps1",
            "html", "css", "scss", "sass", "less", "vue", "svelte", "jsx", "tsx",
            "json", "xml", "yaml", "yml", "toml",
            "md", "txt", "rst", "org", "tex", "latex",
            "conf", "config", "ini", "cfg", "properties",
            "csv", "tsv", "sql", "graphql", "proto",
            "log", "diff", "patch")));

    /**
     * Glob patterns skipped by default: hidden files, lock files and temporary files.
     */
    public static final List<String> DEFAULT_IGNORE_PATTERNS = List.of("**/.*", "**/*.lock", "**/*.tmp");

    /**
     * Prefix of the keys read by {@link #fromProperties(Properties)}.
     */
    public static final String PROPERTY_PREFIX = "token-cache.";

    private final Duration tickInterval;
    private final Duration minTickInterval;
    private final Duration maxTickInterval;
    private final boolean adaptiveScheduling;
    private final int queueSizeThreshold;
    private final int idleTicksBeforeSpeedup;
    private final Duration ttlFile;
    private final Duration ttlDirectory;
    private final int maxBatchPerTick;
    private final int maxConcurrentJobs;
    private final int maxQueueSize;
    private final long maxEntries;
    private final long maxFileSizeBytes;
    private final int oversizedSampleBytes;
    private final Duration debounceWindow;
    private final Duration notificationBatchWindow;
    private final Duration computeTimeout;
    private final String placeholderText;
    private final String encodingHint;
    private final Set<String> allowedExtensions;
    private final List<String> ignorePatterns;
    private final boolean fileCachingEnabled;
    private final boolean directoryCachingEnabled;

    private CacheConfig(Builder builder) {
        this.tickInterval = Duration.ofNanos(builder.tickIntervalNanos);
        this.minTickInterval = Duration.ofNanos(builder.minTickIntervalNanos);
        this.maxTickInterval = Duration.ofNanos(builder.maxTickIntervalNanos);
        this.adaptiveScheduling = builder.adaptiveScheduling;
        this.queueSizeThreshold = builder.queueSizeThreshold;
        this.idleTicksBeforeSpeedup = builder.idleTicksBeforeSpeedup;
        this.ttlFile = Duration.ofNanos(builder.ttlFileNanos);
        this.ttlDirectory = Duration.ofNanos(builder.ttlDirectoryNanos);
        this.maxBatchPerTick = builder.maxBatchPerTick;
        this.maxConcurrentJobs = builder.maxConcurrentJobs;
        this.maxQueueSize = builder.maxQueueSize;
        this.maxEntries = builder.maxEntries;
        this.maxFileSizeBytes = builder.maxFileSizeBytes;
        this.oversizedSampleBytes = builder.oversizedSampleBytes;
        this.debounceWindow = Duration.ofNanos(builder.debounceWindowNanos);
        this.notificationBatchWindow = Duration.ofNanos(builder.notificationBatchWindowNanos);
        this.computeTimeout = Duration.ofNanos(builder.computeTimeoutNanos);
        this.placeholderText = builder.placeholderText;
        this.encodingHint = builder.encodingHint;
        this.allowedExtensions = Collections.unmodifiableSet(new LinkedHashSet<>(builder.allowedExtensions));
        this.ignorePatterns = List.copyOf(builder.ignorePatterns);
        this.fileCachingEnabled = builder.fileCachingEnabled;
        this.directoryCachingEnabled = builder.directoryCachingEnabled;
    }

    /**
     * Creates a new builder initialised with the defaults.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the default configuration.
     */
    public static CacheConfig defaults() {
        return new Builder().build();
    }

    /**
     * Returns a builder initialised with the values of this configuration.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.tickIntervalNanos = tickInterval.toNanos();
        builder.minTickIntervalNanos = minTickInterval.toNanos();
        builder.maxTickIntervalNanos = maxTickInterval.toNanos();
        builder.adaptiveScheduling = adaptiveScheduling;
        builder.queueSizeThreshold = queueSizeThreshold;
        builder.idleTicksBeforeSpeedup = idleTicksBeforeSpeedup;
        builder.ttlFileNanos = ttlFile.toNanos();
        builder.ttlDirectoryNanos = ttlDirectory.toNanos();
        builder.maxBatchPerTick = maxBatchPerTick;
        builder.maxConcurrentJobs = maxConcurrentJobs;
        builder.maxQueueSize = maxQueueSize;
        builder.maxEntries = maxEntries;
        builder.maxFileSizeBytes = maxFileSizeBytes;
        builder.oversizedSampleBytes = oversizedSampleBytes;
        builder.debounceWindowNanos = debounceWindow.toNanos();
        builder.notificationBatchWindowNanos = notificationBatchWindow.toNanos();
        builder.computeTimeoutNanos = computeTimeout.toNanos();
        builder.placeholderText = placeholderText;
        builder.encodingHint = encodingHint;
        builder.allowedExtensions = new LinkedHashSet<>(allowedExtensions);
        builder.ignorePatterns = ignorePatterns;
        builder.fileCachingEnabled = fileCachingEnabled;
        builder.directoryCachingEnabled = directoryCachingEnabled;
        return builder;
    }

    /**
     * Reads a configuration from properties. Keys are the builder method names prefixed with
     * {@value #PROPERTY_PREFIX}, durations are in milliseconds and lists are comma separated:
     *
     * <pre>
     * token-cache.tickInterval=2000
     * token-cache.ttlFile=300000
     * token-cache.allowedExtensions=java,md,txt
     * token-cache.ignorePatterns=**&#47;.*,**&#47;build/**
     * </pre>
     *
     * <p>Missing keys keep their defaults.
     *
     * @param properties the source properties
     * @return the configuration
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static CacheConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties cannot be null");
        Builder builder = new Builder();
        PropertyReader reader = new PropertyReader(properties);

        reader.millis("tickInterval", v -> builder.tickInterval(v, TimeUnit.MILLISECONDS));
        reader.millis("minTickInterval", v -> builder.minTickInterval(v, TimeUnit.MILLISECONDS));
        reader.millis("maxTickInterval", v -> builder.maxTickInterval(v, TimeUnit.MILLISECONDS));
        reader.bool("adaptiveScheduling", builder::adaptiveScheduling);
        reader.integer("queueSizeThreshold", builder::queueSizeThreshold);
        reader.integer("idleTicksBeforeSpeedup", builder::idleTicksBeforeSpeedup);
        reader.millis("ttlFile", v -> builder.ttlFile(v, TimeUnit.MILLISECONDS));
        reader.millis("ttlDirectory", v -> builder.ttlDirectory(v, TimeUnit.MILLISECONDS));
        reader.integer("maxBatchPerTick", builder::maxBatchPerTick);
        reader.integer("maxConcurrentJobs", builder::maxConcurrentJobs);
        reader.integer("maxQueueSize", builder::maxQueueSize);
        reader.longValue("maxEntries", builder::maxEntries);
        reader.longValue("maxFileSizeBytes", builder::maxFileSizeBytes);
        reader.integer("oversizedSampleBytes", builder::oversizedSampleBytes);
        reader.millis("debounceWindow", v -> builder.debounceWindow(v, TimeUnit.MILLISECONDS));
        reader.millis("notificationBatchWindow", v -> builder.notificationBatchWindow(v, TimeUnit.MILLISECONDS));
        reader.millis("computeTimeout", v -> builder.computeTimeout(v, TimeUnit.MILLISECONDS));
        reader.string("placeholderText", builder::placeholderText);
        reader.string("encodingHint", builder::encodingHint);
        reader.list("allowedExtensions", builder::allowedExtensions);
        reader.list("ignorePatterns", builder::ignorePatterns);
        reader.bool("fileCachingEnabled", builder::fileCachingEnabled);
        reader.bool("directoryCachingEnabled", builder::directoryCachingEnabled);

        return builder.build();
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public Duration getMinTickInterval() {
        return minTickInterval;
    }

    public Duration getMaxTickInterval() {
        return maxTickInterval;
    }

    public boolean isAdaptiveScheduling() {
        return adaptiveScheduling;
    }

    public int getQueueSizeThreshold() {
        return queueSizeThreshold;
    }

    public int getIdleTicksBeforeSpeedup() {
        return idleTicksBeforeSpeedup;
    }

    public Duration getTtlFile() {
        return ttlFile;
    }

    public Duration getTtlDirectory() {
        return ttlDirectory;
    }

    public int getMaxBatchPerTick() {
        return maxBatchPerTick;
    }

    public int getMaxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    public long getMaxEntries() {
        return maxEntries;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public int getOversizedSampleBytes() {
        return oversizedSampleBytes;
    }

    public Duration getDebounceWindow() {
        return debounceWindow;
    }

    public Duration getNotificationBatchWindow() {
        return notificationBatchWindow;
    }

    public Duration getComputeTimeout() {
        return computeTimeout;
    }

    public String getPlaceholderText() {
        return placeholderText;
    }

    public String getEncodingHint() {
        return encodingHint;
    }

    /**
     * Returns the allowed extensions, lower case and without the leading dot.
     */
    public Set<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public List<String> getIgnorePatterns() {
        return ignorePatterns;
    }

    public boolean isFileCachingEnabled() {
        return fileCachingEnabled;
    }

    public boolean isDirectoryCachingEnabled() {
        return directoryCachingEnabled;
    }

    /**
     * Builder for {@link CacheConfig}. Every setter validates its argument and throws
     * {@link IllegalArgumentException} on out-of-range values.
     */
    public static class Builder {
        private long tickIntervalNanos = TimeUnit.SECONDS.toNanos(2);
        private long minTickIntervalNanos = TimeUnit.SECONDS.toNanos(1);
        private long maxTickIntervalNanos = TimeUnit.SECONDS.toNanos(10);
        private boolean adaptiveScheduling = true;
        private int queueSizeThreshold = 20;
        private int idleTicksBeforeSpeedup = 3;
        private long ttlFileNanos = TimeUnit.MINUTES.toNanos(5);
        private long ttlDirectoryNanos = TimeUnit.MINUTES.toNanos(10);
        private int maxBatchPerTick = 10;
        private int maxConcurrentJobs = 3;
        private int maxQueueSize = 50;
        private long maxEntries = 10_000;
        private long maxFileSizeBytes = 512 * 1024;
        private int oversizedSampleBytes = 1024;
        private long debounceWindowNanos = TimeUnit.MILLISECONDS.toNanos(100);
        private long notificationBatchWindowNanos = TimeUnit.SECONDS.toNanos(1);
        private long computeTimeoutNanos = TimeUnit.SECONDS.toNanos(30);
        private String placeholderText = "⋯";
        private String encodingHint = "cl100k_base";
        private Set<String> allowedExtensions = new LinkedHashSet<>(DEFAULT_EXTENSIONS);
        private List<String> ignorePatterns = DEFAULT_IGNORE_PATTERNS;
        private boolean fileCachingEnabled = true;
        private boolean directoryCachingEnabled = true;

        private Builder() {
        }

        /**
         * Sets the base period of the background scheduler. Ticks closer together than this after
         * a drain are skipped. Default: 2 seconds.
         */
        public Builder tickInterval(long duration, TimeUnit unit) {
            this.tickIntervalNanos = positive(duration, unit, "tick interval");
            return this;
        }

        /**
         * Sets the floor the adaptive scheduler never speeds up past. A tick interval below this
         * floor is used as is. Default: 1 second.
         */
        public Builder minTickInterval(long duration, TimeUnit unit) {
            this.minTickIntervalNanos = positive(duration, unit, "minimum tick interval");
            return this;
        }

        /**
         * Sets the ceiling the adaptive scheduler never goes above when the queue is long.
         * Default: 10 seconds.
         */
        public Builder maxTickInterval(long duration, TimeUnit unit) {
            this.maxTickIntervalNanos = positive(duration, unit, "maximum tick interval");
            return this;
        }

        /**
         * Enables or disables adaptive tick intervals. Default: true.
         */
        public Builder adaptiveScheduling(boolean enabled) {
            this.adaptiveScheduling = enabled;
            return this;
        }

        /**
         * Sets the queue length above which the adaptive scheduler slows down. Default: 20.
         */
        public Builder queueSizeThreshold(int threshold) {
            if (threshold < 0) {
                throw new IllegalArgumentException("queue size threshold must not be negative");
            }
            this.queueSizeThreshold = threshold;
            return this;
        }

        /**
         * Sets how many consecutive empty ticks make the adaptive scheduler speed up. Default: 3.
         */
        public Builder idleTicksBeforeSpeedup(int ticks) {
            if (ticks < 0) {
                throw new IllegalArgumentException("idle ticks must not be negative");
            }
            this.idleTicksBeforeSpeedup = ticks;
            return this;
        }

        /**
         * Sets how long file entries stay fresh. Default: 5 minutes.
         */
        public Builder ttlFile(long duration, TimeUnit unit) {
            this.ttlFileNanos = positive(duration, unit, "file TTL");
            return this;
        }

        /**
         * Sets how long directory entries stay fresh. Default: 10 minutes.
         */
        public Builder ttlDirectory(long duration, TimeUnit unit) {
            this.ttlDirectoryNanos = positive(duration, unit, "directory TTL");
            return this;
        }

        /**
         * Sets the maximum number of keys taken from the queue per tick. Default: 10.
         */
        public Builder maxBatchPerTick(int max) {
            if (max <= 0) {
                throw new IllegalArgumentException("max batch per tick must be positive");
            }
            this.maxBatchPerTick = max;
            return this;
        }

        /**
         * Sets the maximum number of keys processed at the same time. Default: 3.
         */
        public Builder maxConcurrentJobs(int max) {
            if (max <= 0) {
                throw new IllegalArgumentException("max concurrent jobs must be positive");
            }
            this.maxConcurrentJobs = max;
            return this;
        }

        /**
         * Sets the queue length beyond which background enqueues are dropped. Priority requests
         * are always accepted. Default: 50.
         */
        public Builder maxQueueSize(int max) {
            if (max <= 0) {
                throw new IllegalArgumentException("max queue size must be positive");
            }
            this.maxQueueSize = max;
            return this;
        }

        /**
         * Sets the number of entries above which a sweep evicts the oldest ones. Default: 10,000.
         */
        public Builder maxEntries(long max) {
            if (max <= 0) {
                throw new IllegalArgumentException("max entries must be positive");
            }
            this.maxEntries = max;
            return this;
        }

        /**
         * Sets the size ceiling above which files are estimated from a sample instead of counted.
         * Default: 512 KiB.
         */
        public Builder maxFileSizeBytes(long bytes) {
            if (bytes <= 0) {
                throw new IllegalArgumentException("max file size must be positive");
            }
            this.maxFileSizeBytes = bytes;
            return this;
        }

        /**
         * Sets how many leading bytes of an oversized file are sampled. Default: 1024.
         */
        public Builder oversizedSampleBytes(int bytes) {
            if (bytes <= 0) {
                throw new IllegalArgumentException("oversized sample size must be positive");
            }
            this.oversizedSampleBytes = bytes;
            return this;
        }

        /**
         * Sets the window that coalesces repeated immediate requests for one key. Default: 100 ms.
         */
        public Builder debounceWindow(long duration, TimeUnit unit) {
            this.debounceWindowNanos = positive(duration, unit, "debounce window");
            return this;
        }

        /**
         * Sets the window over which update notifications are batched. Default: 1 second.
         */
        public Builder notificationBatchWindow(long duration, TimeUnit unit) {
            this.notificationBatchWindowNanos = positive(duration, unit, "notification batch window");
            return this;
        }

        /**
         * Sets how long the count function may take before the estimate is used. Default: 30 seconds.
         */
        public Builder computeTimeout(long duration, TimeUnit unit) {
            this.computeTimeoutNanos = positive(duration, unit, "compute timeout");
            return this;
        }

        /**
         * Sets the text shown while a count is computed. Default: {@code ⋯}.
         */
        public Builder placeholderText(String text) {
            this.placeholderText = Objects.requireNonNull(text, "placeholder text cannot be null");
            return this;
        }

        /**
         * Sets the encoding name passed to the count function. Default: {@code cl100k_base}.
         */
        public Builder encodingHint(String encoding) {
            this.encodingHint = Objects.requireNonNull(encoding, "encoding hint cannot be null");
            return this;
        }

        /**
         * Replaces the extension allow-list. Leading dots are stripped and case is ignored.
         */
        public Builder allowedExtensions(Collection<String> extensions) {
            Objects.requireNonNull(extensions, "extensions cannot be null");
            this.allowedExtensions = extensions.stream()
                    .map(String::trim)
                    .map(e -> e.startsWith(".") ? e.substring(1) : e)
                    .filter(e -> !e.isEmpty())
                    .map(e -> e.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            return this;
        }

        /**
         * Replaces the ignore list. Patterns use {@link java.nio.file.FileSystem#getPathMatcher}
         * glob syntax and are matched against the absolute path.
         */
        public Builder ignorePatterns(Collection<String> patterns) {
            Objects.requireNonNull(patterns, "patterns cannot be null");
            this.ignorePatterns = patterns.stream()
                    .map(String::trim)
                    .filter(p -> !p.isEmpty())
                    .collect(Collectors.toList());
            return this;
        }

        /**
         * Enables or disables counting of files requested through lookups. Default: true.
         */
        public Builder fileCachingEnabled(boolean enabled) {
            this.fileCachingEnabled = enabled;
            return this;
        }

        /**
         * Enables or disables aggregation of directories requested through lookups. Default: true.
         */
        public Builder directoryCachingEnabled(boolean enabled) {
            this.directoryCachingEnabled = enabled;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws IllegalArgumentException if the minimum tick interval exceeds the maximum
         */
        public CacheConfig build() {
            if (minTickIntervalNanos > maxTickIntervalNanos) {
                throw new IllegalArgumentException("minimum tick interval must not exceed maximum tick interval");
            }
            return new CacheConfig(this);
        }

        private static long positive(long duration, TimeUnit unit, String name) {
            Objects.requireNonNull(unit, "unit cannot be null");
            if (duration <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return unit.toNanos(duration);
        }
    }

    @Override
    public String toString() {
        return "CacheConfig{"
                + "tickInterval=" + tickInterval
                + ", ttlFile=" + ttlFile
                + ", ttlDirectory=" + ttlDirectory
                + ", maxBatchPerTick=" + maxBatchPerTick
                + ", maxConcurrentJobs=" + maxConcurrentJobs
                + ", maxQueueSize=" + maxQueueSize
                + ", maxFileSizeBytes=" + maxFileSizeBytes
                + ", debounceWindow=" + debounceWindow
                + ", notificationBatchWindow=" + notificationBatchWindow
                + ", adaptiveScheduling=" + adaptiveScheduling
                + '}';
    }
}
