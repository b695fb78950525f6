package com.github.rudygunawan.tokencache.policy;

import com.github.rudygunawan.tokencache.config.CacheConfig;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Decides which paths may be counted and whether there is room to count them now.
 *
 * <p>Eligibility is driven entirely by the {@link CacheConfig}: extension allow-list, ignore globs
 * and size ceiling. Capacity combines the concurrent-job ceiling with the host's "busy" signal.
 * A governor is immutable; the cache builds a new one when its configuration is replaced.
 */
public class ResourceGovernor {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.tokencache.Governor");

    private final CacheConfig config;
    private final List<PathMatcher> ignoreMatchers;
    private final BooleanSupplier hostBusy;

    public ResourceGovernor(CacheConfig config, BooleanSupplier hostBusy) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.hostBusy = Objects.requireNonNull(hostBusy, "hostBusy cannot be null");
        this.ignoreMatchers = config.getIgnorePatterns().stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .collect(Collectors.toList());
    }

    public CacheConfig getConfig() {
        return config;
    }

    /**
     * Checks the name-only rules: non-blank key, ignore globs and extension allow-list.
     * Does not touch the filesystem.
     *
     * @param key the absolute path
     * @return {@link Eligibility#ELIGIBLE} or the first rule that failed
     */
    public Eligibility checkName(String key) {
        if (key == null || key.isBlank()) {
            return Eligibility.EMPTY_KEY;
        }
        Path path;
        try {
            path = Paths.get(key);
        } catch (InvalidPathException e) {
            return Eligibility.INVALID_PATH;
        }
        for (PathMatcher matcher : ignoreMatchers) {
            if (matcher.matches(path)) {
                return Eligibility.IGNORED;
            }
        }
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Eligibility.NO_EXTENSION;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Eligibility.NO_EXTENSION;
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (!config.getAllowedExtensions().contains(extension)) {
            return Eligibility.INVALID_EXTENSION;
        }
        return Eligibility.ELIGIBLE;
    }

    /**
     * Runs {@link #checkName(String)} and then stats the file for existence, type and size.
     *
     * @param key the absolute path
     * @return {@link Eligibility#ELIGIBLE}, {@link Eligibility#OVERSIZED} or the first rule that
     *         failed
     */
    public Eligibility check(String key) {
        Eligibility byName = checkName(key);
        if (!byName.isEligible()) {
            return byName;
        }
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(Paths.get(key), BasicFileAttributes.class);
        } catch (IOException e) {
            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer("Cannot stat " + key + ": " + e);
            }
            return Eligibility.MISSING;
        }
        if (!attributes.isRegularFile()) {
            return Eligibility.NOT_A_FILE;
        }
        if (attributes.size() > config.getMaxFileSizeBytes()) {
            return Eligibility.OVERSIZED;
        }
        return Eligibility.ELIGIBLE;
    }

    /**
     * Returns how many more jobs may start while {@code activeJobs} are running.
     */
    public int spareCapacity(int activeJobs) {
        return Math.max(0, config.getMaxConcurrentJobs() - activeJobs);
    }

    public boolean hasCapacity(int activeJobs) {
        return spareCapacity(activeJobs) > 0;
    }

    /**
     * Asks the host whether it is busy (for example the user is typing). A predicate that throws
     * counts as "not busy" so a broken host hook cannot stall the cache forever.
     */
    public boolean isHostBusy() {
        try {
            return hostBusy.getAsBoolean();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Host busy predicate threw, assuming host is idle", e);
            return false;
        }
    }
}
