package com.github.rudygunawan.tokencache.api;

/**
 * Tells the cache whether a path is in interactive use by the host (open and visible, focused).
 * Active paths are counted even when they exceed the configured size ceiling.
 */
@FunctionalInterface
public interface ActivePredicate {

    /**
     * Returns {@code true} if {@code key} is currently in interactive use.
     *
     * @param key the absolute path
     */
    boolean isActive(String key);

    /**
     * Returns a predicate that treats no path as active.
     */
    static ActivePredicate none() {
        return key -> false;
    }
}
