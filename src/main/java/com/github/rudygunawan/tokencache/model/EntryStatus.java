package com.github.rudygunawan.tokencache.model;

/**
 * How the value of a {@link CountEntry} was obtained.
 *
 * @since 1.0.0
 */
public enum EntryStatus {
    /**
     * The value came from the external count function.
     */
    READY(""),

    /**
     * The count function failed or was unavailable and a local heuristic was used instead.
     */
    ESTIMATED("~"),

    /**
     * The file exceeded the size ceiling; the value was extrapolated from a small sample.
     */
    OVERSIZED("*"),

    /**
     * Placeholder handed out while the value is being computed. Never stored in the cache.
     */
    PROCESSING("");

    private final String marker;

    EntryStatus(String marker) {
        this.marker = marker;
    }

    /**
     * Returns the suffix appended to the display text of values with this status.
     */
    public String marker() {
        return marker;
    }

    /**
     * Returns {@code true} if values with this status are approximations.
     */
    public boolean isApproximate() {
        return this == ESTIMATED || this == OVERSIZED;
    }
}
