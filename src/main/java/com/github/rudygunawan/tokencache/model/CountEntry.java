package com.github.rudygunawan.tokencache.model;

import java.util.Objects;

/**
 * Cached token count for one file or directory.
 *
 * <p>Entries are immutable; the cache replaces them wholesale, so a reader always sees a value and
 * display text that belong together. A {@link EntryStatus#PROCESSING} entry is a placeholder with
 * no count and is only ever returned to callers, never stored.
 *
 * @since 1.0.0
 */
public final class CountEntry {

    private final String key;
    private final EntryKind kind;
    private final EntryStatus status;
    private final TokenCount count;
    private final String displayText;
    private final long computedAt;

    private CountEntry(String key, EntryKind kind, EntryStatus status, TokenCount count,
                       String displayText, long computedAt) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.status = status;
        this.count = count;
        this.displayText = displayText;
        this.computedAt = computedAt;
    }

    /**
     * Creates an entry holding a computed count.
     *
     * @param key the absolute path
     * @param kind file or directory
     * @param count the count; its status becomes the entry status
     * @param computedAt ticker reading at the time of the write
     */
    public static CountEntry of(String key, EntryKind kind, TokenCount count, long computedAt) {
        Objects.requireNonNull(count, "count cannot be null");
        return new CountEntry(key, kind, count.getStatus(), count, count.getDisplayText(), computedAt);
    }

    /**
     * Creates a placeholder for a key whose count is still being computed.
     */
    public static CountEntry placeholder(String key, EntryKind kind, String placeholderText, long now) {
        return new CountEntry(key, kind, EntryStatus.PROCESSING, null, placeholderText, now);
    }

    public String getKey() {
        return key;
    }

    public EntryKind getKind() {
        return kind;
    }

    public EntryStatus getStatus() {
        return status;
    }

    /**
     * Returns the count, or {@code null} for a placeholder.
     */
    public TokenCount getCount() {
        return count;
    }

    /**
     * Returns the raw count, or {@code null} for a placeholder.
     */
    public Long getValue() {
        return count == null ? null : count.getValue();
    }

    public boolean hasValue() {
        return count != null;
    }

    public String getDisplayText() {
        return displayText;
    }

    /**
     * Returns the ticker reading (nanoseconds) at which this entry was written.
     */
    public long getComputedAt() {
        return computedAt;
    }

    /**
     * Returns the age of this entry relative to {@code now}, in nanoseconds.
     */
    public long ageNanos(long now) {
        return now - computedAt;
    }

    @Override
    public String toString() {
        return "CountEntry{"
                + "key=" + key
                + ", kind=" + kind
                + ", status=" + status
                + ", displayText=" + displayText
                + ", computedAt=" + computedAt
                + '}';
    }
}
