package com.github.rudygunawan.tokencache.model;

import java.util.Objects;

/**
 * An immutable token count together with its display text.
 *
 * <p>The display text is derived once, at construction, so the two can never disagree. Summing
 * counts goes through {@link #plus(TokenCount)}, which keeps the raw numbers and never round-trips
 * through the abbreviated text.
 *
 * @since 1.0.0
 */
public final class TokenCount {

    /**
     * Exact zero, used for empty files and empty directories.
     */
    public static final TokenCount ZERO = new TokenCount(0, EntryStatus.READY);

    private final long value;
    private final EntryStatus status;
    private final String displayText;

    private TokenCount(long value, EntryStatus status) {
        if (value < 0) {
            throw new IllegalArgumentException("token count must not be negative: " + value);
        }
        if (status == EntryStatus.PROCESSING) {
            throw new IllegalArgumentException("a computed count cannot have status " + status);
        }
        this.value = value;
        this.status = status;
        this.displayText = CountFormatter.format(value, status);
    }

    public static TokenCount exact(long value) {
        return value == 0 ? ZERO : new TokenCount(value, EntryStatus.READY);
    }

    public static TokenCount estimated(long value) {
        return new TokenCount(value, EntryStatus.ESTIMATED);
    }

    public static TokenCount oversized(long value) {
        return new TokenCount(value, EntryStatus.OVERSIZED);
    }

    public static TokenCount of(long value, EntryStatus status) {
        return status == EntryStatus.READY ? exact(value) : new TokenCount(value, status);
    }

    public long getValue() {
        return value;
    }

    public EntryStatus getStatus() {
        return status;
    }

    public String getDisplayText() {
        return displayText;
    }

    /**
     * Returns the sum of both counts. The result is exact only if both operands are exact;
     * otherwise it is marked {@link EntryStatus#ESTIMATED}.
     */
    public TokenCount plus(TokenCount other) {
        Objects.requireNonNull(other, "other cannot be null");
        long sum = Math.addExact(value, other.value);
        boolean exact = status == EntryStatus.READY && other.status == EntryStatus.READY;
        return exact ? exact(sum) : estimated(sum);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof TokenCount)) {
            return false;
        }
        TokenCount other = (TokenCount) obj;
        return value == other.value && status == other.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, status);
    }

    @Override
    public String toString() {
        return displayText;
    }
}
