package com.github.rudygunawan.tokencache.listener;

import com.github.rudygunawan.tokencache.model.EntryKind;

import java.util.Objects;

/**
 * A single "entry updated" notification waiting to be flushed.
 */
public final class UpdateEvent {

    private final String key;
    private final EntryKind kind;
    private final long timestamp;

    public UpdateEvent(String key, EntryKind kind, long timestamp) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.timestamp = timestamp;
    }

    public String getKey() {
        return key;
    }

    public EntryKind getKind() {
        return kind;
    }

    /**
     * Returns the ticker reading at which the update was recorded.
     */
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "UpdateEvent{" + key + ", " + kind + '}';
    }
}
