package com.github.rudygunawan.tokencache.listener;

import com.github.rudygunawan.tokencache.model.EntryKind;

import java.util.List;

/**
 * A listener notified when cached token counts change.
 *
 * <p>Notifications are batched: within one batch window every listener is called once, with the
 * first update of the window. Listeners are expected to refresh their whole view rather than patch
 * the single key they were given. Listeners that want every key of the batch override
 * {@link #onBatch(List)}.
 *
 * <p>Listeners run on the cache's scheduler thread, never inside a count computation. An exception
 * thrown by one listener is logged and does not affect the others.
 *
 * <p>Usage example:
 * <pre>{@code
 * cache.subscribe((key, kind) -> fileTree.refresh());
 * }</pre>
 */
@FunctionalInterface
public interface UpdateListener {

    /**
     * Called once per batch window with the first update of the window.
     *
     * @param key the absolute path whose entry changed
     * @param kind whether the path is a file or a directory
     */
    void onCacheUpdated(String key, EntryKind kind);

    /**
     * Called once per batch window with every update recorded in the window, in arrival order.
     * The batch is never empty.
     *
     * @param events the updates of this window
     */
    default void onBatch(List<UpdateEvent> events) {
        UpdateEvent first = events.get(0);
        onCacheUpdated(first.getKey(), first.getKind());
    }
}
