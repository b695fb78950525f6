package com.github.rudygunawan.tokencache.api;

import java.util.concurrent.CompletionStage;

/**
 * The external token counter. Typically backed by a tokenizer library or a remote API.
 *
 * <p>The cache treats this function as untrusted: it may be slow, it may fail, it may throw
 * instead of returning a failed stage, and it may return {@code null} or a negative number. All of
 * these make the cache fall back to a local estimate rather than surface an error.
 *
 * <p>Usage example:
 * <pre>{@code
 * CountFunction fn = (content, encoding) -> CompletableFuture.supplyAsync(
 *     () -> (long) tokenizer.encode(new String(content, UTF_8), encoding).size(), pool);
 * }</pre>
 */
@FunctionalInterface
public interface CountFunction {

    /**
     * Counts the tokens in {@code content}.
     *
     * @param content the raw file content, never empty
     * @param encodingHint the tokenizer encoding name from the cache configuration
     * @return a stage completing with the token count
     */
    CompletionStage<Long> compute(byte[] content, String encodingHint);
}
