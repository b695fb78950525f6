package com.github.rudygunawan.tokencache.policy;

/**
 * Local token estimate used when the count function is unavailable, and for oversized files.
 *
 * <p>The estimate is the larger of roughly four bytes per token and 1.3 tokens per
 * whitespace-separated word. It is a heuristic with no accuracy guarantee.
 */
public final class FallbackEstimator {

    private static final int BYTES_PER_TOKEN = 4;
    private static final double TOKENS_PER_WORD = 1.3;

    private FallbackEstimator() {
    }

    /**
     * Estimates the tokens in {@code content}.
     *
     * @param content raw bytes, may be empty
     * @return the estimate, zero for empty content
     */
    public static long estimate(byte[] content) {
        if (content == null || content.length == 0) {
            return 0;
        }
        long byLength = content.length / BYTES_PER_TOKEN;
        long byWords = (long) Math.floor(countWords(content) * TOKENS_PER_WORD);
        return Math.max(byLength, byWords);
    }

    /**
     * Extrapolates a sample estimate to the whole file. The result scales linearly with
     * {@code totalBytes / sample.length}.
     *
     * @param sample the leading bytes of the file
     * @param totalBytes the full file size
     * @return the extrapolated estimate
     */
    public static long extrapolate(byte[] sample, long totalBytes) {
        if (sample == null || sample.length == 0) {
            return totalBytes / BYTES_PER_TOKEN;
        }
        double scale = (double) totalBytes / sample.length;
        return (long) Math.floor(estimate(sample) * scale);
    }

    static long countWords(byte[] content) {
        long words = 0;
        boolean inWord = false;
        for (byte b : content) {
            boolean whitespace = b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == '\f' || b == 0x0B;
            if (whitespace) {
                inWord = false;
            } else if (!inWord) {
                inWord = true;
                words++;
            }
        }
        return words;
    }
}
