package com.github.rudygunawan.tokencache.model;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders token counts as short display strings and reads them back.
 *
 * <p>Formatting thresholds:
 * <ul>
 *   <li>below 1,000: the plain number ({@code 999})</li>
 *   <li>below 9,950: one decimal with a {@code k} suffix ({@code 1234 -> "1.2k"})</li>
 *   <li>below 1,000,000: whole thousands ({@code 45678 -> "45k"})</li>
 *   <li>below 9,950,000: one decimal with an {@code M} suffix ({@code 2500000 -> "2.5M"})</li>
 *   <li>otherwise whole millions ({@code 12000000 -> "12M"})</li>
 * </ul>
 *
 * <p>Approximate values carry the marker of their {@link EntryStatus}: {@code ~} for estimates and
 * {@code *} for oversized extrapolations.
 *
 * <p>{@link #parse(String)} exists for callers that only hold display strings. Code that has a
 * {@link TokenCount} should sum {@link TokenCount#getValue()} instead; parsing is lossy.
 */
public final class CountFormatter {

    /**
     * Value returned by {@link #parse(String)} for the legacy {@code "LARGE"} marker.
     */
    public static final long LARGE_SENTINEL = 999_999L;

    /**
     * Legacy display text for files too big to count.
     */
    public static final String LARGE_TEXT = "LARGE";

    private static final Pattern SUFFIXED = Pattern.compile("^(\\d+(?:\\.\\d+)?)([kM]?)$");

    private CountFormatter() {
    }

    /**
     * Formats an exact count.
     *
     * @param count the count, must not be negative
     * @return the display text
     */
    public static String format(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        if (count < 1_000L) {
            return Long.toString(count);
        }
        // Decimal bands end where one decimal would round up to 10.0
        if (count < 9_950L) {
            return String.format(Locale.ROOT, "%.1fk", count / 1_000.0);
        }
        if (count < 1_000_000L) {
            return Math.max(10L, count / 1_000L) + "k";
        }
        if (count < 9_950_000L) {
            return String.format(Locale.ROOT, "%.1fM", count / 1_000_000.0);
        }
        return Math.max(10L, count / 1_000_000L) + "M";
    }

    /**
     * Formats a count and appends the marker of {@code status}.
     */
    public static String format(long count, EntryStatus status) {
        return format(count) + status.marker();
    }

    /**
     * Parses a display string back to an approximate count.
     *
     * <p>{@code "LARGE"} yields {@link #LARGE_SENTINEL}. Estimate ({@code ~}) and oversized
     * ({@code *}) markers are stripped before parsing. Placeholders, blanks and anything else
     * unrecognised yield an empty result rather than an exception.
     *
     * @param text the display text, may be {@code null}
     * @return the approximate count, or empty if {@code text} is not a count
     */
    public static OptionalLong parse(String text) {
        if (text == null) {
            return OptionalLong.empty();
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return OptionalLong.empty();
        }
        if (LARGE_TEXT.equals(trimmed)) {
            return OptionalLong.of(LARGE_SENTINEL);
        }
        if (trimmed.endsWith(EntryStatus.ESTIMATED.marker()) || trimmed.endsWith(EntryStatus.OVERSIZED.marker())) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }

        Matcher matcher = SUFFIXED.matcher(trimmed);
        if (!matcher.matches()) {
            return OptionalLong.empty();
        }
        BigDecimal number = new BigDecimal(matcher.group(1));
        switch (matcher.group(2)) {
            case "k":
                number = number.movePointRight(3);
                break;
            case "M":
                number = number.movePointRight(6);
                break;
            default:
                break;
        }
        try {
            return OptionalLong.of(number.toBigInteger().longValueExact());
        } catch (ArithmeticException e) {
            // too large for a long
            return OptionalLong.empty();
        }
    }
}
