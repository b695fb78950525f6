package com.github.rudygunawan.tokencache.model;

import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class CountFormatterTest {

    @Test
    void testSmallCountsArePlain() {
        assertEquals("0", CountFormatter.format(0));
        assertEquals("42", CountFormatter.format(42));
        assertEquals("999", CountFormatter.format(999));
    }

    @Test
    void testThousands() {
        assertEquals("1.0k", CountFormatter.format(1000));
        assertEquals("1.2k", CountFormatter.format(1234));
        assertEquals("45k", CountFormatter.format(45_678));
        assertEquals("999k", CountFormatter.format(999_999));
    }

    @Test
    void testMillions() {
        assertEquals("2.5M", CountFormatter.format(2_500_000));
        assertEquals("12M", CountFormatter.format(12_345_678));
    }

    @Test
    void testBandEdgesDoNotRoundPastBand() {
        assertEquals("9.9k", CountFormatter.format(9_949));
        assertEquals("10k", CountFormatter.format(9_950));
        assertEquals("10k", CountFormatter.format(9_999));
        assertEquals("10k", CountFormatter.format(10_000));
        assertEquals("9.9M", CountFormatter.format(9_949_999));
        assertEquals("10M", CountFormatter.format(9_999_999));
        assertEquals("10M", CountFormatter.format(10_000_000));
    }

    @Test
    void testParseOverflowIsEmpty() {
        assertFalse(CountFormatter.parse("99999999999999999999").isPresent());
        assertFalse(CountFormatter.parse("99999999999999M").isPresent());
        assertEquals(OptionalLong.of(1234), CountFormatter.parse("1.2345k"));
    }

    @Test
    void testMarkers() {
        assertEquals("1.2k~", CountFormatter.format(1234, EntryStatus.ESTIMATED));
        assertEquals("300*", CountFormatter.format(300, EntryStatus.OVERSIZED));
        assertEquals("300", CountFormatter.format(300, EntryStatus.READY));
    }

    @Test
    void testNegativeRejected() {
        assertThrows(IllegalArgumentException.class, () -> CountFormatter.format(-1));
    }

    @Test
    void testParseDisplayStrings() {
        assertEquals(OptionalLong.of(1200), CountFormatter.parse("1.2k"));
        assertEquals(OptionalLong.of(1200), CountFormatter.parse("1.2k~"));
        assertEquals(OptionalLong.of(45_000), CountFormatter.parse("45k*"));
        assertEquals(OptionalLong.of(2_500_000), CountFormatter.parse("2.5M"));
        assertEquals(OptionalLong.of(731), CountFormatter.parse(" 731 "));
    }

    @Test
    void testParseLargeSentinel() {
        assertEquals(OptionalLong.of(CountFormatter.LARGE_SENTINEL), CountFormatter.parse("LARGE"));
        assertEquals(999_999L, CountFormatter.LARGE_SENTINEL);
    }

    @Test
    void testParseRejectsPlaceholdersAndGarbage() {
        assertFalse(CountFormatter.parse(null).isPresent());
        assertFalse(CountFormatter.parse("").isPresent());
        assertFalse(CountFormatter.parse("⋯").isPresent());
        assertFalse(CountFormatter.parse("abc").isPresent());
        assertFalse(CountFormatter.parse("1.2x").isPresent());
        assertFalse(CountFormatter.parse("-5").isPresent());
    }

    @Test
    void testFormattedValuesParseBackClose() {
        long[] samples = {7, 1234, 56_789, 3_456_789, 45_000_000};
        for (long sample : samples) {
            long parsed = CountFormatter.parse(CountFormatter.format(sample)).getAsLong();
            double error = Math.abs(parsed - sample) / (double) sample;
            assertTrue(error < 0.05, sample + " parsed back as " + parsed);
        }
    }
}
