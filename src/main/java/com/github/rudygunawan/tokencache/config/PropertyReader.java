package com.github.rudygunawan.tokencache.config;

import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;
import java.util.stream.Collectors;

/**
 * Typed access to {@code token-cache.*} properties. Absent keys are skipped so builder defaults
 * survive; malformed values raise {@link IllegalArgumentException} naming the key.
 */
final class PropertyReader {

    private final Properties properties;

    PropertyReader(Properties properties) {
        this.properties = properties;
    }

    void millis(String name, LongConsumer target) {
        longValue(name, target);
    }

    void longValue(String name, LongConsumer target) {
        String raw = raw(name);
        if (raw != null) {
            try {
                target.accept(Long.parseLong(raw));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid number for " + key(name) + ": " + raw, e);
            }
        }
    }

    void integer(String name, IntConsumer target) {
        String raw = raw(name);
        if (raw != null) {
            try {
                target.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid number for " + key(name) + ": " + raw, e);
            }
        }
    }

    void bool(String name, Consumer<Boolean> target) {
        String raw = raw(name);
        if (raw == null) {
            return;
        }
        if (!"true".equalsIgnoreCase(raw) && !"false".equalsIgnoreCase(raw)) {
            throw new IllegalArgumentException("invalid boolean for " + key(name) + ": " + raw);
        }
        target.accept(Boolean.parseBoolean(raw));
    }

    void string(String name, Consumer<String> target) {
        String value = properties.getProperty(key(name));
        if (value != null) {
            target.accept(value);
        }
    }

    void list(String name, Consumer<List<String>> target) {
        String raw = raw(name);
        if (raw != null) {
            target.accept(Arrays.stream(raw.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toList()));
        }
    }

    private String raw(String name) {
        String value = properties.getProperty(key(name));
        return value == null ? null : value.trim();
    }

    private static String key(String name) {
        return CacheConfig.PROPERTY_PREFIX + name;
    }
}
