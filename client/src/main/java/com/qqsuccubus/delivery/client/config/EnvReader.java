package com.qqsuccubus.delivery.client.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reads typed values from an environment map with defaults.
 * <p>
 * Keys are upper-cased, per-client names become {@code <PREFIX>_<NAME>_<FIELD>} with
 * non-alphanumerics replaced by underscores.
 * </p>
 */
final class EnvReader {
    private final Map<String, String> env;

    EnvReader(Map<String, String> env) {
        this.env = env;
    }

    String get(String key, String defaultValue) {
        String value = env.get(key);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    int getInt(String key, int defaultValue) {
        return parse(key, defaultValue, Integer::parseInt);
    }

    boolean getBoolean(String key, boolean defaultValue) {
        return parse(key, defaultValue, Boolean::parseBoolean);
    }

    Duration getMillis(String key, Duration defaultValue) {
        return parse(key, defaultValue, raw -> Duration.ofMillis(Long.parseLong(raw)));
    }

    List<String> getList(String key) {
        String value = get(key, "");
        if (value.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }

    static String key(String prefix, String name, String field) {
        String normalizedName = name.replaceAll("[^A-Za-z0-9]", "_").toUpperCase(Locale.ROOT);
        return prefix + "_" + normalizedName + "_" + field;
    }

    private <T> T parse(String key, T defaultValue, Function<String, T> parser) {
        String raw = get(key, null);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return parser.apply(raw);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, e);
        }
    }
}
