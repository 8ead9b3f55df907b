package io.hearth.core.profile;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The one place that decides whether a value carries data. Models tend to fill unknown fields with
 * tokens such as {@code "null"} or {@code "N/A"}; those count as absent everywhere.
 */
public final class Placeholders {
    private static final Set<String> SENTINELS = Set.of(
        "null",
        ":null",
        "undefined",
        "/",
        ".",
        "-",
        "n/a",
        "na",
        "none",
        "unknown",
        "not specified",
        "not provided"
    );

    private Placeholders() {
    }

    public static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String text) {
            return isPresentText(text);
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().anyMatch(Placeholders::isPresent);
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                .anyMatch(entry -> isPresent(entry.getKey()) && isPresent(entry.getValue()));
        }
        if (value instanceof Double number) {
            return !number.isNaN() && !number.isInfinite();
        }
        if (value instanceof Float number) {
            return !number.isNaN() && !number.isInfinite();
        }
        return true;
    }

    public static boolean isPlaceholder(Object value) {
        return !isPresent(value);
    }

    private static boolean isPresentText(String text) {
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return false;
        }
        return !SENTINELS.contains(normalized) && !normalized.contains(",null");
    }
}
