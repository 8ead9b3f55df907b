package io.hearth.core.provider;

import java.util.Locale;

/**
 * How the model reports structured field values: through a function call, or inside a JSON reply envelope
 * of the form {@code {"message": ..., "extractedData": {...}}}.
 */
public enum ResponseMode {
    TOOLS,
    JSON;

    public static ResponseMode fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return TOOLS;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "tools", "tool", "function" -> TOOLS;
            case "json", "envelope" -> JSON;
            default -> throw new IllegalArgumentException("Unknown response mode: " + value);
        };
    }
}
