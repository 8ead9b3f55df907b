package io.hearth.core.extraction;

/**
 * Outcome of validating one field value. A rejection is an expected result, not a fault.
 */
public record ValidationResult(boolean valid, Object value, String reason) {

    public static ValidationResult valid(Object value) {
        return new ValidationResult(true, value, "");
    }

    public static ValidationResult rejected(String reason) {
        return new ValidationResult(false, null, reason == null ? "invalid value" : reason);
    }
}
