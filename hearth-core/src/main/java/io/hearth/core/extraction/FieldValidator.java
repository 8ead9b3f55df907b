package io.hearth.core.extraction;

import io.hearth.core.profile.FieldDescriptor;
import io.hearth.core.profile.Placeholders;
import io.hearth.core.profile.ProfileData;
import io.hearth.core.profile.ProfileSchema;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Domain rules for individual profile fields. Pure; rejections carry a human-readable reason.
 */
public final class FieldValidator {
    private static final Pattern URL_PATTERN = Pattern.compile("^https?://.+", Pattern.CASE_INSENSITIVE);
    // Leading number of the digits-and-dots residue; trailing sentence periods are ignored.
    private static final Pattern LEADING_NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?|\\.\\d+");
    private static final BigDecimal MIN_RATE = BigDecimal.valueOf(10);
    private static final BigDecimal MAX_RATE = BigDecimal.valueOf(200);

    public ValidationResult validate(String fieldName, Object value) {
        Optional<FieldDescriptor> descriptor = ProfileSchema.find(fieldName);
        if (descriptor.isEmpty()) {
            return ValidationResult.rejected("Unknown profile field: " + fieldName);
        }
        if (Placeholders.isPlaceholder(value)) {
            return ValidationResult.rejected(fieldName + " has no value");
        }

        FieldDescriptor field = descriptor.get();
        ValidationResult typed = checkKind(field, value);
        if (!typed.valid()) {
            return typed;
        }

        return switch (fieldName) {
            case "location" -> validateLocation((String) typed.value());
            case "languages" -> validateNonEmptyList(fieldName, typed.value(), "At least one language is required");
            case "careTypes" -> validateNonEmptyList(fieldName, typed.value(), "At least one care type is required");
            case "hourlyRate" -> validateHourlyRate((String) typed.value());
            case "profilePictureUrl" -> validatePictureUrl((String) typed.value());
            case "yearsOfExperience" -> validateExperience(typed.value());
            default -> typed;
        };
    }

    public ValidationReport validateAll(ProfileData data) {
        Map<String, Object> accepted = new LinkedHashMap<>();
        Map<String, String> rejections = new LinkedHashMap<>();
        if (data != null) {
            data.asMap().forEach((name, value) -> {
                ValidationResult result = validate(name, value);
                if (result.valid()) {
                    accepted.put(name, result.value());
                } else {
                    rejections.put(name, result.reason());
                }
            });
        }
        return new ValidationReport(ProfileData.of(accepted), rejections);
    }

    public ValidationResult validateLocation(String location) {
        if (location == null || location.trim().length() < 2) {
            return ValidationResult.rejected("Location must be at least 2 characters");
        }
        return ValidationResult.valid(location.trim());
    }

    public ValidationResult validateHourlyRate(String rate) {
        String cleaned = rate == null ? "" : rate.replaceAll("[^0-9.]", "");
        Matcher number = LEADING_NUMBER.matcher(cleaned);
        if (!number.lookingAt()) {
            return ValidationResult.rejected("Hourly rate must be a positive number");
        }
        BigDecimal numeric = new BigDecimal(number.group());
        if (numeric.signum() <= 0) {
            return ValidationResult.rejected("Hourly rate must be a positive number");
        }
        if (numeric.compareTo(MIN_RATE) < 0 || numeric.compareTo(MAX_RATE) > 0) {
            return ValidationResult.rejected("Hourly rate must be between $10 and $200");
        }
        return ValidationResult.valid("$" + numeric.stripTrailingZeros().toPlainString() + "/hour");
    }

    private ValidationResult validatePictureUrl(String url) {
        if (!URL_PATTERN.matcher(url.trim()).matches()) {
            return ValidationResult.rejected("Profile picture URL must be a valid HTTP(S) URL");
        }
        return ValidationResult.valid(url.trim());
    }

    private ValidationResult validateNonEmptyList(String fieldName, Object value, String message) {
        List<String> kept = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (Placeholders.isPresent(item)) {
                kept.add(((String) item).trim());
            }
        }
        if (kept.isEmpty()) {
            return ValidationResult.rejected(message);
        }
        return ValidationResult.valid(List.copyOf(kept));
    }

    private ValidationResult validateExperience(Object value) {
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            double years = ((Number) entry.getValue()).doubleValue();
            if (Double.isNaN(years) || Double.isInfinite(years) || years < 0) {
                return ValidationResult.rejected("yearsOfExperience for " + entry.getKey() + " must be zero or more years");
            }
        }
        return ValidationResult.valid(value);
    }

    private ValidationResult checkKind(FieldDescriptor field, Object value) {
        return switch (field.kind()) {
            case STRING -> value instanceof String
                ? ValidationResult.valid(value)
                : ValidationResult.rejected(field.name() + " must be a string");
            case STRING_LIST -> checkStringList(field, value);
            case NUMBER_MAP -> checkNumberMap(field, value);
        };
    }

    private ValidationResult checkStringList(FieldDescriptor field, Object value) {
        if (!(value instanceof List<?> list)) {
            return ValidationResult.rejected(field.name() + " must be an array");
        }
        for (Object item : list) {
            if (item != null && !(item instanceof String)) {
                return ValidationResult.rejected(field.name() + " must only contain strings");
            }
        }
        return ValidationResult.valid(value);
    }

    private ValidationResult checkNumberMap(FieldDescriptor field, Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return ValidationResult.rejected(field.name() + " must be an object");
        }
        for (Object entry : map.values()) {
            if (!(entry instanceof Number)) {
                return ValidationResult.rejected(field.name() + " values must be numbers");
            }
        }
        return ValidationResult.valid(value);
    }
}
