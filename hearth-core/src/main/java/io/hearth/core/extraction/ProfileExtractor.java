package io.hearth.core.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hearth.core.profile.FieldDescriptor;
import io.hearth.core.profile.Placeholders;
import io.hearth.core.profile.ProfileData;
import io.hearth.core.profile.ProfileSchema;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw model payloads into profile deltas and converts profiles to and from their flattened
 * column form. Shape checks happen here; domain rules live in {@link FieldValidator}.
 */
public final class ProfileExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(ProfileExtractor.class);

    private final ObjectMapper mapper;

    public ProfileExtractor() {
        this(new ObjectMapper());
    }

    public ProfileExtractor(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ExtractionOutcome extract(Map<String, ?> rawPayload) {
        if (rawPayload == null) {
            return ExtractionOutcome.rejected("No extraction payload");
        }

        Map<String, Object> delta = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : rawPayload.entrySet()) {
            Optional<FieldDescriptor> descriptor = ProfileSchema.find(entry.getKey());
            if (descriptor.isEmpty()) {
                LOG.debug("Ignoring unknown extracted field {}", entry.getKey());
                continue;
            }
            if (Placeholders.isPlaceholder(entry.getValue())) {
                continue;
            }

            FieldDescriptor field = descriptor.get();
            Object value = entry.getValue();
            Object shaped;
            switch (field.kind()) {
                case STRING -> {
                    if (!(value instanceof String text)) {
                        return ExtractionOutcome.rejected(field.name() + " must be a string");
                    }
                    shaped = text.trim();
                }
                case STRING_LIST -> {
                    if (!(value instanceof List<?> list)) {
                        return ExtractionOutcome.rejected(field.name() + " must be an array of strings");
                    }
                    List<String> items = new ArrayList<>();
                    for (Object item : list) {
                        if (Placeholders.isPlaceholder(item)) {
                            continue;
                        }
                        if (!(item instanceof String text)) {
                            return ExtractionOutcome.rejected(field.name() + " must be an array of strings");
                        }
                        items.add(text.trim());
                    }
                    shaped = items.isEmpty() ? null : items;
                }
                case NUMBER_MAP -> {
                    if (!(value instanceof Map<?, ?> map)) {
                        return ExtractionOutcome.rejected(field.name() + " must be an object of numbers");
                    }
                    Map<String, Object> numbers = new LinkedHashMap<>();
                    for (Map.Entry<?, ?> item : map.entrySet()) {
                        if (Placeholders.isPlaceholder(item.getKey()) || item.getValue() == null) {
                            continue;
                        }
                        if (!(item.getValue() instanceof Number number)) {
                            return ExtractionOutcome.rejected(field.name() + " must be an object of numbers");
                        }
                        numbers.put(String.valueOf(item.getKey()).trim(), number.doubleValue());
                    }
                    shaped = numbers.isEmpty() ? null : numbers;
                }
                default -> throw new IllegalStateException("Unhandled field kind " + field.kind());
            }
            if (shaped != null) {
                delta.put(field.name(), shaped);
            }
        }

        ProfileData data = ProfileData.of(delta);
        return ExtractionOutcome.accepted(data, listTouchedFields(data));
    }

    /**
     * Last write wins per field; a field absent from the delta keeps its existing value.
     */
    public ProfileData merge(ProfileData existing, ProfileData delta) {
        Map<String, Object> merged = new LinkedHashMap<>(existing == null ? Map.of() : existing.asMap());
        if (delta != null) {
            delta.asMap().forEach((name, value) -> {
                if (Placeholders.isPresent(value)) {
                    merged.put(name, value);
                }
            });
        }
        return ProfileData.of(merged);
    }

    public Map<String, String> toStorageForm(ProfileData profile) {
        Map<String, String> flattened = new LinkedHashMap<>();
        if (profile == null) {
            return flattened;
        }
        profile.asMap().forEach((name, value) -> {
            if (Placeholders.isPlaceholder(value)) {
                return;
            }
            if (value instanceof String text) {
                flattened.put(name, text);
            } else {
                flattened.put(name, writeJson(value));
            }
        });
        return flattened;
    }

    public ProfileData fromStorageForm(Map<String, String> flattened) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (flattened == null) {
            return ProfileData.empty();
        }
        flattened.forEach((name, raw) -> {
            Optional<FieldDescriptor> descriptor = ProfileSchema.find(name);
            if (descriptor.isEmpty() || Placeholders.isPlaceholder(raw)) {
                return;
            }
            Object decoded = switch (descriptor.get().kind()) {
                case STRING -> raw;
                case STRING_LIST, NUMBER_MAP -> decodeStructured(raw);
            };
            if (decoded != null) {
                values.put(name, decoded);
            }
        });
        return ProfileData.of(values);
    }

    public List<String> listTouchedFields(ProfileData profile) {
        if (profile == null) {
            return List.of();
        }
        return ProfileSchema.listFields().stream()
            .map(FieldDescriptor::name)
            .filter(name -> Placeholders.isPresent(profile.get(name).orElse(null)))
            .toList();
    }

    private Object decodeStructured(String raw) {
        Object parsed;
        try {
            parsed = mapper.readValue(raw, Object.class);
        } catch (JsonProcessingException e) {
            return raw;
        }

        if (parsed instanceof List<?> list) {
            List<String> items = new ArrayList<>();
            for (Object item : list) {
                if (Placeholders.isPresent(item)) {
                    items.add(String.valueOf(item));
                }
            }
            return items.isEmpty() ? null : items;
        }
        if (parsed instanceof Map<?, ?> map) {
            Map<String, Object> numbers = new LinkedHashMap<>();
            map.forEach((key, value) -> {
                if (Placeholders.isPresent(key) && value instanceof Number number) {
                    numbers.put(String.valueOf(key), number.doubleValue());
                }
            });
            return numbers.isEmpty() ? null : numbers;
        }
        return raw;
    }

    private String writeJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize profile value", e);
        }
    }
}
