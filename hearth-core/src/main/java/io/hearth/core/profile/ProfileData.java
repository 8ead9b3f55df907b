package io.hearth.core.profile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of profile field values, keyed by schema field name and kept in schema order.
 * Values are {@code String}, {@code List<String>} or {@code Map<String, Double>}; numbers inside maps
 * are normalized to {@code Double} so equality survives a storage round trip.
 */
public final class ProfileData {
    private static final ProfileData EMPTY = new ProfileData(Map.of());

    private final Map<String, Object> values;

    private ProfileData(Map<String, Object> values) {
        this.values = values;
    }

    public static ProfileData empty() {
        return EMPTY;
    }

    public static ProfileData of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        List<String> names = new ArrayList<>(values.keySet());
        for (String name : names) {
            if (!ProfileSchema.contains(name)) {
                throw new IllegalArgumentException("Unknown profile field: " + name);
            }
        }
        names.sort(Comparator.comparingInt(ProfileSchema::indexOf));

        Map<String, Object> ordered = new LinkedHashMap<>();
        for (String name : names) {
            Object value = values.get(name);
            if (value != null) {
                ordered.put(name, freeze(value));
            }
        }
        return ordered.isEmpty() ? EMPTY : new ProfileData(Collections.unmodifiableMap(ordered));
    }

    public Optional<Object> get(String field) {
        return Optional.ofNullable(values.get(field));
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    public Set<String> fieldNames() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public ProfileData with(String field, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        if (value == null) {
            copy.remove(field);
        } else {
            copy.put(field, value);
        }
        return of(copy);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ProfileData that && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ProfileData" + values;
    }

    private static Object freeze(Object value) {
        if (value instanceof List<?> list) {
            return List.copyOf(list);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, entry) -> copy.put(
                String.valueOf(key),
                entry instanceof Number number ? Double.valueOf(number.doubleValue()) : entry
            ));
            return Collections.unmodifiableMap(copy);
        }
        return value;
    }
}
