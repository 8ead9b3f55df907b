package io.hearth.core.provider;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named providers available to conversations. Lookups ignore case and treat '-' and '_' alike,
 * so {@code open-router} and {@code OPEN_ROUTER} resolve to the same entry.
 */
public final class ProviderRegistry {
    private final Map<String, LlmProvider> providersByKey = new ConcurrentHashMap<>();

    public void register(LlmProvider provider) {
        String key = keyOf(provider.name());
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        LlmProvider previous = providersByKey.putIfAbsent(key, provider);
        if (previous != null) {
            throw new IllegalStateException("Provider " + provider.name() + " is already registered");
        }
    }

    public Optional<LlmProvider> find(String name) {
        return Optional.ofNullable(providersByKey.get(keyOf(name)));
    }

    /**
     * Returns the named provider or fails with the list of registered names.
     */
    public LlmProvider require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
            "Unknown provider: " + name + " (registered: " + String.join(", ", names()) + ")"
        ));
    }

    public List<String> names() {
        return providersByKey.keySet().stream().sorted().toList();
    }

    private static String keyOf(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
