package io.hearth.core.provider;

import java.util.Locale;

/**
 * Picks the provider for a conversation: the configured one when set, otherwise by model name.
 */
public final class ProviderRouter {
    private final ProviderRegistry registry;

    public ProviderRouter(ProviderRegistry registry) {
        this.registry = registry;
    }

    public LlmProvider resolve(String preferredProvider, String model) {
        if (preferredProvider != null && !preferredProvider.isBlank()) {
            return registry.require(preferredProvider);
        }
        return registry.require(providerForModel(model));
    }

    static String providerForModel(String model) {
        String normalized = model == null ? "" : model.toLowerCase(Locale.ROOT);
        if (normalized.equals("echo")) {
            return "echo";
        }
        if (normalized.startsWith("gpt") || normalized.startsWith("o1") || normalized.startsWith("o3")) {
            return "openai";
        }
        return "openrouter";
    }
}
