package io.hearth.core.provider;

import java.util.Map;

/**
 * Stands in for a provider whose credentials are missing from the config.
 * Every turn fails without touching the network, which lets a fallback chain move to the next provider.
 */
public final class DisabledProvider implements LlmProvider {
    private final String name;
    private final String reason;

    public DisabledProvider(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "provider is disabled" : reason;
    }

    public static DisabledProvider missingApiKey(String name) {
        return new DisabledProvider(name, "set providers." + name + ".apiKey in the config file");
    }

    @Override
    public String name() {
        return name;
    }

    public String reason() {
        return reason;
    }

    @Override
    public LlmResponse stream(LlmRequest request, StreamListener listener) {
        return LlmResponse.failure(
            "provider " + name + " is not configured: " + reason,
            Map.of("provider", name, "disabled", true)
        );
    }
}
