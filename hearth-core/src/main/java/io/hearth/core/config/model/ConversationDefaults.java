package io.hearth.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversationDefaults(
    String provider,
    String model,
    @JsonAlias({"max_history_turns"}) int maxHistoryTurns,
    @JsonAlias({"strict_validation"}) boolean strictValidation,
    @JsonAlias({"response_mode"}) String responseMode,
    double temperature
) {

    public static ConversationDefaults defaults() {
        return new ConversationDefaults(
            "openai",
            "gpt-4o-2024-08-06",
            20,
            true,
            "tools",
            0.8
        );
    }
}
