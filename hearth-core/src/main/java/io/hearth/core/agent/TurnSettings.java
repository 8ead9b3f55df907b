package io.hearth.core.agent;

import io.hearth.core.provider.ResponseMode;

public record TurnSettings(
    String systemPrompt,
    String provider,
    String model,
    int maxHistoryTurns,
    boolean strictValidation,
    ResponseMode responseMode,
    Double temperature
) {
    public static final String DEFAULT_MODEL = "gpt-4o-2024-08-06";

    public TurnSettings {
        maxHistoryTurns = maxHistoryTurns <= 0 ? 20 : maxHistoryTurns;
        model = model == null || model.isBlank() ? DEFAULT_MODEL : model;
        responseMode = responseMode == null ? ResponseMode.TOOLS : responseMode;
        systemPrompt = systemPrompt == null || systemPrompt.isBlank() ? OnboardingPrompt.DEFAULT : systemPrompt;
    }

    public static TurnSettings defaults() {
        return new TurnSettings(null, null, null, 20, true, ResponseMode.TOOLS, 0.8);
    }
}
