package io.hearth.core.provider;

import io.hearth.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * @param responseSchema JSON schema for the reply envelope; only used in {@link ResponseMode#JSON}
 * @param temperature sampling temperature, or {@code null} for the provider default
 */
public record LlmRequest(
    String model,
    List<ChatMessage> messages,
    List<Map<String, Object>> tools,
    ResponseMode responseMode,
    Map<String, Object> responseSchema,
    Double temperature
) {
    public LlmRequest {
        Objects.requireNonNull(model, "model must not be null");
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
        responseMode = responseMode == null ? ResponseMode.TOOLS : responseMode;
    }

    public static LlmRequest of(String model, List<ChatMessage> messages) {
        return new LlmRequest(model, messages, List.of(), ResponseMode.TOOLS, null, null);
    }
}
