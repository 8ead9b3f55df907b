package io.hearth.core.provider;

import io.hearth.core.model.ToolCall;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one model call. {@code content} is the reply text as it was streamed to the listener,
 * {@code rawContent} the unmodified model output. A failed response carries an {@code error} and is never
 * partially consumed by callers.
 */
public record LlmResponse(
    String content,
    String rawContent,
    List<ToolCall> toolCalls,
    Map<String, Object> structuredData,
    Map<String, Object> usage,
    String error,
    boolean cancelled
) {
    public LlmResponse {
        content = content == null ? "" : content;
        rawContent = rawContent == null ? content : rawContent;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        structuredData = structuredData == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(structuredData));
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }

    public static LlmResponse of(String content, List<ToolCall> toolCalls, Map<String, Object> usage) {
        return new LlmResponse(content, content, toolCalls, null, usage, null, false);
    }

    public static LlmResponse failure(String error) {
        return new LlmResponse("", "", List.of(), null, Map.of(), error == null ? "unknown error" : error, false);
    }

    public static LlmResponse failure(String error, Map<String, Object> usage) {
        return new LlmResponse("", "", List.of(), null, usage, error == null ? "unknown error" : error, false);
    }

    public static LlmResponse cancelledBy(String partialContent) {
        return new LlmResponse(partialContent, partialContent, List.of(), null, Map.of(), null, true);
    }

    public boolean failed() {
        return error != null;
    }

    public Optional<ToolCall> toolCall(String name) {
        return toolCalls.stream().filter(call -> call.name().equals(name)).findFirst();
    }
}
