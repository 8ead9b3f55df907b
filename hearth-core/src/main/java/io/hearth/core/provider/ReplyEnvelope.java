package io.hearth.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Optional;

/**
 * The {@code {"message": ..., "extractedData": {...}}} object a model returns in {@link ResponseMode#JSON}.
 * {@code extractedData} is {@code null} when the model reported nothing.
 */
public record ReplyEnvelope(String message, Map<String, Object> extractedData) {
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {
    };

    public static Optional<ReplyEnvelope> parse(ObjectMapper mapper, String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject() || !root.path("message").isTextual()) {
            return Optional.empty();
        }
        JsonNode data = root.path("extractedData");
        Map<String, Object> extracted = data.isObject() ? mapper.convertValue(data, OBJECT) : null;
        return Optional.of(new ReplyEnvelope(root.path("message").asText(), extracted));
    }
}
