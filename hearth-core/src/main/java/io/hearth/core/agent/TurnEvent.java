package io.hearth.core.agent;

import io.hearth.core.profile.ProfileData;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One element of a turn's output stream. A turn emits zero or more {@code CONTENT} events, at most one
 * {@code EXTRACTION}, and ends with exactly one {@code ERROR} or {@code DONE}.
 */
public record TurnEvent(
    TurnEventType type,
    String content,
    ProfileData data,
    List<String> fields,
    String error,
    boolean sessionCompleted
) {
    public TurnEvent {
        Objects.requireNonNull(type, "type must not be null");
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static TurnEvent content(String fragment) {
        return new TurnEvent(TurnEventType.CONTENT, fragment, null, null, null, false);
    }

    public static TurnEvent extraction(ProfileData data, List<String> fields) {
        return new TurnEvent(TurnEventType.EXTRACTION, null, data, fields, null, false);
    }

    public static TurnEvent error(String message) {
        return new TurnEvent(TurnEventType.ERROR, null, null, null, message, false);
    }

    public static TurnEvent done(boolean sessionCompleted) {
        return new TurnEvent(TurnEventType.DONE, null, null, null, null, sessionCompleted);
    }

    public boolean terminal() {
        return type == TurnEventType.ERROR || type == TurnEventType.DONE;
    }

    /**
     * JSON-ready form used on the wire: {@code {"type": "content", "content": "..."}} and so on.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type.wireName());
        switch (type) {
            case CONTENT -> payload.put("content", content);
            case EXTRACTION -> {
                payload.put("data", data == null ? Map.of() : data.asMap());
                payload.put("fields", fields);
            }
            case ERROR -> payload.put("error", error);
            case DONE -> payload.put("sessionCompleted", sessionCompleted);
        }
        return payload;
    }
}
