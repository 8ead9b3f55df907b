package io.hearth.core.session;

import io.hearth.core.profile.ProfileData;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One exchange in a session. {@code extractedData} and {@code touchedFields} are {@code null} when the
 * turn produced no accepted extraction.
 */
public record ConversationTurn(
    String id,
    String sessionId,
    Instant createdAt,
    String userMessage,
    String agentReply,
    String rawModelOutput,
    ProfileData extractedData,
    List<String> touchedFields
) {
    public ConversationTurn {
        userMessage = userMessage == null ? "" : userMessage;
        agentReply = agentReply == null ? "" : agentReply;
        rawModelOutput = rawModelOutput == null ? "" : rawModelOutput;
        touchedFields = touchedFields == null ? null : List.copyOf(touchedFields);
    }

    public Optional<ProfileData> extraction() {
        return Optional.ofNullable(extractedData);
    }

    public List<String> touchedFieldsOrEmpty() {
        return touchedFields == null ? List.of() : touchedFields;
    }
}
