package io.hearth.core.session;

import io.hearth.core.model.ChatMessage;
import io.hearth.core.profile.ProfileData;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface ConversationStore {
    int DEFAULT_HISTORY_TURNS = 20;

    /**
     * Returns the profile's ACTIVE session, creating it when none exists. Concurrent callers for the
     * same profile all observe the same session.
     */
    ConversationSession getOrCreateActiveSession(String profileId) throws IOException;

    ConversationTurn appendTurn(
        String sessionId,
        String userMessage,
        String agentReply,
        String rawModelOutput,
        ProfileData extractedData,
        List<String> touchedFields
    ) throws IOException;

    /**
     * The last {@code maxTurns} turns, oldest first, each expanded into a user message and an assistant message.
     */
    List<ChatMessage> boundedHistory(String sessionId, int maxTurns) throws IOException;

    default List<ChatMessage> boundedHistory(String sessionId) throws IOException {
        return boundedHistory(sessionId, DEFAULT_HISTORY_TURNS);
    }

    /**
     * Marks the session COMPLETED. Ending an already completed session is a no-op.
     *
     * @throws IllegalArgumentException when the session does not exist
     */
    ConversationSession endSession(String sessionId) throws IOException;

    ConversationStats computeStats(String sessionId) throws IOException;

    Optional<ConversationSession> findSession(String sessionId) throws IOException;

    List<ConversationSession> listSessions(String profileId) throws IOException;

    List<ConversationSession> listAllSessions() throws IOException;

    List<ConversationTurn> listTurns(String sessionId) throws IOException;
}
