package io.hearth.core.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hearth.core.model.ChatMessage;
import io.hearth.core.profile.ProfileData;
import io.hearth.core.profile.ProfileSchema;
import io.hearth.core.storage.SqliteDatabase;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public final class SqliteConversationStore implements ConversationStore {
    private static final TypeReference<Map<String, Object>> EXTRACTED_DATA = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> FIELD_NAMES = new TypeReference<>() {
    };

    private final SqliteDatabase database;
    private final ObjectMapper mapper;
    private final Clock clock;

    public SqliteConversationStore(SqliteDatabase database, Clock clock) throws IOException {
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        init();
    }

    @Override
    public synchronized ConversationSession getOrCreateActiveSession(String profileId) throws IOException {
        if (profileId == null || profileId.isBlank()) {
            throw new IllegalArgumentException("profileId must not be blank");
        }
        String insert = """
            INSERT OR IGNORE INTO conversation_sessions (id, profile_id, status, started_at, last_updated_at, version)
            VALUES (?, ?, 'ACTIVE', ?, ?, 1)
            """;
        try (Connection connection = database.open()) {
            Optional<ConversationSession> existing = findActive(connection, profileId);
            if (existing.isPresent()) {
                return existing.get();
            }
            long now = clock.millis();
            try (PreparedStatement statement = connection.prepareStatement(insert)) {
                statement.setString(1, UUID.randomUUID().toString());
                statement.setString(2, profileId);
                statement.setLong(3, now);
                statement.setLong(4, now);
                statement.executeUpdate();
            }
            // Another writer may have won the insert; the unique index guarantees there is exactly one row.
            return findActive(connection, profileId)
                .orElseThrow(() -> new IOException("Active session vanished for profile " + profileId));
        } catch (SQLException e) {
            throw new IOException("Failed to resolve active session for profile " + profileId, e);
        }
    }

    @Override
    public synchronized ConversationTurn appendTurn(
        String sessionId,
        String userMessage,
        String agentReply,
        String rawModelOutput,
        ProfileData extractedData,
        List<String> touchedFields
    ) throws IOException {
        String insert = """
            INSERT INTO conversation_turns
                (id, session_id, created_at, user_message, agent_reply, raw_model_output, extracted_data, extracted_fields)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;
        String touch = """
            UPDATE conversation_sessions
            SET last_updated_at = ?, version = version + 1
            WHERE id = ?
            """;
        ConversationTurn turn = new ConversationTurn(
            UUID.randomUUID().toString(),
            sessionId,
            Instant.ofEpochMilli(clock.millis()),
            userMessage,
            agentReply,
            rawModelOutput,
            extractedData,
            touchedFields
        );
        String dataJson = extractedData == null ? null : mapper.writeValueAsString(extractedData.asMap());
        String fieldsJson = turn.touchedFields() == null ? null : mapper.writeValueAsString(turn.touchedFields());

        try (Connection connection = database.open()) {
            connection.setAutoCommit(false);
            try (PreparedStatement sessionUpdate = connection.prepareStatement(touch);
                 PreparedStatement turnInsert = connection.prepareStatement(insert)) {
                sessionUpdate.setLong(1, turn.createdAt().toEpochMilli());
                sessionUpdate.setString(2, sessionId);
                if (sessionUpdate.executeUpdate() == 0) {
                    throw new IllegalArgumentException("Unknown session: " + sessionId);
                }
                turnInsert.setString(1, turn.id());
                turnInsert.setString(2, sessionId);
                turnInsert.setLong(3, turn.createdAt().toEpochMilli());
                turnInsert.setString(4, turn.userMessage());
                turnInsert.setString(5, turn.agentReply());
                turnInsert.setString(6, turn.rawModelOutput());
                turnInsert.setString(7, dataJson);
                turnInsert.setString(8, fieldsJson);
                turnInsert.executeUpdate();
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                SqliteDatabase.rollback(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to append conversation turn", e);
        }
        return turn;
    }

    @Override
    public synchronized List<ChatMessage> boundedHistory(String sessionId, int maxTurns) throws IOException {
        if (maxTurns <= 0) {
            return List.of();
        }
        String sql = """
            SELECT * FROM conversation_turns
            WHERE session_id = ?
            ORDER BY created_at DESC, rowid DESC
            LIMIT ?
            """;
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            statement.setInt(2, maxTurns);
            List<ConversationTurn> turns = readTurns(statement);
            Collections.reverse(turns);
            List<ChatMessage> history = new ArrayList<>(turns.size() * 2);
            for (ConversationTurn turn : turns) {
                history.add(ChatMessage.user(turn.userMessage()));
                history.add(ChatMessage.assistant(turn.agentReply()));
            }
            return history;
        } catch (SQLException e) {
            throw new IOException("Failed to load history for session " + sessionId, e);
        }
    }

    @Override
    public synchronized ConversationSession endSession(String sessionId) throws IOException {
        String sql = """
            UPDATE conversation_sessions
            SET status = 'COMPLETED', last_updated_at = ?, version = version + 1
            WHERE id = ? AND status = 'ACTIVE'
            """;
        try (Connection connection = database.open()) {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setLong(1, clock.millis());
                statement.setString(2, sessionId);
                statement.executeUpdate();
            }
            return findSession(connection, sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
        } catch (SQLException e) {
            throw new IOException("Failed to end session " + sessionId, e);
        }
    }

    @Override
    public synchronized ConversationStats computeStats(String sessionId) throws IOException {
        ConversationSession session = findSession(sessionId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
        List<ConversationTurn> turns = listTurns(sessionId);

        Set<String> fieldsExtracted = new LinkedHashSet<>();
        for (ConversationTurn turn : turns) {
            fieldsExtracted.addAll(turn.touchedFieldsOrEmpty());
        }
        int totalFields = ProfileSchema.totalFields();
        int covered = fieldsExtracted.size();
        int percentage = (int) Math.round(100.0 * covered / totalFields);

        Duration latency = Duration.ZERO;
        if (turns.size() > 1) {
            Duration span = Duration.between(turns.get(0).createdAt(), turns.get(turns.size() - 1).createdAt());
            latency = span.dividedBy(turns.size() - 1);
        }
        return new ConversationStats(
            turns.size(),
            List.copyOf(fieldsExtracted),
            covered,
            totalFields,
            percentage,
            Duration.between(session.startedAt(), session.lastUpdatedAt()),
            latency
        );
    }

    @Override
    public synchronized Optional<ConversationSession> findSession(String sessionId) throws IOException {
        try (Connection connection = database.open()) {
            return findSession(connection, sessionId);
        } catch (SQLException e) {
            throw new IOException("Failed to load session " + sessionId, e);
        }
    }

    @Override
    public synchronized List<ConversationSession> listSessions(String profileId) throws IOException {
        String sql = """
            SELECT * FROM conversation_sessions
            WHERE profile_id = ?
            ORDER BY started_at ASC, rowid ASC
            """;
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, profileId);
            return readSessions(statement);
        } catch (SQLException e) {
            throw new IOException("Failed to list sessions for profile " + profileId, e);
        }
    }

    @Override
    public synchronized List<ConversationSession> listAllSessions() throws IOException {
        String sql = "SELECT * FROM conversation_sessions ORDER BY started_at DESC, rowid DESC";
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            return readSessions(statement);
        } catch (SQLException e) {
            throw new IOException("Failed to list sessions", e);
        }
    }

    @Override
    public synchronized List<ConversationTurn> listTurns(String sessionId) throws IOException {
        String sql = """
            SELECT * FROM conversation_turns
            WHERE session_id = ?
            ORDER BY created_at ASC, rowid ASC
            """;
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            return readTurns(statement);
        } catch (SQLException e) {
            throw new IOException("Failed to list turns for session " + sessionId, e);
        }
    }

    private Optional<ConversationSession> findActive(Connection connection, String profileId) throws SQLException {
        String sql = "SELECT * FROM conversation_sessions WHERE profile_id = ? AND status = 'ACTIVE'";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, profileId);
            List<ConversationSession> sessions = readSessions(statement);
            return sessions.isEmpty() ? Optional.empty() : Optional.of(sessions.get(0));
        }
    }

    private Optional<ConversationSession> findSession(Connection connection, String sessionId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT * FROM conversation_sessions WHERE id = ?")) {
            statement.setString(1, sessionId);
            List<ConversationSession> sessions = readSessions(statement);
            return sessions.isEmpty() ? Optional.empty() : Optional.of(sessions.get(0));
        }
    }

    private List<ConversationSession> readSessions(PreparedStatement statement) throws SQLException {
        List<ConversationSession> sessions = new ArrayList<>();
        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                sessions.add(new ConversationSession(
                    resultSet.getString("id"),
                    resultSet.getString("profile_id"),
                    SessionStatus.valueOf(resultSet.getString("status")),
                    Instant.ofEpochMilli(resultSet.getLong("started_at")),
                    Instant.ofEpochMilli(resultSet.getLong("last_updated_at")),
                    resultSet.getLong("version")
                ));
            }
        }
        return sessions;
    }

    private List<ConversationTurn> readTurns(PreparedStatement statement) throws SQLException, IOException {
        List<ConversationTurn> turns = new ArrayList<>();
        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                String dataJson = resultSet.getString("extracted_data");
                String fieldsJson = resultSet.getString("extracted_fields");
                turns.add(new ConversationTurn(
                    resultSet.getString("id"),
                    resultSet.getString("session_id"),
                    Instant.ofEpochMilli(resultSet.getLong("created_at")),
                    resultSet.getString("user_message"),
                    resultSet.getString("agent_reply"),
                    resultSet.getString("raw_model_output"),
                    dataJson == null ? null : readExtractedData(dataJson),
                    fieldsJson == null ? null : mapper.readValue(fieldsJson, FIELD_NAMES)
                ));
            }
        }
        return turns;
    }

    private ProfileData readExtractedData(String json) throws IOException {
        Map<String, Object> known = new LinkedHashMap<>();
        mapper.readValue(json, EXTRACTED_DATA).forEach((name, value) -> {
            if (ProfileSchema.contains(name)) {
                known.put(name, value);
            }
        });
        return ProfileData.of(known);
    }

    private void init() throws IOException {
        String sessions = """
            CREATE TABLE IF NOT EXISTS conversation_sessions (
                id TEXT PRIMARY KEY,
                profile_id TEXT NOT NULL,
                status TEXT NOT NULL,
                started_at INTEGER NOT NULL,
                last_updated_at INTEGER NOT NULL,
                version INTEGER NOT NULL
            )
            """;
        String oneActive = """
            CREATE UNIQUE INDEX IF NOT EXISTS idx_conversation_sessions_one_active
            ON conversation_sessions(profile_id) WHERE status = 'ACTIVE'
            """;
        String turns = """
            CREATE TABLE IF NOT EXISTS conversation_turns (
                id TEXT PRIMARY KEY,
                session_id TEXT NOT NULL REFERENCES conversation_sessions(id),
                created_at INTEGER NOT NULL,
                user_message TEXT NOT NULL,
                agent_reply TEXT NOT NULL,
                raw_model_output TEXT NOT NULL,
                extracted_data TEXT,
                extracted_fields TEXT
            )
            """;
        String turnIdx = """
            CREATE INDEX IF NOT EXISTS idx_conversation_turns_session_created
            ON conversation_turns(session_id, created_at)
            """;
        try (Connection connection = database.open();
             Statement statement = connection.createStatement()) {
            statement.execute(sessions);
            statement.execute(oneActive);
            statement.execute(turns);
            statement.execute(turnIdx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite conversation store", e);
        }
    }
}
