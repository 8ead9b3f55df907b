package io.hearth.core.profile;

import io.hearth.core.extraction.ProfileExtractor;
import io.hearth.core.storage.SqliteDatabase;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Profiles stored one row per onboarding attempt, one text column per schema field. Lists and maps
 * live in their columns as JSON text produced by {@link ProfileExtractor#toStorageForm}.
 */
public final class SqliteProfileStore implements ProfileStore {
    private final SqliteDatabase database;
    private final ProfileExtractor extractor;
    private final Clock clock;

    public SqliteProfileStore(SqliteDatabase database, ProfileExtractor extractor, Clock clock) throws IOException {
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        init();
    }

    @Override
    public synchronized Profile create() throws IOException {
        String sql = """
            INSERT INTO caregiver_profiles (id, status, created_at, updated_at)
            VALUES (?, ?, ?, ?)
            """;
        String id = UUID.randomUUID().toString();
        Instant now = clock.instant();
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, id);
            statement.setString(2, ProfileStatus.IN_PROGRESS.name());
            statement.setLong(3, now.toEpochMilli());
            statement.setLong(4, now.toEpochMilli());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to create caregiver profile", e);
        }
        return new Profile(id, ProfileStatus.IN_PROGRESS, ProfileData.empty(),
            Instant.ofEpochMilli(now.toEpochMilli()), Instant.ofEpochMilli(now.toEpochMilli()));
    }

    @Override
    public synchronized Optional<Profile> find(String profileId) throws IOException {
        try (Connection connection = database.open()) {
            return find(connection, profileId);
        } catch (SQLException e) {
            throw new IOException("Failed to load caregiver profile " + profileId, e);
        }
    }

    @Override
    public synchronized List<Profile> list() throws IOException {
        String sql = "SELECT * FROM caregiver_profiles ORDER BY created_at ASC, rowid ASC";
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<Profile> profiles = new ArrayList<>();
            while (resultSet.next()) {
                profiles.add(readProfile(resultSet));
            }
            return profiles;
        } catch (SQLException e) {
            throw new IOException("Failed to list caregiver profiles", e);
        }
    }

    @Override
    public synchronized Profile applyDelta(String profileId, ProfileData delta) throws IOException {
        try (Connection connection = database.open()) {
            connection.setAutoCommit(false);
            try {
                Profile current = find(connection, profileId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown profile: " + profileId));
                ProfileData merged = extractor.merge(current.data(), delta);
                Instant now = clock.instant();
                writeFields(connection, profileId, extractor.toStorageForm(merged), now);
                connection.commit();
                return new Profile(profileId, current.status(), merged, current.createdAt(),
                    Instant.ofEpochMilli(now.toEpochMilli()));
            } catch (SQLException | RuntimeException e) {
                SqliteDatabase.rollback(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to update caregiver profile " + profileId, e);
        }
    }

    @Override
    public synchronized void markCompleted(String profileId) throws IOException {
        String sql = "UPDATE caregiver_profiles SET status = ?, updated_at = ? WHERE id = ?";
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, ProfileStatus.COMPLETED.name());
            statement.setLong(2, clock.millis());
            statement.setString(3, profileId);
            if (statement.executeUpdate() == 0) {
                throw new IllegalArgumentException("Unknown profile: " + profileId);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to complete caregiver profile " + profileId, e);
        }
    }

    static String columnName(String fieldName) {
        return fieldName.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
    }

    private Optional<Profile> find(Connection connection, String profileId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT * FROM caregiver_profiles WHERE id = ?")) {
            statement.setString(1, profileId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(readProfile(resultSet)) : Optional.empty();
            }
        }
    }

    private void writeFields(Connection connection, String profileId, Map<String, String> flattened, Instant now)
        throws SQLException {
        List<FieldDescriptor> fields = ProfileSchema.listFields();
        String assignments = fields.stream()
            .map(field -> columnName(field.name()) + " = ?")
            .collect(Collectors.joining(", "));
        String sql = "UPDATE caregiver_profiles SET " + assignments + ", updated_at = ? WHERE id = ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            int index = 1;
            for (FieldDescriptor field : fields) {
                statement.setString(index++, flattened.get(field.name()));
            }
            statement.setLong(index++, now.toEpochMilli());
            statement.setString(index, profileId);
            statement.executeUpdate();
        }
    }

    private Profile readProfile(ResultSet resultSet) throws SQLException {
        Map<String, String> flattened = new LinkedHashMap<>();
        for (FieldDescriptor field : ProfileSchema.listFields()) {
            String value = resultSet.getString(columnName(field.name()));
            if (value != null) {
                flattened.put(field.name(), value);
            }
        }
        return new Profile(
            resultSet.getString("id"),
            ProfileStatus.valueOf(resultSet.getString("status")),
            extractor.fromStorageForm(flattened),
            Instant.ofEpochMilli(resultSet.getLong("created_at")),
            Instant.ofEpochMilli(resultSet.getLong("updated_at"))
        );
    }

    private void init() throws IOException {
        String columns = ProfileSchema.listFields().stream()
            .map(field -> "    " + columnName(field.name()) + " TEXT")
            .collect(Collectors.joining(",\n"));
        String ddl = """
            CREATE TABLE IF NOT EXISTS caregiver_profiles (
                id TEXT PRIMARY KEY,
                status TEXT NOT NULL,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL,
            %s
            )
            """.formatted(columns);
        try (Connection connection = database.open();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite profile store", e);
        }
    }
}
