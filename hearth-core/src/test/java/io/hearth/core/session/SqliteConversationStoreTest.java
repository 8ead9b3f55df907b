package io.hearth.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.hearth.core.model.ChatMessage;
import io.hearth.core.model.MessageRole;
import io.hearth.core.profile.ProfileData;
import io.hearth.core.storage.SqliteDatabase;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteConversationStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReuseActiveSessionUntilEnded() throws Exception {
        SqliteConversationStore store = newStore(Clock.systemUTC());

        ConversationSession first = store.getOrCreateActiveSession("profile-1");
        ConversationSession again = store.getOrCreateActiveSession("profile-1");

        assertThat(again.id()).isEqualTo(first.id());
        assertThat(first.active()).isTrue();

        ConversationSession ended = store.endSession(first.id());
        ConversationSession next = store.getOrCreateActiveSession("profile-1");

        assertThat(ended.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(next.id()).isNotEqualTo(first.id());
        assertThat(store.listSessions("profile-1")).hasSize(2);
    }

    @Test
    void concurrentFirstTurnsShouldCreateExactlyOneActiveSession() throws Exception {
        Path dbPath = tempDir.resolve("race.db");
        SqliteConversationStore left = new SqliteConversationStore(new SqliteDatabase(dbPath), Clock.systemUTC());
        SqliteConversationStore right = new SqliteConversationStore(new SqliteDatabase(dbPath), Clock.systemUTC());
        CountDownLatch start = new CountDownLatch(1);
        Set<String> seen = ConcurrentHashMap.newKeySet();

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<String>> calls = List.of(
                () -> awaitThenResolve(start, left),
                () -> awaitThenResolve(start, right),
                () -> awaitThenResolve(start, left),
                () -> awaitThenResolve(start, right)
            );
            List<Future<String>> futures = calls.stream().map(pool::submit).toList();
            start.countDown();
            for (Future<String> future : futures) {
                seen.add(future.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(seen).hasSize(1);
        assertThat(left.listSessions("profile-race")).hasSize(1);
    }

    @Test
    void boundedHistoryShouldReturnMostRecentTurnsOldestFirst() throws Exception {
        SqliteConversationStore store = newStore(new SteppingClock(Instant.parse("2024-05-01T10:00:00Z")));
        String sessionId = store.getOrCreateActiveSession("profile-1").id();
        for (int i = 1; i <= 25; i++) {
            store.appendTurn(sessionId, "question " + i, "answer " + i, "{}", null, null);
        }

        List<ChatMessage> history = store.boundedHistory(sessionId);

        assertThat(history).hasSize(40);
        assertThat(history.get(0).role()).isEqualTo(MessageRole.USER);
        assertThat(history.get(0).content()).isEqualTo("question 6");
        assertThat(history.get(1).role()).isEqualTo(MessageRole.ASSISTANT);
        assertThat(history.get(39).content()).isEqualTo("answer 25");
        assertThat(store.boundedHistory(sessionId, 0)).isEmpty();
        assertThat(store.boundedHistory(sessionId, 2)).extracting(ChatMessage::content)
            .containsExactly("question 24", "answer 24", "question 25", "answer 25");
    }

    @Test
    void appendTurnShouldPersistExtractionAndBumpVersion() throws Exception {
        SqliteConversationStore store = newStore(Clock.systemUTC());
        ConversationSession session = store.getOrCreateActiveSession("profile-1");

        store.appendTurn(session.id(), "hi", "hello", "{}", null, null);
        store.appendTurn(
            session.id(),
            "I'm in Denver",
            "Great!",
            "{\"provider\":\"openai\"}",
            ProfileData.of(Map.of("location", "Denver", "yearsOfExperience", Map.of("infant", 3))),
            List.of("location", "yearsOfExperience")
        );

        List<ConversationTurn> turns = store.listTurns(session.id());
        assertThat(turns).hasSize(2);
        assertThat(turns.get(0).extraction()).isEmpty();
        assertThat(turns.get(0).touchedFields()).isNull();
        assertThat(turns.get(1).extraction().orElseThrow().get("yearsOfExperience"))
            .contains(Map.of("infant", 3.0));
        assertThat(turns.get(1).touchedFields()).containsExactly("location", "yearsOfExperience");
        assertThat(store.findSession(session.id()).orElseThrow().version()).isEqualTo(session.version() + 2);
    }

    @Test
    void appendTurnShouldRejectUnknownSession() throws Exception {
        SqliteConversationStore store = newStore(Clock.systemUTC());

        assertThatThrownBy(() -> store.appendTurn("missing", "hi", "hello", "{}", null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.listTurns("missing")).isEmpty();
    }

    @Test
    void endSessionShouldBeIdempotent() throws Exception {
        SqliteConversationStore store = newStore(Clock.systemUTC());
        ConversationSession session = store.getOrCreateActiveSession("profile-1");

        ConversationSession ended = store.endSession(session.id());
        ConversationSession endedAgain = store.endSession(session.id());

        assertThat(endedAgain.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(endedAgain.version()).isEqualTo(ended.version());
        assertThatThrownBy(() -> store.endSession("missing")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void statsForSessionWithoutTurnsShouldBeZero() throws Exception {
        SqliteConversationStore store = newStore(Clock.systemUTC());
        ConversationSession session = store.getOrCreateActiveSession("profile-1");

        ConversationStats stats = store.computeStats(session.id());

        assertThat(stats.turnCount()).isZero();
        assertThat(stats.fieldsExtracted()).isEmpty();
        assertThat(stats.completionPercentage()).isZero();
        assertThat(stats.totalFields()).isEqualTo(20);
        assertThat(stats.averageInterTurnLatency()).isEqualTo(Duration.ZERO);
        assertThatThrownBy(() -> store.computeStats("missing")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void statsShouldCountDistinctFieldsAndLatency() throws Exception {
        SteppingClock clock = new SteppingClock(Instant.parse("2024-05-01T10:00:00Z"));
        SqliteConversationStore store = newStore(clock);
        String sessionId = store.getOrCreateActiveSession("profile-1").id();

        store.appendTurn(sessionId, "a", "b", "{}", ProfileData.of(Map.of("location", "Denver")), List.of("location"));
        store.appendTurn(sessionId, "c", "d", "{}", null, null);
        store.appendTurn(
            sessionId,
            "e",
            "f",
            "{}",
            ProfileData.of(Map.of("location", "Boulder", "languages", List.of("English"))),
            List.of("location", "languages")
        );

        ConversationStats stats = store.computeStats(sessionId);

        assertThat(stats.turnCount()).isEqualTo(3);
        assertThat(stats.fieldsExtracted()).containsExactly("location", "languages");
        assertThat(stats.fieldsCovered()).isEqualTo(2);
        assertThat(stats.completionPercentage()).isEqualTo(10);
        assertThat(stats.averageInterTurnLatency()).isEqualTo(SteppingClock.STEP);
        assertThat(stats.duration()).isEqualTo(SteppingClock.STEP.multipliedBy(3));
    }

    private String awaitThenResolve(CountDownLatch start, SqliteConversationStore store) throws Exception {
        start.await();
        return store.getOrCreateActiveSession("profile-race").id();
    }

    private SqliteConversationStore newStore(Clock clock) throws Exception {
        return new SqliteConversationStore(new SqliteDatabase(tempDir.resolve("hearth.db")), clock);
    }

    /**
     * Advances by {@link #STEP} on every read.
     */
    static final class SteppingClock extends Clock {
        static final Duration STEP = Duration.ofSeconds(2);

        private Instant next;

        SteppingClock(Instant start) {
            this.next = start;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public synchronized Instant instant() {
            Instant current = next;
            next = next.plus(STEP);
            return current;
        }
    }
}
