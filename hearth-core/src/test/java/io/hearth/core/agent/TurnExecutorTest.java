package io.hearth.core.agent;

import static org.assertj.core.api.Assertions.assertThat;

import io.hearth.core.extraction.ProfileExtractor;
import io.hearth.core.model.ChatMessage;
import io.hearth.core.model.MessageRole;
import io.hearth.core.model.ToolCall;
import io.hearth.core.profile.Profile;
import io.hearth.core.profile.ProfileData;
import io.hearth.core.profile.ProfileSchema;
import io.hearth.core.profile.ProfileStatus;
import io.hearth.core.profile.ProfileStore;
import io.hearth.core.profile.SqliteProfileStore;
import io.hearth.core.provider.LlmProvider;
import io.hearth.core.provider.LlmRequest;
import io.hearth.core.provider.LlmResponse;
import io.hearth.core.provider.ProviderRegistry;
import io.hearth.core.provider.ProviderRouter;
import io.hearth.core.provider.ResponseMode;
import io.hearth.core.provider.StreamListener;
import io.hearth.core.session.ConversationSession;
import io.hearth.core.session.ConversationStats;
import io.hearth.core.session.ConversationStore;
import io.hearth.core.session.ConversationTurn;
import io.hearth.core.session.SessionStatus;
import io.hearth.core.session.SqliteConversationStore;
import io.hearth.core.storage.SqliteDatabase;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TurnExecutorTest {

    @TempDir
    Path tempDir;

    private SqliteProfileStore profiles;
    private SqliteConversationStore conversations;
    private ScriptedProvider provider;
    private TurnExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        SqliteDatabase database = new SqliteDatabase(tempDir.resolve("hearth.db"));
        profiles = new SqliteProfileStore(database, new ProfileExtractor(), Clock.systemUTC());
        conversations = new SqliteConversationStore(database, Clock.systemUTC());
        provider = new ScriptedProvider();
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(provider);
        executor = new TurnExecutor(new ProviderRouter(registry), profiles, conversations);
    }

    @Test
    void shouldStreamReplyThenReportExtractionAndPersistTurn() throws Exception {
        Profile profile = profiles.create();
        provider.reply(
            List.of("Welcome! ", "How long have you been caring for kids?"),
            Map.of("location", "Denver", "languages", List.of("English"))
        );
        RecordingSink sink = new RecordingSink();

        TurnResult result = executor.execute(profile.id(), "I'm in Denver and speak English", settings(), sink);

        assertThat(result.succeeded()).isTrue();
        assertThat(sink.types()).containsExactly(
            TurnEventType.CONTENT, TurnEventType.CONTENT, TurnEventType.EXTRACTION, TurnEventType.DONE);
        assertThat(sink.events.get(2).fields()).containsExactly("location", "languages");
        assertThat(sink.events.get(3).sessionCompleted()).isFalse();

        Profile stored = profiles.find(profile.id()).orElseThrow();
        assertThat(stored.data().get("location")).contains("Denver");
        assertThat(stored.data().get("languages")).contains(List.of("English"));

        List<ConversationTurn> turns = conversations.listTurns(result.sessionId());
        assertThat(turns).hasSize(1);
        assertThat(turns.get(0).agentReply()).isEqualTo("Welcome! How long have you been caring for kids?");
        assertThat(turns.get(0).touchedFields()).containsExactly("location", "languages");
        assertThat(turns.get(0).rawModelOutput()).contains("\"provider\":\"scripted\"", ProfileSchema.UPDATE_PROFILE_TOOL);

        LlmRequest request = provider.requests.get(0);
        assertThat(request.messages().get(0).role()).isEqualTo(MessageRole.SYSTEM);
        assertThat(request.tools()).hasSize(1);
    }

    @Test
    void shouldSendBoundedHistoryOnLaterTurns() throws Exception {
        Profile profile = profiles.create();
        provider.reply(List.of("First answer"), null);
        executor.execute(profile.id(), "first question", settings(), new RecordingSink());
        provider.reply(List.of("Second answer"), null);

        executor.execute(profile.id(), "second question", settings(), new RecordingSink());

        assertThat(provider.requests.get(1).messages()).extracting(ChatMessage::content)
            .endsWith("first question", "First answer", "second question");
    }

    @Test
    void shouldReportUnknownProfileWithoutCreatingSession() throws Exception {
        RecordingSink sink = new RecordingSink();

        TurnResult result = executor.execute("missing", "hello", settings(), sink);

        assertThat(result.state()).isEqualTo(TurnState.ERROR);
        assertThat(sink.types()).containsExactly(TurnEventType.ERROR);
        assertThat(conversations.listAllSessions()).isEmpty();
        assertThat(provider.requests).isEmpty();
    }

    @Test
    void shouldReportProviderFailureWithoutLoggingTurn() throws Exception {
        Profile profile = profiles.create();
        provider.fail("HTTP 503 overloaded");
        RecordingSink sink = new RecordingSink();

        TurnResult result = executor.execute(profile.id(), "hello", settings(), sink);

        assertThat(result.state()).isEqualTo(TurnState.ERROR);
        assertThat(sink.events).hasSize(1);
        assertThat(sink.events.get(0).error()).isEqualTo("Unable to process your message. Please try again.");
        assertThat(conversations.listTurns(result.sessionId())).isEmpty();
    }

    @Test
    void shouldTreatEmptyReplyAsError() throws Exception {
        Profile profile = profiles.create();
        provider.reply(List.of(), Map.of("location", "Denver"));
        RecordingSink sink = new RecordingSink();

        TurnResult result = executor.execute(profile.id(), "hello", settings(), sink);

        assertThat(result.state()).isEqualTo(TurnState.ERROR);
        assertThat(sink.types()).containsExactly(TurnEventType.ERROR);
        assertThat(profiles.find(profile.id()).orElseThrow().data().isEmpty()).isTrue();
    }

    @Test
    void shouldRejectBlankMessage() {
        RecordingSink sink = new RecordingSink();

        TurnResult result = executor.execute("any", "   ", settings(), sink);

        assertThat(result.state()).isEqualTo(TurnState.ERROR);
        assertThat(sink.events.get(0).error()).isEqualTo("Message must not be empty");
    }

    @Test
    void shouldWriteNothingWhenCallerDisconnects() throws Exception {
        Profile profile = profiles.create();
        provider.reply(List.of("one ", "two ", "three"), Map.of("location", "Denver"));
        RecordingSink sink = new RecordingSink();
        sink.closeAfter = 1;

        TurnResult result = executor.execute(profile.id(), "hello", settings(), sink);

        assertThat(result.state()).isEqualTo(TurnState.ABANDONED);
        assertThat(sink.types()).containsExactly(TurnEventType.CONTENT);
        assertThat(conversations.listTurns(result.sessionId())).isEmpty();
        assertThat(profiles.find(profile.id()).orElseThrow().data().isEmpty()).isTrue();
    }

    @Test
    void strictValidationShouldDropRejectedFieldsOnly() throws Exception {
        Profile profile = profiles.create();
        provider.reply(List.of("Thanks!"), Map.of("location", "Denver", "hourlyRate", "$5/hr"));
        RecordingSink sink = new RecordingSink();

        executor.execute(profile.id(), "Denver, $5/hr", settings(), sink);

        assertThat(sink.events.get(1).fields()).containsExactly("location");
        assertThat(profiles.find(profile.id()).orElseThrow().data().has("hourlyRate")).isFalse();
    }

    @Test
    void lenientValidationShouldKeepShapeValidFields() throws Exception {
        Profile profile = profiles.create();
        provider.reply(List.of("Thanks!"), Map.of("hourlyRate", "$5/hr"));
        TurnSettings lenient = new TurnSettings(null, "scripted", "gpt-4o", 20, false, ResponseMode.TOOLS, null);

        executor.execute(profile.id(), "$5/hr", lenient, new RecordingSink());

        assertThat(profiles.find(profile.id()).orElseThrow().data().get("hourlyRate")).contains("$5/hr");
    }

    @Test
    void malformedExtractionShouldStillDeliverReply() throws Exception {
        Profile profile = profiles.create();
        provider.reply(List.of("Tell me more."), Map.of("yearsOfExperience", "all the experience"));
        RecordingSink sink = new RecordingSink();

        TurnResult result = executor.execute(profile.id(), "all the experience", settings(), sink);

        assertThat(result.succeeded()).isTrue();
        assertThat(sink.types()).containsExactly(TurnEventType.CONTENT, TurnEventType.DONE);
        List<ConversationTurn> turns = conversations.listTurns(result.sessionId());
        assertThat(turns.get(0).extraction()).isEmpty();
        assertThat(turns.get(0).touchedFields()).isNull();
    }

    @Test
    void shouldEndSessionOnceProfileIsComplete() throws Exception {
        Profile profile = profiles.create();
        profiles.applyDelta(profile.id(), ProfileData.of(Map.of(
            "location", "Denver",
            "languages", List.of("English"),
            "careTypes", List.of("infant care"),
            "qualifications", List.of("CPR"),
            "startDate", "June"
        )));
        provider.reply(List.of("All set!"), Map.of("hourlyRate", "$30/hr", "weeklyHours", "30"));
        RecordingSink sink = new RecordingSink();

        TurnResult result = executor.execute(profile.id(), "$30/hr, 30 hours a week", settings(), sink);

        assertThat(result.sessionCompleted()).isTrue();
        assertThat(sink.events.get(sink.events.size() - 1).sessionCompleted()).isTrue();
        assertThat(profiles.find(profile.id()).orElseThrow().status()).isEqualTo(ProfileStatus.COMPLETED);
        assertThat(profiles.find(profile.id()).orElseThrow().data().get("hourlyRate")).contains("$30/hour");
        ConversationSession session = conversations.findSession(result.sessionId()).orElseThrow();
        assertThat(session.status()).isEqualTo(SessionStatus.COMPLETED);
    }

    @Test
    void jsonModeShouldUseStructuredDataAndAskForEnvelope() throws Exception {
        Profile profile = profiles.create();
        provider.envelope("Which languages do you speak?", Map.of("location", "Denver"));
        TurnSettings json = new TurnSettings(null, "scripted", "gpt-4o", 20, true, ResponseMode.JSON, 0.8);
        RecordingSink sink = new RecordingSink();

        executor.execute(profile.id(), "I'm in Denver", json, sink);

        assertThat(sink.types()).containsExactly(TurnEventType.CONTENT, TurnEventType.EXTRACTION, TurnEventType.DONE);
        LlmRequest request = provider.requests.get(0);
        assertThat(request.tools()).isEmpty();
        assertThat(request.responseSchema()).isNotNull();
        assertThat(request.messages().get(0).content()).contains("\"extractedData\"");
        assertThat(profiles.find(profile.id()).orElseThrow().data().get("location")).contains("Denver");
    }

    @Test
    void failedProfileWriteShouldStillLogTurnAndFinish() throws Exception {
        FaultyProfileStore faultyProfiles = new FaultyProfileStore(profiles);
        faultyProfiles.failApplyDelta = true;
        TurnExecutor faulty = executorWith(faultyProfiles, conversations);
        Profile profile = profiles.create();
        provider.reply(List.of("Noted, Denver."), Map.of("location", "Denver"));
        RecordingSink sink = new RecordingSink();

        TurnResult result = faulty.execute(profile.id(), "I live in Denver", settings(), sink);

        assertThat(result.succeeded()).isTrue();
        assertThat(sink.types()).containsExactly(TurnEventType.CONTENT, TurnEventType.DONE);
        List<ConversationTurn> turns = conversations.listTurns(result.sessionId());
        assertThat(turns).hasSize(1);
        assertThat(turns.get(0).extraction()).isPresent();
        assertThat(turns.get(0).touchedFields()).isNull();
        assertThat(profiles.find(profile.id()).orElseThrow().data().isEmpty()).isTrue();
    }

    @Test
    void failedTurnLogShouldNotFailTheTurn() throws Exception {
        FaultyConversationStore faultyConversations = new FaultyConversationStore(conversations);
        faultyConversations.failAppendTurn = true;
        TurnExecutor faulty = executorWith(profiles, faultyConversations);
        Profile profile = profiles.create();
        provider.reply(List.of("Great, Denver it is."), Map.of("location", "Denver"));
        RecordingSink sink = new RecordingSink();

        TurnResult result = faulty.execute(profile.id(), "Denver", settings(), sink);

        assertThat(result.succeeded()).isTrue();
        assertThat(sink.types()).containsExactly(TurnEventType.CONTENT, TurnEventType.EXTRACTION, TurnEventType.DONE);
        assertThat(conversations.listTurns(result.sessionId())).isEmpty();
        assertThat(profiles.find(profile.id()).orElseThrow().data().get("location")).contains("Denver");
    }

    @Test
    void storeFaultWhileLoadingContextShouldEmitOneErrorAndWriteNothing() throws Exception {
        FaultyConversationStore faultyConversations = new FaultyConversationStore(conversations);
        faultyConversations.failActiveSession = true;
        TurnExecutor faulty = executorWith(profiles, faultyConversations);
        Profile profile = profiles.create();
        provider.reply(List.of("unused"), Map.of("location", "Denver"));
        RecordingSink sink = new RecordingSink();

        TurnResult result = faulty.execute(profile.id(), "hello", settings(), sink);

        assertThat(result.state()).isEqualTo(TurnState.ERROR);
        assertThat(sink.types()).containsExactly(TurnEventType.ERROR);
        assertThat(sink.events.get(0).error()).isEqualTo("Unable to load the conversation. Please try again.");
        assertThat(provider.requests).isEmpty();
        assertThat(conversations.listAllSessions()).isEmpty();
        assertThat(profiles.find(profile.id()).orElseThrow().data().isEmpty()).isTrue();
    }

    private TurnExecutor executorWith(ProfileStore profileStore, ConversationStore conversationStore) {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(provider);
        return new TurnExecutor(new ProviderRouter(registry), profileStore, conversationStore);
    }

    private TurnSettings settings() {
        return new TurnSettings(null, "scripted", "gpt-4o", 20, true, ResponseMode.TOOLS, 0.8);
    }

    private static final class RecordingSink implements TurnEventSink {
        private final List<TurnEvent> events = new ArrayList<>();
        private int closeAfter = Integer.MAX_VALUE;

        @Override
        public void accept(TurnEvent event) {
            events.add(event);
        }

        @Override
        public boolean isOpen() {
            return events.size() < closeAfter;
        }

        private List<TurnEventType> types() {
            return events.stream().map(TurnEvent::type).toList();
        }
    }

    private static final class ScriptedProvider implements LlmProvider {
        private final List<LlmRequest> requests = new ArrayList<>();
        private List<String> fragments = List.of();
        private Map<String, Object> arguments;
        private Map<String, Object> structured;
        private String error;

        void reply(List<String> fragments, Map<String, Object> arguments) {
            this.fragments = fragments;
            this.arguments = arguments;
            this.structured = null;
            this.error = null;
        }

        void envelope(String message, Map<String, Object> extractedData) {
            reply(List.of(message), null);
            this.structured = extractedData;
        }

        void fail(String error) {
            reply(List.of(), null);
            this.error = error;
        }

        @Override
        public String name() {
            return "scripted";
        }

        @Override
        public LlmResponse stream(LlmRequest request, StreamListener listener) {
            requests.add(request);
            if (error != null) {
                return LlmResponse.failure(error);
            }
            StringBuilder sent = new StringBuilder();
            for (String fragment : fragments) {
                if (listener.cancelled()) {
                    return LlmResponse.cancelledBy(sent.toString());
                }
                sent.append(fragment);
                if (!listener.onDelta(fragment)) {
                    return LlmResponse.cancelledBy(sent.toString());
                }
            }
            List<ToolCall> calls = arguments == null
                ? List.of()
                : List.of(new ToolCall("call_1", ProfileSchema.UPDATE_PROFILE_TOOL, arguments, "{}"));
            return new LlmResponse(sent.toString(), sent.toString(), calls, structured, Map.of(), null, false);
        }
    }

    private static final class FaultyProfileStore implements ProfileStore {
        private final ProfileStore delegate;
        private boolean failApplyDelta;

        FaultyProfileStore(ProfileStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public Profile create() throws IOException {
            return delegate.create();
        }

        @Override
        public Optional<Profile> find(String profileId) throws IOException {
            return delegate.find(profileId);
        }

        @Override
        public List<Profile> list() throws IOException {
            return delegate.list();
        }

        @Override
        public Profile applyDelta(String profileId, ProfileData delta) throws IOException {
            if (failApplyDelta) {
                throw new IOException("disk I/O error");
            }
            return delegate.applyDelta(profileId, delta);
        }

        @Override
        public void markCompleted(String profileId) throws IOException {
            delegate.markCompleted(profileId);
        }
    }

    private static final class FaultyConversationStore implements ConversationStore {
        private final ConversationStore delegate;
        private boolean failActiveSession;
        private boolean failAppendTurn;

        FaultyConversationStore(ConversationStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public ConversationSession getOrCreateActiveSession(String profileId) throws IOException {
            if (failActiveSession) {
                throw new IOException("database is locked");
            }
            return delegate.getOrCreateActiveSession(profileId);
        }

        @Override
        public ConversationTurn appendTurn(
            String sessionId,
            String userMessage,
            String agentReply,
            String rawModelOutput,
            ProfileData extractedData,
            List<String> touchedFields
        ) throws IOException {
            if (failAppendTurn) {
                throw new IOException("database is locked");
            }
            return delegate.appendTurn(sessionId, userMessage, agentReply, rawModelOutput, extractedData, touchedFields);
        }

        @Override
        public List<ChatMessage> boundedHistory(String sessionId, int maxTurns) throws IOException {
            return delegate.boundedHistory(sessionId, maxTurns);
        }

        @Override
        public ConversationSession endSession(String sessionId) throws IOException {
            return delegate.endSession(sessionId);
        }

        @Override
        public ConversationStats computeStats(String sessionId) throws IOException {
            return delegate.computeStats(sessionId);
        }

        @Override
        public Optional<ConversationSession> findSession(String sessionId) throws IOException {
            return delegate.findSession(sessionId);
        }

        @Override
        public List<ConversationSession> listSessions(String profileId) throws IOException {
            return delegate.listSessions(profileId);
        }

        @Override
        public List<ConversationSession> listAllSessions() throws IOException {
            return delegate.listAllSessions();
        }

        @Override
        public List<ConversationTurn> listTurns(String sessionId) throws IOException {
            return delegate.listTurns(sessionId);
        }
    }
}
