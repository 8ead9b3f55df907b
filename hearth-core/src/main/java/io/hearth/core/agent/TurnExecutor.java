package io.hearth.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hearth.core.extraction.ExtractionOutcome;
import io.hearth.core.extraction.FieldValidator;
import io.hearth.core.extraction.ProfileExtractor;
import io.hearth.core.extraction.ValidationReport;
import io.hearth.core.model.ChatMessage;
import io.hearth.core.model.ToolCall;
import io.hearth.core.profile.Profile;
import io.hearth.core.profile.ProfileData;
import io.hearth.core.profile.ProfileSchema;
import io.hearth.core.profile.ProfileStore;
import io.hearth.core.provider.LlmProvider;
import io.hearth.core.provider.LlmRequest;
import io.hearth.core.provider.LlmResponse;
import io.hearth.core.provider.ProviderRouter;
import io.hearth.core.provider.ResponseMode;
import io.hearth.core.provider.StreamListener;
import io.hearth.core.session.ConversationSession;
import io.hearth.core.session.ConversationStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one conversation turn: loads context, streams the model reply to the caller, folds any reported
 * profile fields into the stored profile and logs the turn. Bookkeeping failures after the reply has been
 * produced are logged and never fail the turn.
 */
public final class TurnExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(TurnExecutor.class);
    private static final String GENERIC_FAILURE = "Unable to process your message. Please try again.";
    private static final String ENVELOPE_INSTRUCTION = """

        Respond with a single JSON object: {"message": "<your reply>", "extractedData": {<profile fields>}}.
        """;

    private final ProviderRouter providerRouter;
    private final ProfileStore profileStore;
    private final ConversationStore conversationStore;
    private final ProfileExtractor extractor;
    private final FieldValidator validator;
    private final CompletionPolicy completionPolicy;
    private final ObjectMapper mapper;

    public TurnExecutor(ProviderRouter providerRouter, ProfileStore profileStore, ConversationStore conversationStore) {
        this(providerRouter, profileStore, conversationStore, new ProfileExtractor(), new FieldValidator(), new CompletionPolicy());
    }

    public TurnExecutor(
        ProviderRouter providerRouter,
        ProfileStore profileStore,
        ConversationStore conversationStore,
        ProfileExtractor extractor,
        FieldValidator validator,
        CompletionPolicy completionPolicy
    ) {
        this.providerRouter = Objects.requireNonNull(providerRouter, "providerRouter must not be null");
        this.profileStore = Objects.requireNonNull(profileStore, "profileStore must not be null");
        this.conversationStore = Objects.requireNonNull(conversationStore, "conversationStore must not be null");
        this.extractor = extractor == null ? new ProfileExtractor() : extractor;
        this.validator = validator == null ? new FieldValidator() : validator;
        this.completionPolicy = completionPolicy == null ? new CompletionPolicy() : completionPolicy;
        this.mapper = new ObjectMapper();
    }

    public TurnResult execute(String profileId, String userMessage, TurnEventSink sink) {
        return execute(profileId, userMessage, TurnSettings.defaults(), sink);
    }

    public TurnResult execute(String profileId, String userMessage, TurnSettings settings, TurnEventSink sink) {
        Objects.requireNonNull(sink, "sink must not be null");
        TurnSettings effective = settings == null ? TurnSettings.defaults() : settings;
        String sessionId = null;
        try {
            if (userMessage == null || userMessage.isBlank()) {
                return fail(sink, null, "Message must not be empty");
            }

            // LOADING_CONTEXT
            List<ChatMessage> history;
            try {
                Optional<Profile> profile = profileStore.find(profileId);
                if (profile.isEmpty()) {
                    return fail(sink, null, "Profile not found: " + profileId);
                }
                ConversationSession session = conversationStore.getOrCreateActiveSession(profileId);
                sessionId = session.id();
                history = conversationStore.boundedHistory(sessionId, effective.maxHistoryTurns());
            } catch (IOException e) {
                LOG.warn("Failed to load conversation context for profile {}", profileId, e);
                return fail(sink, sessionId, "Unable to load the conversation. Please try again.");
            }
            LOG.debug("Loaded {} history messages for session {}", history.size(), sessionId);

            // GENERATING
            LlmProvider provider = providerRouter.resolve(effective.provider(), effective.model());
            LOG.debug("Using provider {} with model {}", provider.name(), effective.model());
            LlmResponse response = provider.stream(buildRequest(effective, history, userMessage), new SinkListener(sink));
            if (response.cancelled() || !sink.isOpen()) {
                LOG.info("Turn for session {} abandoned by caller", sessionId);
                return TurnResult.abandoned(sessionId);
            }
            if (response.failed()) {
                LOG.warn("Provider {} failed for session {}: {}", provider.name(), sessionId, response.error());
                return fail(sink, sessionId, GENERIC_FAILURE);
            }
            String reply = response.content();
            if (reply.isBlank()) {
                LOG.warn("Provider {} returned an empty reply for session {}", provider.name(), sessionId);
                return fail(sink, sessionId, "No response received from the AI. Please try again.");
            }

            // EXTRACTING
            Map<String, Object> payload = structuredPayload(response);
            ProfileData delta = extractDelta(payload, effective.strictValidation(), sessionId);
            List<String> touched = extractor.listTouchedFields(delta);

            // PERSISTING
            Profile updated = null;
            if (!delta.isEmpty()) {
                try {
                    updated = profileStore.applyDelta(profileId, delta);
                } catch (IOException | RuntimeException e) {
                    LOG.warn("Failed to update profile {} with fields {}", profileId, touched, e);
                }
                if (updated != null) {
                    sink.accept(TurnEvent.extraction(delta, touched));
                }
            }

            try {
                conversationStore.appendTurn(
                    sessionId,
                    userMessage,
                    reply,
                    rawModelOutput(provider, response, payload),
                    delta.isEmpty() ? null : delta,
                    updated == null ? null : touched
                );
            } catch (IOException | RuntimeException e) {
                LOG.warn("Failed to log turn for session {}", sessionId, e);
            }

            boolean completed = updated != null && completeIfReady(updated, sessionId);

            sink.accept(TurnEvent.done(completed));
            return new TurnResult(TurnState.DONE, sessionId, reply, updated == null ? null : delta,
                updated == null ? null : touched, completed, null);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure while executing turn for profile {}", profileId, e);
            return fail(sink, sessionId, GENERIC_FAILURE);
        }
    }

    private LlmRequest buildRequest(TurnSettings settings, List<ChatMessage> history, String userMessage) {
        boolean envelope = settings.responseMode() == ResponseMode.JSON;
        List<ChatMessage> messages = new ArrayList<>(history.size() + 2);
        messages.add(ChatMessage.system(envelope ? settings.systemPrompt() + ENVELOPE_INSTRUCTION : settings.systemPrompt()));
        messages.addAll(history);
        messages.add(ChatMessage.user(userMessage));
        return new LlmRequest(
            settings.model(),
            messages,
            envelope ? List.of() : List.of(ProfileSchema.toolDefinition()),
            settings.responseMode(),
            envelope ? ProfileSchema.replyEnvelopeSchema() : null,
            settings.temperature()
        );
    }

    private Map<String, Object> structuredPayload(LlmResponse response) {
        if (response.structuredData() != null) {
            return response.structuredData();
        }
        return response.toolCall(ProfileSchema.UPDATE_PROFILE_TOOL)
            .map(ToolCall::arguments)
            .orElse(null);
    }

    private ProfileData extractDelta(Map<String, Object> payload, boolean strict, String sessionId) {
        if (payload == null) {
            return ProfileData.empty();
        }
        ExtractionOutcome outcome = extractor.extract(payload);
        if (!outcome.accepted()) {
            LOG.warn("Discarded extraction for session {}: {}", sessionId, outcome.reason());
            return ProfileData.empty();
        }
        if (!strict || !outcome.hasChanges()) {
            return outcome.delta();
        }
        ValidationReport report = validator.validateAll(outcome.delta());
        report.rejections().forEach((field, reason) ->
            LOG.warn("Rejected {} for session {}: {}", field, sessionId, reason));
        return report.accepted();
    }

    private boolean completeIfReady(Profile profile, String sessionId) {
        if (!completionPolicy.isComplete(profile.data())) {
            return false;
        }
        try {
            conversationStore.endSession(sessionId);
            profileStore.markCompleted(profile.id());
            LOG.info("Profile {} complete, ended session {}", profile.id(), sessionId);
            return true;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to complete session {} for profile {}", sessionId, profile.id(), e);
            return false;
        }
    }

    private String rawModelOutput(LlmProvider provider, LlmResponse response, Map<String, Object> payload) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("provider", provider.name());
        raw.put("content", response.rawContent());
        if (!response.toolCalls().isEmpty()) {
            List<Map<String, Object>> calls = new ArrayList<>();
            for (ToolCall call : response.toolCalls()) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("id", call.id());
                item.put("name", call.name());
                item.put("arguments", call.rawArguments());
                calls.add(item);
            }
            raw.put("toolCalls", calls);
        }
        raw.put("extractedData", payload);
        if (!response.usage().isEmpty()) {
            raw.put("usage", response.usage());
        }
        try {
            return mapper.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            LOG.warn("Failed to serialize raw model output, keeping reply text only", e);
            return response.rawContent();
        }
    }

    private TurnResult fail(TurnEventSink sink, String sessionId, String message) {
        if (sink.isOpen()) {
            sink.accept(TurnEvent.error(message));
        }
        return TurnResult.failed(sessionId, message);
    }

    private static final class SinkListener implements StreamListener {
        private final TurnEventSink sink;

        private SinkListener(TurnEventSink sink) {
            this.sink = sink;
        }

        @Override
        public boolean onDelta(String fragment) {
            if (!sink.isOpen()) {
                return false;
            }
            sink.accept(TurnEvent.content(fragment));
            return sink.isOpen();
        }

        @Override
        public boolean cancelled() {
            return !sink.isOpen();
        }
    }
}
