package io.hearth.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hearth.core.model.ChatMessage;
import io.hearth.core.model.MessageRole;
import io.hearth.core.model.ToolCall;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chat-completions client for OpenAI and API-compatible gateways such as OpenRouter. Replies are streamed
 * over SSE; in {@link ResponseMode#TOOLS} text fragments are forwarded as they arrive, in
 * {@link ResponseMode#JSON} the envelope is buffered and only its cleaned {@code message} is forwarded.
 */
public final class OpenAiCompatProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {
    };

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> extraHeaders;
    private final int maxAttempts;

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders
    ) {
        this(name, apiKey, apiBase, extraHeaders, 3);
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        int maxAttempts
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse stream(LlmRequest request, StreamListener listener) {
        if (apiKey.isBlank()) {
            return LlmResponse.failure("missing API key for provider " + name);
        }
        StreamListener target = listener == null ? StreamListener.NONE : listener;
        ForwardTracker tracker = new ForwardTracker(target);

        long delayMs = 250;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Request httpRequest = buildRequest(request);
                try (Response response = client.newCall(httpRequest).execute()) {
                    if (!response.isSuccessful()) {
                        String errorBody = response.body() == null ? "" : response.body().string();
                        boolean retryable = response.code() == 429 || response.code() >= 500;
                        if (retryable && attempt < maxAttempts) {
                            LOG.debug("Provider {} returned HTTP {}, retrying", name, response.code());
                            sleep(delayMs);
                            delayMs = Math.min(delayMs * 2, 2000);
                            continue;
                        }
                        return LlmResponse.failure(
                            "HTTP " + response.code() + " " + errorBody,
                            Map.of("http_status", response.code())
                        );
                    }

                    ResponseBody body = response.body();
                    if (body == null) {
                        return LlmResponse.failure("empty response body from provider " + name);
                    }

                    String contentType = response.header("Content-Type", "");
                    if (contentType.contains("text/event-stream")) {
                        return parseSse(body.source(), request.responseMode(), tracker);
                    }
                    return parseJson(body.string(), request.responseMode(), tracker);
                }
            } catch (IOException ioe) {
                // A retry after text reached the caller would duplicate it.
                if (attempt < maxAttempts && !tracker.forwarded) {
                    LOG.debug("Provider {} transport failure, retrying: {}", name, ioe.getMessage());
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                return LlmResponse.failure(ioe.getMessage() == null ? ioe.getClass().getSimpleName() : ioe.getMessage());
            }
        }
        return LlmResponse.failure("exhausted retries");
    }

    private Request buildRequest(LlmRequest request) throws JsonProcessingException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.model());
        payload.put("messages", toWireMessages(request.messages()));
        payload.put("stream", true);
        if (request.temperature() != null) {
            payload.put("temperature", request.temperature());
        }
        if (request.responseMode() == ResponseMode.JSON) {
            payload.put("response_format", responseFormat(request.responseSchema()));
        } else if (!request.tools().isEmpty()) {
            payload.put("tools", request.tools());
            payload.put("tool_choice", "auto");
        }

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);

        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json, text/event-stream");

        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private Map<String, Object> responseFormat(Map<String, Object> schema) {
        if (schema == null || schema.isEmpty()) {
            return Map.of("type", "json_object");
        }
        return Map.of(
            "type", "json_schema",
            "json_schema", Map.of("name", "agent_response", "schema", schema)
        );
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", toRoleValue(message.role()));
            row.put("content", message.content());
            wire.add(row);
        }
        return wire;
    }

    private String toRoleValue(MessageRole role) {
        return switch (role) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
        };
    }

    private LlmResponse parseJson(String body, ResponseMode mode, ForwardTracker tracker) throws IOException {
        JsonNode root = mapper.readTree(body);
        JsonNode message = root.path("choices").path(0).path("message");
        String content = message.path("content").asText("");
        List<ToolCall> toolCalls = parseToolCalls(message.path("tool_calls"));
        Map<String, Object> usage = usageAsMap(root.path("usage"));
        if (mode == ResponseMode.TOOLS && !content.isEmpty() && !tracker.onDelta(content)) {
            return LlmResponse.cancelledBy(content);
        }
        return finish(mode, content, toolCalls, usage, tracker);
    }

    private LlmResponse parseSse(BufferedSource source, ResponseMode mode, ForwardTracker tracker) throws IOException {
        StringBuilder content = new StringBuilder();
        Map<String, ToolCallBuffer> toolBuffers = new LinkedHashMap<>();
        Map<Integer, String> toolIdsByIndex = new LinkedHashMap<>();
        Map<String, Object> usage = Map.of();

        while (!source.exhausted()) {
            if (tracker.cancelled()) {
                LOG.debug("Provider {} stream cancelled by caller", name);
                return LlmResponse.cancelledBy(content.toString());
            }
            String line = source.readUtf8Line();
            if (line == null || line.isBlank() || !line.startsWith("data:")) {
                continue;
            }

            String payload = line.substring(5).trim();
            if (payload.isEmpty()) {
                continue;
            }
            if ("[DONE]".equals(payload)) {
                break;
            }

            JsonNode event = mapper.readTree(payload);
            if (event.hasNonNull("usage")) {
                usage = usageAsMap(event.path("usage"));
            }
            if (event.hasNonNull("error")) {
                return LlmResponse.failure(event.path("error").path("message").asText(event.path("error").toString()));
            }

            for (JsonNode choice : event.path("choices")) {
                JsonNode delta = choice.path("delta");
                if (delta.has("content") && !delta.path("content").isNull()) {
                    String fragment = delta.path("content").asText("");
                    content.append(fragment);
                    if (mode == ResponseMode.TOOLS && !fragment.isEmpty() && !tracker.onDelta(fragment)) {
                        return LlmResponse.cancelledBy(content.toString());
                    }
                }
                collectToolCalls(delta.path("tool_calls"), toolBuffers, toolIdsByIndex);
            }
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        for (Map.Entry<String, ToolCallBuffer> entry : toolBuffers.entrySet()) {
            ToolCallBuffer buffer = entry.getValue();
            String rawArguments = buffer.arguments.toString();
            toolCalls.add(new ToolCall(entry.getKey(), buffer.name, parseArguments(rawArguments), rawArguments));
        }

        return finish(mode, content.toString(), toolCalls, usage, tracker);
    }

    private LlmResponse finish(
        ResponseMode mode,
        String content,
        List<ToolCall> toolCalls,
        Map<String, Object> usage,
        ForwardTracker tracker
    ) {
        if (mode == ResponseMode.TOOLS) {
            return new LlmResponse(content, content, toolCalls, null, usage, null, false);
        }

        Optional<ReplyEnvelope> envelope = ReplyEnvelope.parse(mapper, content);
        if (envelope.isEmpty()) {
            return LlmResponse.failure("malformed reply envelope from provider " + name, usage);
        }
        String message = ReplyCleaner.clean(envelope.get().message());
        if (!message.isEmpty() && !tracker.onDelta(message)) {
            return LlmResponse.cancelledBy(message);
        }
        return new LlmResponse(message, content, toolCalls, envelope.get().extractedData(), usage, null, false);
    }

    private List<ToolCall> parseToolCalls(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode item : node) {
            String id = item.path("id").asText("");
            JsonNode function = item.path("function");
            String toolName = function.path("name").asText("");
            JsonNode argsNode = function.path("arguments");
            if (argsNode.isTextual()) {
                String raw = argsNode.asText("{}");
                toolCalls.add(new ToolCall(id, toolName, parseArguments(raw), raw));
            } else {
                toolCalls.add(new ToolCall(id, toolName, mapper.convertValue(argsNode, OBJECT), argsNode.toString()));
            }
        }
        return toolCalls;
    }

    private void collectToolCalls(
        JsonNode toolCallsNode,
        Map<String, ToolCallBuffer> buffers,
        Map<Integer, String> toolIdsByIndex
    ) {
        if (toolCallsNode == null || !toolCallsNode.isArray()) {
            return;
        }
        for (JsonNode toolCall : toolCallsNode) {
            int index = toolCall.path("index").asInt(-1);
            String id = toolCall.path("id").asText();
            if (id != null && !id.isBlank() && index >= 0) {
                toolIdsByIndex.put(index, id);
            }
            if ((id == null || id.isBlank()) && index >= 0 && toolIdsByIndex.containsKey(index)) {
                id = toolIdsByIndex.get(index);
            }
            if (id == null || id.isBlank()) {
                index = Math.max(index, 0);
                id = "call_" + index;
            }

            ToolCallBuffer buffer = buffers.computeIfAbsent(id, ignored -> new ToolCallBuffer());
            JsonNode function = toolCall.path("function");
            if (function.has("name")) {
                String toolName = function.path("name").asText("");
                if (!toolName.isBlank()) {
                    buffer.name = toolName;
                }
            }
            if (function.has("arguments")) {
                String argChunk = function.path("arguments").asText("");
                if (!argChunk.isEmpty()) {
                    buffer.arguments.append(argChunk);
                }
            }
        }
    }

    private Map<String, Object> usageAsMap(JsonNode usage) {
        if (usage == null || usage.isMissingNode() || usage.isNull()) {
            return Map.of();
        }
        return mapper.convertValue(usage, OBJECT);
    }

    private Map<String, Object> parseArguments(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(raw, OBJECT);
        } catch (JsonProcessingException e) {
            LOG.warn("Provider {} returned unparseable tool arguments: {}", name, e.getOriginalMessage());
            return Map.of();
        }
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class ToolCallBuffer {
        private String name = "";
        private final StringBuilder arguments = new StringBuilder();
    }

    private static final class ForwardTracker {
        private final StreamListener listener;
        private boolean forwarded;

        private ForwardTracker(StreamListener listener) {
            this.listener = listener;
        }

        private boolean onDelta(String fragment) {
            forwarded = true;
            return listener.onDelta(fragment);
        }

        private boolean cancelled() {
            return listener.cancelled();
        }
    }
}
