package io.hearth.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.hearth.core.agent.TurnEvent;
import io.hearth.core.agent.TurnEventSink;
import io.hearth.core.agent.TurnExecutor;
import io.hearth.core.agent.TurnSettings;
import io.hearth.core.profile.Profile;
import io.hearth.core.profile.ProfileStore;
import io.hearth.core.session.ConversationSession;
import io.hearth.core.session.ConversationStats;
import io.hearth.core.session.ConversationStore;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front end for the onboarding pipeline. Turns are streamed as server-sent events, one JSON
 * {@link TurnEvent} per {@code data:} line, terminated by {@code data: [DONE]}.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final byte[] DONE_FRAME = "data: [DONE]\n\n".getBytes(StandardCharsets.UTF_8);

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final TurnExecutor executor;
    private final TurnSettings settings;
    private final ProfileStore profileStore;
    private final ConversationStore conversationStore;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(
        int port,
        String host,
        TurnExecutor executor,
        TurnSettings settings,
        ProfileStore profileStore,
        ConversationStore conversationStore
    ) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.settings = settings == null ? TurnSettings.defaults() : settings;
        this.profileStore = Objects.requireNonNull(profileStore, "profileStore must not be null");
        this.conversationStore = Objects.requireNonNull(conversationStore, "conversationStore must not be null");

        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/chat", blocking(this::handleChat))
            .addPrefixPath("/profiles", blocking(this::handleProfiles))
            .addPrefixPath("/sessions", blocking(this::handleSessions));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleProfiles(HttpServerExchange exchange) throws IOException {
        String id = trimSlashes(exchange.getRelativePath());
        if (id.isEmpty()) {
            if (isMethod(exchange, "POST")) {
                sendJson(exchange, 201, profilePayload(profileStore.create()));
                return;
            }
            if (isMethod(exchange, "GET")) {
                List<Map<String, Object>> profiles = profileStore.list().stream().map(this::profilePayload).toList();
                sendJson(exchange, 200, Map.of("profiles", profiles));
                return;
            }
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        if (!isMethod(exchange, "GET") || id.contains("/")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        Optional<Profile> profile = profileStore.find(id);
        if (profile.isEmpty()) {
            sendJson(exchange, 404, Map.of("error", "profile_not_found"));
            return;
        }
        sendJson(exchange, 200, profilePayload(profile.get()));
    }

    private void handleSessions(HttpServerExchange exchange) throws IOException {
        String[] parts = trimSlashes(exchange.getRelativePath()).split("/");
        if (parts.length != 2 || parts[0].isBlank()) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        String sessionId = parts[0];
        switch (parts[1]) {
            case "stats" -> {
                if (!isMethod(exchange, "GET")) {
                    sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
                    return;
                }
                if (conversationStore.findSession(sessionId).isEmpty()) {
                    sendJson(exchange, 404, Map.of("error", "session_not_found"));
                    return;
                }
                sendJson(exchange, 200, statsPayload(conversationStore.computeStats(sessionId)));
            }
            case "end" -> {
                if (!isMethod(exchange, "POST")) {
                    sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
                    return;
                }
                if (conversationStore.findSession(sessionId).isEmpty()) {
                    sendJson(exchange, 404, Map.of("error", "session_not_found"));
                    return;
                }
                sendJson(exchange, 200, sessionPayload(conversationStore.endSession(sessionId)));
            }
            default -> sendJson(exchange, 404, Map.of("error", "not_found"));
        }
    }

    private void handleChat(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "POST")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        JsonNode body = readJsonBody(exchange);
        String profileId = body.path("profileId").asText("").trim();
        String message = body.path("message").asText("");
        if (profileId.isEmpty()) {
            sendJson(exchange, 400, Map.of("error", "profile_id_required"));
            return;
        }
        if (message.isBlank()) {
            sendJson(exchange, 400, Map.of("error", "message_required"));
            return;
        }

        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/event-stream; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-cache");
        SseSink sink = new SseSink(exchange);
        executor.execute(profileId, message, settings, sink);
        sink.finish();
    }

    private Map<String, Object> profilePayload(Profile profile) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", profile.id());
        payload.put("status", profile.status().name());
        payload.put("createdAt", profile.createdAt());
        payload.put("updatedAt", profile.updatedAt());
        payload.put("fields", profile.data().asMap());
        return payload;
    }

    private Map<String, Object> sessionPayload(ConversationSession session) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", session.id());
        payload.put("profileId", session.profileId());
        payload.put("status", session.status().name());
        payload.put("startedAt", session.startedAt());
        payload.put("lastUpdatedAt", session.lastUpdatedAt());
        payload.put("version", session.version());
        return payload;
    }

    private Map<String, Object> statsPayload(ConversationStats stats) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turnCount", stats.turnCount());
        payload.put("fieldsExtracted", stats.fieldsExtracted());
        payload.put("fieldsCovered", stats.fieldsCovered());
        payload.put("totalFields", stats.totalFields());
        payload.put("completionPercentage", stats.completionPercentage());
        payload.put("durationMs", stats.duration().toMillis());
        payload.put("averageInterTurnLatencyMs", stats.averageInterTurnLatency().toMillis());
        return payload;
    }

    private HttpHandler blocking(ExchangeHandler handler) {
        return exchange -> {
            if (exchange.isInIoThread()) {
                exchange.dispatch(() -> runHandler(handler, exchange));
                return;
            }
            runHandler(handler, exchange);
        };
    }

    private void runHandler(ExchangeHandler handler, HttpServerExchange exchange) {
        try {
            exchange.startBlocking();
            handler.handle(exchange);
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, e);
        } catch (Exception e) {
            LOG.warn("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendError(exchange, 500, e);
        } finally {
            exchange.endExchange();
        }
    }

    private void sendError(HttpServerExchange exchange, int status, Exception error) {
        if (exchange.isResponseStarted()) {
            return;
        }
        try {
            sendJson(exchange, status, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException e) {
            LOG.debug("Could not report failure to client", e);
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        if (exchange.isBlocking()) {
            exchange.getOutputStream().write(body);
            return;
        }
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(bytes);
    }

    private boolean isMethod(HttpServerExchange exchange, String method) {
        return method.equalsIgnoreCase(exchange.getRequestMethod().toString());
    }

    private static String trimSlashes(String path) {
        String trimmed = path == null ? "" : path;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpServerExchange exchange) throws Exception;
    }

    /**
     * Writes events straight to the response. A failed write means the client has gone, which closes the
     * sink and lets the executor abandon the turn.
     */
    private final class SseSink implements TurnEventSink {
        private final HttpServerExchange exchange;
        private final OutputStream out;
        private volatile boolean open = true;

        private SseSink(HttpServerExchange exchange) {
            this.exchange = exchange;
            this.out = exchange.getOutputStream();
        }

        @Override
        public void accept(TurnEvent event) {
            if (!isOpen()) {
                return;
            }
            try {
                String frame = "data: " + mapper.writeValueAsString(event.toPayload()) + "\n\n";
                out.write(frame.getBytes(StandardCharsets.UTF_8));
                out.flush();
            } catch (IOException e) {
                LOG.debug("SSE client disconnected: {}", e.getMessage());
                open = false;
            }
        }

        @Override
        public boolean isOpen() {
            return open && exchange.getConnection().isOpen();
        }

        private void finish() {
            if (!isOpen()) {
                return;
            }
            try {
                out.write(DONE_FRAME);
                out.flush();
            } catch (IOException e) {
                LOG.debug("SSE client disconnected before end of stream: {}", e.getMessage());
                open = false;
            }
        }
    }
}
