package io.hearth.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.hearth.core.agent.TurnSettings;
import io.hearth.core.config.model.ConversationDefaults;
import io.hearth.core.config.model.HearthConfig;
import io.hearth.core.provider.ResponseMode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes {@code ~/.hearth/config.json}. Values in the file are layered over
 * {@link HearthConfig#defaults()}, so a file only needs the keys it changes.
 */
public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Loads the config at {@code configPath}, or the defaults when the file does not exist.
     *
     * @throws IOException when the file cannot be read or holds values a conversation cannot run with
     */
    public HearthConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return HearthConfig.defaults();
        }

        JsonNode fileNode = mapper.readTree(Files.readString(configPath));
        if (fileNode != null && !fileNode.isNull() && !fileNode.isObject()) {
            throw new IOException("Invalid config " + configPath + ": top level must be a JSON object");
        }
        JsonNode layered = overlay(mapper.valueToTree(HearthConfig.defaults()), fileNode);
        HearthConfig config = mapper.treeToValue(layered, HearthConfig.class);

        List<String> problems = problemsIn(config);
        if (!problems.isEmpty()) {
            throw new IOException("Invalid config " + configPath + ": " + String.join("; ", problems));
        }
        return config;
    }

    public void save(Path configPath, HearthConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    /**
     * Writes a config file, keeping an existing one's values unless {@code overwrite} is set.
     */
    public InitResult init(Path configPath, boolean overwrite, Map<String, String> env) throws IOException {
        boolean exists = Files.exists(configPath);
        HearthConfig config = exists && !overwrite ? load(configPath) : HearthConfig.defaults();
        save(configPath, config);
        return new InitResult(configPath, ConfigPaths.resolveDatabasePath(config, env), !exists, exists && overwrite);
    }

    public String toPrettyJson(HearthConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    public static TurnSettings toTurnSettings(HearthConfig config) {
        ConversationDefaults conversation = config.conversation() == null
            ? ConversationDefaults.defaults()
            : config.conversation();
        return new TurnSettings(
            null,
            conversation.provider(),
            conversation.model(),
            conversation.maxHistoryTurns(),
            conversation.strictValidation(),
            ResponseMode.fromConfig(conversation.responseMode()),
            conversation.temperature()
        );
    }

    static List<String> problemsIn(HearthConfig config) {
        List<String> problems = new ArrayList<>();
        ConversationDefaults conversation = config.conversation();
        if (conversation == null) {
            return problems;
        }
        try {
            ResponseMode.fromConfig(conversation.responseMode());
        } catch (IllegalArgumentException e) {
            problems.add("conversation.responseMode: " + e.getMessage());
        }
        if (conversation.maxHistoryTurns() < 1) {
            problems.add("conversation.maxHistoryTurns must be at least 1");
        }
        if (conversation.temperature() < 0 || conversation.temperature() > 2) {
            problems.add("conversation.temperature must be between 0 and 2");
        }
        if (conversation.model() == null || conversation.model().isBlank()) {
            problems.add("conversation.model must not be blank");
        }
        return problems;
    }

    // Objects merge key by key; any other node in the file replaces the default outright.
    private static JsonNode overlay(JsonNode defaults, JsonNode file) {
        if (defaults == null || file == null || file.isNull()) {
            return defaults == null ? file : defaults;
        }
        if (!defaults.isObject() || !file.isObject()) {
            return file;
        }
        ObjectNode result = ((ObjectNode) defaults).deepCopy();
        file.fields().forEachRemaining(entry ->
            result.set(entry.getKey(), overlay(result.get(entry.getKey()), entry.getValue()))
        );
        return result;
    }
}
