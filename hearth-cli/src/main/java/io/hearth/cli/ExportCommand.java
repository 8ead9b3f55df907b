package io.hearth.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.hearth.core.profile.Profile;
import io.hearth.core.session.ConversationSession;
import io.hearth.core.session.ConversationTurn;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "export", description = "Export a session, its turns and its profile to a JSON file")
public final class ExportCommand implements Callable<Integer> {
    private final CliContext context;
    private final ObjectMapper mapper;

    @Parameters(index = "0", arity = "1", description = "Session id")
    String sessionId;

    @Parameters(index = "1", arity = "1", description = "Target file")
    Path target;

    public ExportCommand(CliContext context) {
        this.context = context;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public Integer call() {
        try {
            ConversationSession session = context.conversationStore().findSession(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Session not found: " + sessionId));
            List<ConversationTurn> turns = context.conversationStore().listTurns(sessionId);

            Map<String, Object> export = new LinkedHashMap<>();
            export.put("session", session);
            export.put("turns", turnsPayload(turns));
            context.profileStore().find(session.profileId()).ifPresent(profile -> export.put("profile", profilePayload(profile)));

            Path absolute = target.toAbsolutePath();
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
            Files.writeString(absolute, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(export) + System.lineSeparator());
            System.out.println("Exported to " + absolute);
            return 0;
        } catch (Exception e) {
            System.err.println("Export command failed: " + e.getMessage());
            return 1;
        }
    }

    private List<Map<String, Object>> turnsPayload(List<ConversationTurn> turns) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (ConversationTurn turn : turns) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", turn.id());
            row.put("createdAt", turn.createdAt());
            row.put("userMessage", turn.userMessage());
            row.put("agentReply", turn.agentReply());
            row.put("rawModelOutput", turn.rawModelOutput());
            row.put("extractedData", turn.extraction().map(data -> data.asMap()).orElse(null));
            row.put("touchedFields", turn.touchedFields());
            rows.add(row);
        }
        return rows;
    }

    private Map<String, Object> profilePayload(Profile profile) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", profile.id());
        payload.put("status", profile.status());
        payload.put("createdAt", profile.createdAt());
        payload.put("updatedAt", profile.updatedAt());
        payload.put("fields", profile.data().asMap());
        return payload;
    }
}
