package io.hearth.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hearth.core.agent.TurnExecutor;
import io.hearth.core.config.ConfigService;
import io.hearth.core.extraction.ProfileExtractor;
import io.hearth.core.profile.Profile;
import io.hearth.core.profile.ProfileData;
import io.hearth.core.profile.SqliteProfileStore;
import io.hearth.core.provider.EchoProvider;
import io.hearth.core.provider.ProviderRegistry;
import io.hearth.core.provider.ProviderRouter;
import io.hearth.core.session.SessionStatus;
import io.hearth.core.session.SqliteConversationStore;
import io.hearth.core.storage.SqliteDatabase;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class InspectorCommandsTest {

    @TempDir
    Path tempDir;

    private SqliteProfileStore profiles;
    private SqliteConversationStore conversations;
    private CommandLine commandLine;
    private String profileId;
    private String sessionId;

    @BeforeEach
    void setUp() throws Exception {
        SqliteDatabase database = new SqliteDatabase(tempDir.resolve("hearth.db"));
        profiles = new SqliteProfileStore(database, new ProfileExtractor(), Clock.systemUTC());
        conversations = new SqliteConversationStore(database, Clock.systemUTC());
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new EchoProvider("echo"));
        TurnExecutor executor = new TurnExecutor(new ProviderRouter(registry), profiles, conversations);
        commandLine = HearthCommandLine.create(
            new CliContext(executor, profiles, conversations, new ConfigService(), tempDir.resolve("config.json")));

        Profile profile = profiles.create();
        profileId = profile.id();
        profiles.applyDelta(profileId, ProfileData.of(Map.of("location", "Denver")));
        sessionId = conversations.getOrCreateActiveSession(profileId).id();
        conversations.appendTurn(sessionId, "Hi, I'm in Denver", "Welcome!", "{}",
            ProfileData.of(Map.of("location", "Denver")), List.of("location"));
        conversations.appendTurn(sessionId, "What next?", "Which languages do you speak?", "{}", null, null);
    }

    @Test
    void listShouldShowProfilesAndSessions() {
        Captured captured = run("list");

        assertThat(captured.code).isZero();
        assertThat(captured.out)
            .contains("Total profiles: 1")
            .contains("Location: Denver")
            .contains(sessionId + " (ACTIVE)")
            .contains("Turns: 2");
    }

    @Test
    void showShouldPrintTurnHistory() {
        Captured captured = run("show", sessionId);

        assertThat(captured.code).isZero();
        assertThat(captured.out)
            .contains("--- Turn 1")
            .contains("User: Hi, I'm in Denver")
            .contains("Agent: Which languages do you speak?")
            .contains("Extracted: location");
        assertThat(run("show", "missing").code).isEqualTo(1);
    }

    @Test
    void statsShouldReportCoverage() {
        Captured captured = run("stats", sessionId);

        assertThat(captured.code).isZero();
        assertThat(captured.out)
            .contains("Turns: 2")
            .contains("Fields extracted: 1/20")
            .contains("Completion: 5%")
            .contains("  - location");

        Captured missing = run("stats", "missing");
        assertThat(missing.code).isEqualTo(1);
        assertThat(missing.err).contains("Stats command failed: Unknown session: missing");
    }

    @Test
    void exportShouldWriteSessionTurnsAndProfile() throws Exception {
        Path target = tempDir.resolve("exports/session.json");

        Captured captured = run("export", sessionId, target.toString());

        assertThat(captured.code).isZero();
        assertThat(captured.out).contains("Exported to");
        JsonNode exported = new ObjectMapper().readTree(Files.readString(target));
        assertThat(exported.path("session").path("id").asText()).isEqualTo(sessionId);
        assertThat(exported.path("turns")).hasSize(2);
        assertThat(exported.path("turns").get(0).path("extractedData").path("location").asText()).isEqualTo("Denver");
        assertThat(exported.path("turns").get(1).path("extractedData").isNull()).isTrue();
        assertThat(exported.path("profile").path("fields").path("location").asText()).isEqualTo("Denver");
    }

    @Test
    void endShouldCompleteSession() throws Exception {
        Captured captured = run("end", sessionId);

        assertThat(captured.code).isZero();
        assertThat(captured.out).contains("is COMPLETED");
        assertThat(conversations.findSession(sessionId).orElseThrow().status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(run("end", "missing").code).isEqualTo(1);
    }

    @Test
    void analyticsShouldRankExtractedFields() {
        Captured captured = run("analytics", "--top", "5");

        assertThat(captured.code).isZero();
        assertThat(captured.out)
            .contains("Total sessions: 1 (1 active, 0 completed)")
            .contains("Turns with extraction: 1")
            .contains("location: 1 times");
    }

    @Test
    void initAndStatusShouldManageConfig() {
        Captured init = run("init");
        Captured status = run("status");

        assertThat(init.code).isZero();
        assertThat(init.out).contains("Created config: " + tempDir.resolve("config.json"));
        assertThat(Files.exists(tempDir.resolve("config.json"))).isTrue();
        assertThat(status.code).isZero();
        assertThat(status.out)
            .contains("Config exists: true")
            .contains("Default model: gpt-4o-2024-08-06")
            .contains("OpenAI configured: false")
            .contains("Turns: mode=tools, strict=true, history=20, temperature=0.80")
            .contains("Sessions: ");
    }

    @Test
    void gatewayShouldFailWithoutRunner() {
        Captured captured = run("gateway", "--port", "0");

        assertThat(captured.code).isEqualTo(1);
        assertThat(captured.err).contains("gateway runner is not configured");
    }

    @Test
    void gatewayShouldRejectOutOfRangePort() {
        Captured captured = run("gateway", "--port", "70000");

        assertThat(captured.code).isEqualTo(2);
        assertThat(captured.err).contains("--port must be between 0 and 65535");
    }

    private Captured run(String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            code = commandLine.execute(args);
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
        return new Captured(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    private record Captured(int code, String out, String err) {
    }
}
