package io.hearth.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.hearth.core.agent.TurnExecutor;
import io.hearth.core.config.ConfigService;
import io.hearth.core.extraction.ProfileExtractor;
import io.hearth.core.profile.Profile;
import io.hearth.core.profile.SqliteProfileStore;
import io.hearth.core.provider.OpenAiCompatProvider;
import io.hearth.core.provider.ProviderRegistry;
import io.hearth.core.provider.ProviderRouter;
import io.hearth.core.session.SqliteConversationStore;
import io.hearth.core.storage.SqliteDatabase;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ChatCommandIntegrationTest {

    private MockWebServer server;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldStreamReplyAndSaveExtractedFields() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody("""
                data: {"choices":[{"delta":{"content":"Great, Denver it is! "}}]}

                data: {"choices":[{"delta":{"content":"Which languages do you speak?"}}]}

                data: {"choices":[{"delta":{"tool_calls":[{"id":"call_1","index":0,"function":{"name":"update_caregiver_profile","arguments":"{\\"location\\":\\"Denver\\"}"}}]}}]}

                data: [DONE]

                """));

        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "conversation": {
                "provider": "openai",
                "model": "gpt-4o"
              }
            }
            """, StandardCharsets.UTF_8);

        SqliteDatabase database = new SqliteDatabase(tempDir.resolve("hearth.db"));
        SqliteProfileStore profiles = new SqliteProfileStore(database, new ProfileExtractor(), Clock.systemUTC());
        SqliteConversationStore conversations = new SqliteConversationStore(database, Clock.systemUTC());
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new OpenAiCompatProvider("openai", "sk-test", server.url("/v1/").toString(), Map.of(), 1));
        TurnExecutor executor = new TurnExecutor(new ProviderRouter(registry), profiles, conversations);
        CliContext context = new CliContext(executor, profiles, conversations, new ConfigService(), configPath);
        Profile profile = profiles.create();

        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int code = HearthCommandLine.create(context).execute("chat", "--profile", profile.id(), "I live in Denver");
            assertThat(code).isEqualTo(0);
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }

        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Great, Denver it is! Which languages do you speak?");
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("[saved location]");
        assertThat(profiles.find(profile.id()).orElseThrow().data().get("location")).contains("Denver");
        assertThat(conversations.listSessions(profile.id())).hasSize(1);
        assertThat(server.takeRequest().getBody().readUtf8()).contains("\"model\":\"gpt-4o\"", "update_caregiver_profile");
    }

    @Test
    void shouldCreateProfileWhenNoneGivenAndFailOnProviderError() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"bad request\"}"));

        SqliteDatabase database = new SqliteDatabase(tempDir.resolve("hearth.db"));
        SqliteProfileStore profiles = new SqliteProfileStore(database, new ProfileExtractor(), Clock.systemUTC());
        SqliteConversationStore conversations = new SqliteConversationStore(database, Clock.systemUTC());
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new OpenAiCompatProvider("openai", "sk-test", server.url("/v1/").toString(), Map.of(), 1));
        TurnExecutor executor = new TurnExecutor(new ProviderRouter(registry), profiles, conversations);
        CliContext context = new CliContext(executor, profiles, conversations, new ConfigService(), tempDir.resolve("missing.json"));

        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code;
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            code = HearthCommandLine.create(context).execute("chat", "hello");
        } finally {
            System.setErr(originalErr);
        }

        List<Profile> created = profiles.list();
        assertThat(code).isEqualTo(1);
        assertThat(created).hasSize(1);
        assertThat(err.toString(StandardCharsets.UTF_8))
            .contains("Created profile " + created.get(0).id())
            .contains("Chat failed: Unable to process your message. Please try again.");
    }
}
