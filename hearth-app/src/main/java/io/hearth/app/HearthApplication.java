package io.hearth.app;

import io.hearth.cli.CliContext;
import io.hearth.cli.HearthCommandLine;
import io.hearth.core.agent.TurnExecutor;
import io.hearth.core.agent.TurnSettings;
import io.hearth.core.api.GatewayServer;
import io.hearth.core.config.ConfigPaths;
import io.hearth.core.config.ConfigService;
import io.hearth.core.config.model.HearthConfig;
import io.hearth.core.config.model.ProviderConfig;
import io.hearth.core.extraction.ProfileExtractor;
import io.hearth.core.profile.ProfileStore;
import io.hearth.core.profile.SqliteProfileStore;
import io.hearth.core.provider.DisabledProvider;
import io.hearth.core.provider.EchoProvider;
import io.hearth.core.provider.FallbackLlmProvider;
import io.hearth.core.provider.LlmProvider;
import io.hearth.core.provider.OpenAiCompatProvider;
import io.hearth.core.provider.ProviderRegistry;
import io.hearth.core.provider.ProviderRouter;
import io.hearth.core.session.ConversationStore;
import io.hearth.core.session.SqliteConversationStore;
import io.hearth.core.storage.SqliteDatabase;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HearthApplication {
    private static final Logger LOG = LoggerFactory.getLogger(HearthApplication.class);

    private HearthApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        HearthConfig config = loadConfig(configService, configPath);

        ProviderRegistry providerRegistry = buildProviderRegistry(config);

        Path databasePath = ConfigPaths.resolveDatabasePath(config, System.getenv());
        ProfileStore profileStore;
        ConversationStore conversationStore;
        try {
            SqliteDatabase database = new SqliteDatabase(databasePath);
            profileStore = new SqliteProfileStore(database, new ProfileExtractor(), Clock.systemUTC());
            conversationStore = new SqliteConversationStore(database, Clock.systemUTC());
        } catch (IOException e) {
            System.err.println("Failed to open database " + databasePath + ": " + e.getMessage());
            System.exit(1);
            return;
        }

        TurnExecutor executor = new TurnExecutor(new ProviderRouter(providerRegistry), profileStore, conversationStore);
        TurnSettings gatewaySettings = ConfigService.toTurnSettings(config);

        CliContext context = new CliContext(
            executor,
            profileStore,
            conversationStore,
            configService,
            configPath,
            (port, host) -> runGateway(port, host, executor, gatewaySettings, profileStore, conversationStore)
        );

        int exitCode = HearthCommandLine.create(context).execute(args);
        System.exit(exitCode);
    }

    static ProviderRegistry buildProviderRegistry(HearthConfig config) {
        LlmProvider openai = buildOpenAiCompatProvider("openai", config.providers().openai(), "https://api.openai.com/v1");
        LlmProvider openrouter = buildOpenAiCompatProvider(
            "openrouter",
            config.providers().openrouter(),
            "https://openrouter.ai/api/v1"
        );

        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new FallbackLlmProvider("openai", List.of(openai, openrouter)));
        registry.register(new FallbackLlmProvider("openrouter", List.of(openrouter, openai)));
        registry.register(new EchoProvider("echo"));
        return registry;
    }

    private static HearthConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return HearthConfig.defaults();
        }
    }

    private static LlmProvider buildOpenAiCompatProvider(
        String name,
        ProviderConfig providerConfig,
        String defaultBase
    ) {
        if (providerConfig != null && providerConfig.configured()) {
            String apiBase = providerConfig.apiBase() == null || providerConfig.apiBase().isBlank()
                ? defaultBase
                : providerConfig.apiBase();
            return new OpenAiCompatProvider(name, providerConfig.apiKey(), apiBase, providerConfig.extraHeaders());
        }
        return DisabledProvider.missingApiKey(name);
    }

    private static int runGateway(
        int port,
        String host,
        TurnExecutor executor,
        TurnSettings settings,
        ProfileStore profileStore,
        ConversationStore conversationStore
    ) throws InterruptedException {
        CountDownLatch shutdown = new CountDownLatch(1);
        try (GatewayServer server = new GatewayServer(port, host, executor, settings, profileStore, conversationStore)) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            System.out.println("Gateway started on http://" + host + ":" + server.port());
            System.out.println("Endpoints: POST /profiles, GET /profiles/{id}, POST /chat, "
                + "GET /sessions/{id}/stats, POST /sessions/{id}/end, GET /healthz");
            shutdown.await();
        }
        return 0;
    }
}
