package io.hearth.cli;

import io.hearth.core.agent.TurnExecutor;
import io.hearth.core.config.ConfigService;
import io.hearth.core.profile.ProfileStore;
import io.hearth.core.session.ConversationStore;
import java.nio.file.Path;

public record CliContext(
    TurnExecutor executor,
    ProfileStore profileStore,
    ConversationStore conversationStore,
    ConfigService configService,
    Path configPath,
    GatewayRunner gatewayRunner
) {
    public CliContext(
        TurnExecutor executor,
        ProfileStore profileStore,
        ConversationStore conversationStore,
        ConfigService configService,
        Path configPath
    ) {
        this(executor, profileStore, conversationStore, configService, configPath, (port, host) -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }
}
