package io.hearth.cli;

import io.hearth.core.config.ConfigPaths;
import io.hearth.core.config.model.ConversationDefaults;
import io.hearth.core.config.model.HearthConfig;
import io.hearth.core.session.ConversationSession;
import io.hearth.core.session.SessionStatus;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show the active config and what is stored in the database")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            HearthConfig config = context.configService().load(context.configPath());
            ConversationDefaults conversation = config.conversation();

            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Default provider: " + conversation.provider());
            System.out.println("Default model: " + conversation.model());
            System.out.println(String.format(
                Locale.ROOT,
                "Turns: mode=%s, strict=%s, history=%d, temperature=%.2f",
                conversation.responseMode(),
                conversation.strictValidation(),
                conversation.maxHistoryTurns(),
                conversation.temperature()
            ));
            System.out.println("OpenAI configured: " + config.providers().openai().configured());
            System.out.println("OpenRouter configured: " + config.providers().openrouter().configured());
            System.out.println("Database: " + ConfigPaths.resolveDatabasePath(config, System.getenv()));
            printStorageCounts();
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }

    private void printStorageCounts() throws IOException {
        if (context.profileStore() == null || context.conversationStore() == null) {
            return;
        }
        List<ConversationSession> sessions = context.conversationStore().listAllSessions();
        long active = sessions.stream().filter(session -> session.status() == SessionStatus.ACTIVE).count();
        System.out.println("Profiles: " + context.profileStore().list().size());
        System.out.println("Sessions: " + sessions.size() + " (" + active + " active)");
    }
}
