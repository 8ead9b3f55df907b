package io.hearth.cli;

import io.hearth.core.session.ConversationStats;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "stats", description = "Show extraction statistics for a session")
public final class StatsCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session id")
    String sessionId;

    public StatsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ConversationStats stats = context.conversationStore().computeStats(sessionId);
            System.out.println("Conversation statistics");
            System.out.println("Turns: " + stats.turnCount());
            System.out.println("Fields extracted: " + stats.fieldsCovered() + "/" + stats.totalFields());
            System.out.println("Completion: " + stats.completionPercentage() + "%");
            System.out.println("Duration: " + seconds(stats.duration().toMillis()));
            System.out.println("Avg time between turns: " + seconds(stats.averageInterTurnLatency().toMillis()));
            if (!stats.fieldsExtracted().isEmpty()) {
                System.out.println("Extracted fields:");
                stats.fieldsExtracted().forEach(field -> System.out.println("  - " + field));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Stats command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String seconds(long millis) {
        return String.format(Locale.ROOT, "%.1fs", millis / 1000.0);
    }
}
