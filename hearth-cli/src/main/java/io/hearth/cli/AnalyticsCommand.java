package io.hearth.cli;

import io.hearth.core.session.ExtractionAnalytics;
import io.hearth.core.session.ExtractionSummary;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "analytics", description = "Show extraction analytics across all sessions")
public final class AnalyticsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--top", description = "Number of fields to rank", defaultValue = "10")
    int top;

    public AnalyticsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ExtractionSummary summary = new ExtractionAnalytics(context.conversationStore()).summary(top);
            System.out.println("Extraction analytics");
            System.out.println("Total sessions: " + summary.totalSessions()
                + " (" + summary.activeSessions() + " active, " + summary.completedSessions() + " completed)");
            System.out.println("Total turns: " + summary.totalTurns());
            System.out.println("Turns with extraction: " + summary.turnsWithExtraction());
            System.out.println("Most extracted fields:");
            summary.topFields().forEach(count ->
                System.out.println("  " + count.field() + ": " + count.count() + " times"));
            return 0;
        } catch (Exception e) {
            System.err.println("Analytics command failed: " + e.getMessage());
            return 1;
        }
    }
}
