package io.hearth.cli;

import io.hearth.core.session.ConversationSession;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "end", description = "Mark a session as completed")
public final class EndCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session id")
    String sessionId;

    public EndCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ConversationSession session = context.conversationStore().endSession(sessionId);
            System.out.println("Session " + session.id() + " is " + session.status());
            return 0;
        } catch (Exception e) {
            System.err.println("End command failed: " + e.getMessage());
            return 1;
        }
    }
}
