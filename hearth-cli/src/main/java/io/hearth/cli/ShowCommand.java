package io.hearth.cli;

import io.hearth.core.session.ConversationSession;
import io.hearth.core.session.ConversationTurn;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "show", description = "Display the full turn history of a session")
public final class ShowCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session id")
    String sessionId;

    public ShowCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Optional<ConversationSession> session = context.conversationStore().findSession(sessionId);
            if (session.isEmpty()) {
                System.err.println("Session not found: " + sessionId);
                return 1;
            }
            List<ConversationTurn> turns = context.conversationStore().listTurns(sessionId);
            System.out.println("Session: " + sessionId);
            System.out.println("Profile: " + session.get().profileId());
            System.out.println("Status: " + session.get().status());
            System.out.println("Started: " + session.get().startedAt());
            System.out.println("Turns: " + turns.size());
            for (int i = 0; i < turns.size(); i++) {
                ConversationTurn turn = turns.get(i);
                System.out.println();
                System.out.println("--- Turn " + (i + 1) + " (" + turn.createdAt() + ") ---");
                System.out.println("User: " + turn.userMessage());
                System.out.println("Agent: " + turn.agentReply());
                if (!turn.touchedFieldsOrEmpty().isEmpty()) {
                    System.out.println("Extracted: " + String.join(", ", turn.touchedFieldsOrEmpty()));
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Show command failed: " + e.getMessage());
            return 1;
        }
    }
}
