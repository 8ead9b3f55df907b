package io.hearth.cli;

import io.hearth.core.profile.Profile;
import io.hearth.core.session.ConversationSession;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "list", description = "List profiles with their conversation sessions")
public final class ListCommand implements Callable<Integer> {
    private final CliContext context;

    public ListCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<Profile> profiles = context.profileStore().list();
            System.out.println("Total profiles: " + profiles.size());
            for (Profile profile : profiles) {
                System.out.println();
                System.out.println("Profile: " + profile.id());
                System.out.println("  Location: " + profile.data().get("location").orElse("Not set"));
                System.out.println("  Status: " + profile.status());
                List<ConversationSession> sessions = context.conversationStore().listSessions(profile.id());
                System.out.println("  Sessions: " + sessions.size());
                for (ConversationSession session : sessions) {
                    int turns = context.conversationStore().listTurns(session.id()).size();
                    System.out.println("    - " + session.id() + " (" + session.status() + ")");
                    System.out.println("      Turns: " + turns);
                    System.out.println("      Started: " + session.startedAt());
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("List command failed: " + e.getMessage());
            return 1;
        }
    }
}
