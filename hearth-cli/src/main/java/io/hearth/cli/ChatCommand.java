package io.hearth.cli;

import io.hearth.core.agent.TurnEvent;
import io.hearth.core.agent.TurnResult;
import io.hearth.core.agent.TurnSettings;
import io.hearth.core.config.ConfigService;
import io.hearth.core.config.model.HearthConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Send one caregiver message and stream the reply")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Message to send")
    String message;

    @Option(names = "--profile", description = "Profile id; a new profile is created when omitted")
    String profileId;

    @Option(names = {"-m", "--model"}, description = "Model override")
    String model;

    @Option(names = {"-p", "--provider"}, description = "Provider override")
    String provider;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            HearthConfig config = context.configService().load(context.configPath());
            TurnSettings defaults = ConfigService.toTurnSettings(config);
            TurnSettings settings = new TurnSettings(
                defaults.systemPrompt(),
                provider != null ? provider : defaults.provider(),
                model != null ? model : defaults.model(),
                defaults.maxHistoryTurns(),
                defaults.strictValidation(),
                defaults.responseMode(),
                defaults.temperature()
            );

            String targetProfile = profileId;
            if (targetProfile == null || targetProfile.isBlank()) {
                targetProfile = context.profileStore().create().id();
                System.err.println("Created profile " + targetProfile);
            }

            TurnResult result = context.executor().execute(targetProfile, message, settings, this::print);
            return result.succeeded() ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }

    private void print(TurnEvent event) {
        switch (event.type()) {
            case CONTENT -> {
                System.out.print(event.content());
                System.out.flush();
            }
            case EXTRACTION -> System.err.println(System.lineSeparator() + "[saved " + String.join(", ", event.fields()) + "]");
            case ERROR -> System.err.println("Chat failed: " + event.error());
            case DONE -> {
                System.out.println();
                if (event.sessionCompleted()) {
                    System.err.println("[profile complete]");
                }
            }
        }
    }
}
