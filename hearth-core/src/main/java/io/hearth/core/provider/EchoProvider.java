package io.hearth.core.provider;

import io.hearth.core.model.ChatMessage;
import io.hearth.core.model.MessageRole;
import java.util.List;
import java.util.Map;

/**
 * Offline provider that repeats the last user message word by word. Useful for trying the pipeline
 * without an API key; it never reports structured data.
 */
public final class EchoProvider implements LlmProvider {
    private final String name;

    public EchoProvider(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse stream(LlmRequest request, StreamListener listener) {
        String lastUserMessage = request.messages().stream()
            .filter(message -> message.role() == MessageRole.USER)
            .reduce((first, second) -> second)
            .map(ChatMessage::content)
            .orElse("");

        String reply = "[" + name + "] " + lastUserMessage;
        StringBuilder sent = new StringBuilder();
        for (String word : reply.split("(?<= )")) {
            if (listener.cancelled()) {
                return LlmResponse.cancelledBy(sent.toString());
            }
            sent.append(word);
            if (!listener.onDelta(word)) {
                return LlmResponse.cancelledBy(sent.toString());
            }
        }
        return LlmResponse.of(reply, List.of(), Map.of("provider", name));
    }
}
