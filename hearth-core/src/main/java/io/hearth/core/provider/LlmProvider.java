package io.hearth.core.provider;

public interface LlmProvider {
    String name();

    /**
     * Runs one completion, pushing reply fragments to {@code listener} as they arrive. Transport and API
     * errors are reported through {@link LlmResponse#failed()}, not thrown.
     */
    LlmResponse stream(LlmRequest request, StreamListener listener);

    default LlmResponse chat(LlmRequest request) {
        return stream(request, StreamListener.NONE);
    }
}
