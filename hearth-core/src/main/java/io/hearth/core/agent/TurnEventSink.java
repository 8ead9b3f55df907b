package io.hearth.core.agent;

/**
 * Receives a turn's events in order, on the executing thread. A sink that reports {@link #isOpen()} as
 * {@code false} cancels the turn: generation stops and nothing is persisted.
 */
@FunctionalInterface
public interface TurnEventSink {
    void accept(TurnEvent event);

    default boolean isOpen() {
        return true;
    }
}
