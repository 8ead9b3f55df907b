package io.hearth.core.provider;

/**
 * Receives reply fragments as the model produces them.
 */
@FunctionalInterface
public interface StreamListener {
    StreamListener NONE = fragment -> true;

    /**
     * @return {@code false} to stop consuming the stream
     */
    boolean onDelta(String fragment);

    /**
     * Polled between stream events so a caller that has gone away stops the transfer even while no text is
     * being produced.
     */
    default boolean cancelled() {
        return false;
    }
}
