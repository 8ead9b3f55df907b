package io.hearth.core.agent;

public enum TurnState {
    LOADING_CONTEXT,
    GENERATING,
    EXTRACTING,
    PERSISTING,
    DONE,
    ERROR,
    ABANDONED
}
