package io.hearth.core.session;

public enum SessionStatus {
    ACTIVE,
    COMPLETED
}
