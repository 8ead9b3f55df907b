package io.hearth.core.profile;

public enum ProfileStatus {
    IN_PROGRESS,
    COMPLETED
}
