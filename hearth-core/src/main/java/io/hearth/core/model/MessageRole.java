package io.hearth.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT
}
