package io.hearth.core.profile;

public enum FieldPriority {
    CRITICAL,
    HIGH,
    OPTIONAL
}
