package io.hearth.core.profile;

import java.util.Objects;

public record FieldDescriptor(String name, FieldKind kind, FieldPriority priority, String description) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        priority = priority == null ? FieldPriority.OPTIONAL : priority;
        description = description == null ? "" : description;
    }
}
