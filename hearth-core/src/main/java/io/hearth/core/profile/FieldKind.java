package io.hearth.core.profile;

public enum FieldKind {
    STRING,
    STRING_LIST,
    NUMBER_MAP
}
