package io.hearth.core.agent;

import java.util.Locale;

public enum TurnEventType {
    CONTENT,
    EXTRACTION,
    ERROR,
    DONE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
