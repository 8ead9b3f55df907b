package io.hearth.core.session;

import java.util.List;

public record ExtractionSummary(
    int totalSessions,
    int activeSessions,
    int completedSessions,
    int totalTurns,
    int turnsWithExtraction,
    List<FieldCount> topFields
) {
    public ExtractionSummary {
        topFields = topFields == null ? List.of() : List.copyOf(topFields);
    }

    public record FieldCount(String field, int count) {
    }
}
