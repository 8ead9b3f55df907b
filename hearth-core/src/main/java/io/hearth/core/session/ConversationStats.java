package io.hearth.core.session;

import java.time.Duration;
import java.util.List;

public record ConversationStats(
    int turnCount,
    List<String> fieldsExtracted,
    int fieldsCovered,
    int totalFields,
    int completionPercentage,
    Duration duration,
    Duration averageInterTurnLatency
) {
    public ConversationStats {
        fieldsExtracted = fieldsExtracted == null ? List.of() : List.copyOf(fieldsExtracted);
        duration = duration == null ? Duration.ZERO : duration;
        averageInterTurnLatency = averageInterTurnLatency == null ? Duration.ZERO : averageInterTurnLatency;
    }
}
