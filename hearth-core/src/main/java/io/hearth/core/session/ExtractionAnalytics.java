package io.hearth.core.session;

import io.hearth.core.profile.ProfileSchema;
import java.io.IOException;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregates extraction activity across every stored session for the inspector.
 */
public final class ExtractionAnalytics {
    public static final int DEFAULT_TOP_FIELDS = 10;

    private final ConversationStore store;

    public ExtractionAnalytics(ConversationStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public ExtractionSummary summary() throws IOException {
        return summary(DEFAULT_TOP_FIELDS);
    }

    public ExtractionSummary summary(int topLimit) throws IOException {
        List<ConversationSession> sessions = store.listAllSessions();
        Map<String, Integer> counts = new HashMap<>();
        int active = 0;
        int totalTurns = 0;
        int withExtraction = 0;

        for (ConversationSession session : sessions) {
            if (session.active()) {
                active++;
            }
            for (ConversationTurn turn : store.listTurns(session.id())) {
                totalTurns++;
                List<String> fields = turn.touchedFieldsOrEmpty();
                if (!fields.isEmpty()) {
                    withExtraction++;
                }
                fields.forEach(field -> counts.merge(field, 1, Integer::sum));
            }
        }

        // Ties keep schema order so the ranking is stable between runs.
        List<ExtractionSummary.FieldCount> top = counts.entrySet().stream()
            .map(entry -> new ExtractionSummary.FieldCount(entry.getKey(), entry.getValue()))
            .sorted(Comparator.comparingInt(ExtractionSummary.FieldCount::count).reversed()
                .thenComparingInt(count -> rank(count.field())))
            .limit(Math.max(0, topLimit))
            .toList();

        return new ExtractionSummary(sessions.size(), active, sessions.size() - active, totalTurns, withExtraction, top);
    }

    private static int rank(String field) {
        int index = ProfileSchema.indexOf(field);
        return index < 0 ? Integer.MAX_VALUE : index;
    }
}
