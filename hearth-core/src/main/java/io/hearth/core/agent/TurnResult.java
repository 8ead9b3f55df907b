package io.hearth.core.agent;

import io.hearth.core.profile.ProfileData;
import java.util.List;

/**
 * Summary of an executed turn for in-process callers. The event stream remains the primary output.
 */
public record TurnResult(
    TurnState state,
    String sessionId,
    String reply,
    ProfileData delta,
    List<String> touchedFields,
    boolean sessionCompleted,
    String error
) {
    public TurnResult {
        delta = delta == null ? ProfileData.empty() : delta;
        touchedFields = touchedFields == null ? List.of() : List.copyOf(touchedFields);
        reply = reply == null ? "" : reply;
    }

    static TurnResult failed(String sessionId, String error) {
        return new TurnResult(TurnState.ERROR, sessionId, "", null, null, false, error);
    }

    static TurnResult abandoned(String sessionId) {
        return new TurnResult(TurnState.ABANDONED, sessionId, "", null, null, false, null);
    }

    public boolean succeeded() {
        return state == TurnState.DONE;
    }
}
