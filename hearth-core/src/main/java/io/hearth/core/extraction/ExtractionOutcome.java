package io.hearth.core.extraction;

import io.hearth.core.profile.ProfileData;
import java.util.List;

/**
 * Either an accepted delta with the names of the fields it touches, or a rejection reason.
 */
public record ExtractionOutcome(boolean accepted, ProfileData delta, List<String> touchedFields, String reason) {

    public ExtractionOutcome {
        delta = delta == null ? ProfileData.empty() : delta;
        touchedFields = touchedFields == null ? List.of() : List.copyOf(touchedFields);
        reason = reason == null ? "" : reason;
    }

    public static ExtractionOutcome accepted(ProfileData delta, List<String> touchedFields) {
        return new ExtractionOutcome(true, delta, touchedFields, "");
    }

    public static ExtractionOutcome rejected(String reason) {
        return new ExtractionOutcome(false, ProfileData.empty(), List.of(), reason);
    }

    public boolean hasChanges() {
        return accepted && !delta.isEmpty();
    }
}
