package io.hearth.core.extraction;

import io.hearth.core.profile.ProfileData;
import java.util.Map;

/**
 * Result of validating a whole delta: the accepted (and normalized) fields plus one reason per rejected field.
 */
public record ValidationReport(ProfileData accepted, Map<String, String> rejections) {

    public ValidationReport {
        accepted = accepted == null ? ProfileData.empty() : accepted;
        rejections = rejections == null ? Map.of() : Map.copyOf(rejections);
    }

    public boolean hasRejections() {
        return !rejections.isEmpty();
    }
}
