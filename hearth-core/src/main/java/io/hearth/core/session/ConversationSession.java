package io.hearth.core.session;

import java.time.Instant;
import java.util.Objects;

public record ConversationSession(
    String id,
    String profileId,
    SessionStatus status,
    Instant startedAt,
    Instant lastUpdatedAt,
    long version
) {
    public ConversationSession {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(profileId, "profileId must not be null");
        status = status == null ? SessionStatus.ACTIVE : status;
    }

    public boolean active() {
        return status == SessionStatus.ACTIVE;
    }
}
