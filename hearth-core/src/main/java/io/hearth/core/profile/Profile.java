package io.hearth.core.profile;

import java.time.Instant;
import java.util.Objects;

public record Profile(
    String id,
    ProfileStatus status,
    ProfileData data,
    Instant createdAt,
    Instant updatedAt
) {
    public Profile {
        Objects.requireNonNull(id, "id must not be null");
        status = status == null ? ProfileStatus.IN_PROGRESS : status;
        data = data == null ? ProfileData.empty() : data;
    }
}
