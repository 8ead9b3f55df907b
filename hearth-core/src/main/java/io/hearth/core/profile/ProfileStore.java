package io.hearth.core.profile;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface ProfileStore {
    Profile create() throws IOException;

    Optional<Profile> find(String profileId) throws IOException;

    List<Profile> list() throws IOException;

    /**
     * Merges {@code delta} into the stored profile inside one transaction and returns the result.
     *
     * @throws IllegalArgumentException when no profile has the given id
     */
    Profile applyDelta(String profileId, ProfileData delta) throws IOException;

    void markCompleted(String profileId) throws IOException;
}
