package io.hearth.core.agent;

import io.hearth.core.profile.FieldDescriptor;
import io.hearth.core.profile.FieldPriority;
import io.hearth.core.profile.Placeholders;
import io.hearth.core.profile.ProfileData;
import io.hearth.core.profile.ProfileSchema;
import java.util.List;

/**
 * A profile is complete once every critical field and more than half of the high-priority fields hold a value.
 */
public final class CompletionPolicy {

    public boolean isComplete(ProfileData data) {
        if (data == null) {
            return false;
        }
        for (FieldDescriptor field : ProfileSchema.fieldsWithPriority(FieldPriority.CRITICAL)) {
            if (!present(data, field)) {
                return false;
            }
        }
        List<FieldDescriptor> high = ProfileSchema.fieldsWithPriority(FieldPriority.HIGH);
        long covered = high.stream().filter(field -> present(data, field)).count();
        return covered * 2 > high.size();
    }

    private boolean present(ProfileData data, FieldDescriptor field) {
        return Placeholders.isPresent(data.get(field.name()).orElse(null));
    }
}
