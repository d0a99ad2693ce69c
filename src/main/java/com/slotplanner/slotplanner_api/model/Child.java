package com.slotplanner.slotplanner_api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A child to be placed in exactly one weekly session. Preferences are ordered; only the first one
 * earns credit.
 */
public record Child(String id,
                    String name,
                    Set<TimeSlot> availability,
                    List<String> preferredTeacherIds,
                    boolean earlyPreferred) {

    public Child {
        // null entries are kept so validation can report them
        availability = availability == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(availability));
        preferredTeacherIds = preferredTeacherIds == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(preferredTeacherIds));
    }

    public Optional<String> firstPreference() {
        return preferredTeacherIds.isEmpty() ? Optional.empty() : Optional.ofNullable(preferredTeacherIds.get(0));
    }
}
