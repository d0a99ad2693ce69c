package com.slotplanner.slotplanner_api.model;

import java.util.List;

/**
 * One occupied teacher window: either a single child or a declared tandem.
 */
public interface Session {

    String teacherId();

    TimeSlot slot();

    List<String> childIds();
}
