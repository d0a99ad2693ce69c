package com.slotplanner.slotplanner_api.solver.domain;

import java.util.List;

import com.slotplanner.slotplanner_api.solver.Objective;

import ai.timefold.solver.core.api.domain.entity.PlanningEntity;
import ai.timefold.solver.core.api.domain.lookup.PlanningId;
import ai.timefold.solver.core.api.domain.valuerange.ValueRangeProvider;
import ai.timefold.solver.core.api.domain.variable.PlanningVariable;

/**
 * One child's weekly session. Unassigned when {@link #getPlacement()} is null.
 */
@PlanningEntity
public class ChildSession {

    @PlanningId
    private String childId;

    // Problem facts
    private int childIndex;
    private String groupKey;
    private int tandemIndex;
    private Objective objective;

    @ValueRangeProvider(id = "placements")
    private List<Placement> placements;

    // Planning variable
    @PlanningVariable(valueRangeProviderRefs = "placements", allowsUnassigned = true)
    private Placement placement;

    public ChildSession() {}

    public ChildSession(String childId, int childIndex, String groupKey, int tandemIndex, Objective objective,
                        List<Placement> placements) {
        this.childId = childId;
        this.childIndex = childIndex;
        this.groupKey = groupKey;
        this.tandemIndex = tandemIndex;
        this.objective = objective;
        this.placements = placements;
    }

    public String getChildId() { return childId; }
    public int getChildIndex() { return childIndex; }
    public String getGroupKey() { return groupKey; }
    public int getTandemIndex() { return tandemIndex; }
    public boolean isInTandem() { return tandemIndex >= 0; }
    public Objective getObjective() { return objective; }
    public List<Placement> getPlacements() { return placements; }
    public Placement getPlacement() { return placement; }
    public void setPlacement(Placement placement) { this.placement = placement; }

    public boolean isAssigned() { return placement != null; }
    public String getTeacherId() { return placement == null ? null : placement.getTeacherId(); }
    public int getTeacherIndex() { return placement == null ? -1 : placement.getTeacherIndex(); }
    public Long getPlacementKey() { return placement == null ? null : placement.getKey(); }
    public Integer getDayIndex() { return placement == null ? null : placement.getTimeslot().getDayIndex(); }
    public int getStartTick() { return placement == null ? -1 : placement.getTimeslot().getTick(); }

    @Override
    public String toString() {
        return childId + " -> " + placement;
    }
}
