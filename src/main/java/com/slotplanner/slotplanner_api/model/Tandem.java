package com.slotplanner.slotplanner_api.model;

/**
 * Unordered pair of children allowed to share one session.
 * <p>
 * {@code priority} runs from {@value #MIN_PRIORITY} to {@value #MAX_PRIORITY}; a missing priority
 * means {@value #DEFAULT_PRIORITY}, which earns exactly the configured tandem weight.
 */
public record Tandem(String childA, String childB, String preferredTeacherId, Integer priority) {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;
    public static final int DEFAULT_PRIORITY = 5;
    public static final int LOW_PRIORITY_THRESHOLD = 3;

    public Tandem {
        if (priority == null) priority = DEFAULT_PRIORITY;
    }

    public Tandem(String childA, String childB, String preferredTeacherId) {
        this(childA, childB, preferredTeacherId, null);
    }

    public Tandem(String childA, String childB) {
        this(childA, childB, null, null);
    }

    public boolean contains(String childId) {
        return childA.equals(childId) || childB.equals(childId);
    }

    public String partnerOf(String childId) {
        if (childA.equals(childId)) return childB;
        if (childB.equals(childId)) return childA;
        throw new IllegalArgumentException("Child " + childId + " is not part of tandem " + this);
    }

    public boolean hasPreferredTeacher() {
        return preferredTeacherId != null && !preferredTeacherId.isBlank();
    }

    /** Multiplier applied to the tandem weight. */
    public double priorityFactor() {
        return (double) priority / DEFAULT_PRIORITY;
    }

    @Override
    public String toString() {
        return childA + "+" + childB;
    }
}
