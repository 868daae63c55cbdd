package com.talentforge.model;

/**
 * Recording sub-state. Declaration order is the only legal direction of travel.
 */
public enum RecordingStatus {
    NONE,
    IN_PROGRESS,
    PROCESSING,
    COMPLETED;

    public boolean isBefore(RecordingStatus other) {
        return ordinal() < other.ordinal();
    }
}
