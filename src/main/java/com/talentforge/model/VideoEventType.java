package com.talentforge.model;

import java.util.Arrays;

public enum VideoEventType {
    URL_VALIDATION("endpoint.url_validation"),
    RECORDING_STARTED("recording.started"),
    RECORDING_STOPPED("recording.stopped"),
    RECORDING_PAUSED("recording.paused"),
    RECORDING_RESUMED("recording.resumed"),
    RECORDING_COMPLETED("recording.completed"),
    MEETING_STARTED("meeting.started"),
    MEETING_ENDED("meeting.ended"),
    UNKNOWN(null);

    private final String wireName;

    VideoEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static VideoEventType fromWireName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(type -> name.equals(type.wireName))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
