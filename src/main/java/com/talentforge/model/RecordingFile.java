package com.talentforge.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class RecordingFile {

    public static final String SCREEN_WITH_SPEAKER = "shared_screen_with_speaker_view";
    public static final String ACTIVE_SPEAKER = "active_speaker";

    String id;
    String recordingType;
    String fileType;
    Long fileSize;
    String downloadUrl;
    String playUrl;
    Instant recordingStart;
    Instant recordingEnd;

    /**
     * Whole seconds between start and end, or {@code null} when either bound is missing.
     */
    public Long getDurationSeconds() {
        if (recordingStart == null || recordingEnd == null) {
            return null;
        }
        return Duration.between(recordingStart, recordingEnd).getSeconds();
    }
}
