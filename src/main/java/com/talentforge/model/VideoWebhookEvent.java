package com.talentforge.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Value
@Builder(toBuilder = true)
public class VideoWebhookEvent implements ProviderEvent {

    VideoEventType type;
    String eventType;
    String eventId;
    String meetingId;
    Instant occurredAt;
    @Singular
    List<RecordingFile> recordingFiles;

    @Override
    public WebhookProvider getProvider() {
        return WebhookProvider.VIDEO;
    }

    @Override
    public String getRelatedEntityRef() {
        return meetingId;
    }

    /**
     * The artifact a completed recording is represented by: the screen-share
     * composite if present, then the active-speaker view, then the first file.
     */
    public Optional<RecordingFile> primaryRecording() {
        return recordingFiles.stream()
                .filter(file -> RecordingFile.SCREEN_WITH_SPEAKER.equals(file.getRecordingType()))
                .findFirst()
                .or(() -> recordingFiles.stream()
                        .filter(file -> RecordingFile.ACTIVE_SPEAKER.equals(file.getRecordingType()))
                        .findFirst())
                .or(() -> recordingFiles.stream().findFirst());
    }
}
