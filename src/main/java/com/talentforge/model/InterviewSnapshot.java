package com.talentforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterviewSnapshot {

    private UUID id;
    private InterviewStatus status;
    private RecordingStatus recordingStatus;
    private TranscriptStatus transcriptStatus;
    private Instant scheduledAt;
    private Integer durationMinutes;
    private String recordingUrl;
    private Long recordingDurationSeconds;
    private String lastWebhookEventType;
    private Instant lastWebhookReceivedAt;

    public static InterviewSnapshot from(Interview interview) {
        return InterviewSnapshot.builder()
                .id(interview.getId())
                .status(interview.getStatus())
                .recordingStatus(interview.getRecordingStatus())
                .transcriptStatus(interview.getTranscriptStatus())
                .scheduledAt(interview.getScheduledAt())
                .durationMinutes(interview.getDurationMinutes())
                .recordingUrl(interview.getRecordingUrl())
                .recordingDurationSeconds(interview.getRecordingDurationSeconds())
                .lastWebhookEventType(interview.getLastWebhookEventType())
                .lastWebhookReceivedAt(interview.getLastWebhookReceivedAt())
                .build();
    }
}
