package com.talentforge.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Interview owned by a company. Only the columns the webhook engine reads
 * or writes are mapped here.
 */
@Entity
@Table(name = "interviews", indexes = {
        @Index(name = "idx_interviews_external_meeting_ref", columnList = "external_meeting_ref"),
        @Index(name = "idx_interviews_company", columnList = "company_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "transcript")
public class Interview {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "company_id", nullable = false)
    private UUID companyId;

    @Column(name = "candidate_id")
    private UUID candidateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private InterviewStatus status = InterviewStatus.SCHEDULED;

    @Enumerated(EnumType.STRING)
    @Column(name = "recording_status", nullable = false, length = 20)
    @Builder.Default
    private RecordingStatus recordingStatus = RecordingStatus.NONE;

    @Enumerated(EnumType.STRING)
    @Column(name = "transcript_status", nullable = false, length = 20)
    @Builder.Default
    private TranscriptStatus transcriptStatus = TranscriptStatus.NONE;

    @Column(name = "external_meeting_ref", length = 100)
    private String externalMeetingRef;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Column(name = "duration_minutes")
    @Builder.Default
    private Integer durationMinutes = 30;

    @Column(name = "recording_url", columnDefinition = "TEXT")
    private String recordingUrl;

    @Column(name = "recording_duration_seconds")
    private Long recordingDurationSeconds;

    @Column(name = "recording_file_size")
    private Long recordingFileSize;

    @Column(name = "recording_processed_at")
    private Instant recordingProcessedAt;

    @Column(name = "transcript", columnDefinition = "TEXT")
    private String transcript;

    @Column(name = "transcript_processed_at")
    private Instant transcriptProcessedAt;

    @Column(name = "last_webhook_event_type", length = 100)
    private String lastWebhookEventType;

    @Column(name = "last_webhook_received_at")
    private Instant lastWebhookReceivedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }

    public void recordWebhook(String eventType, Instant receivedAt) {
        this.lastWebhookEventType = eventType;
        this.lastWebhookReceivedAt = receivedAt;
    }
}
