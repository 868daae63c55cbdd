package com.talentforge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentforge.exception.RejectionReason;
import com.talentforge.exception.WebhookRejectedException;
import com.talentforge.model.EmailEventType;
import com.talentforge.model.EmailWebhookEvent;
import com.talentforge.model.ProviderEvent;
import com.talentforge.model.RecordingFile;
import com.talentforge.model.ResendWebhookPayload;
import com.talentforge.model.VideoEventType;
import com.talentforge.model.VideoWebhookEvent;
import com.talentforge.model.WebhookProvider;
import com.talentforge.model.ZoomWebhookPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Turns raw provider JSON into typed events. Everything downstream works
 * on {@link VideoWebhookEvent} / {@link EmailWebhookEvent}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookPayloadParser {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ZoomWebhookPayload readZoom(String rawBody) {
        ZoomWebhookPayload payload = read(rawBody, ZoomWebhookPayload.class, WebhookProvider.VIDEO);
        if (payload.getEvent() == null || payload.getEvent().isBlank()) {
            throw malformed(WebhookProvider.VIDEO, "Missing event type");
        }
        return payload;
    }

    /**
     * @param requestTimestamp signed request timestamp, used for the event id
     *                         when the body carries no {@code event_ts}
     */
    public VideoWebhookEvent toVideoEvent(ZoomWebhookPayload payload, String requestTimestamp) {
        ZoomWebhookPayload.MeetingObject meeting = payload.getPayload() != null
                ? payload.getPayload().getObject()
                : null;
        if (meeting == null || meeting.getId() == null || meeting.getId().isBlank()) {
            throw malformed(WebhookProvider.VIDEO, "Missing meeting id");
        }

        String eventTs = payload.getEventTs() != null
                ? String.valueOf(payload.getEventTs())
                : requestTimestamp;
        if (eventTs == null) {
            throw malformed(WebhookProvider.VIDEO, "Missing event timestamp");
        }

        VideoWebhookEvent.VideoWebhookEventBuilder builder = VideoWebhookEvent.builder()
                .type(VideoEventType.fromWireName(payload.getEvent()))
                .eventType(payload.getEvent())
                .eventId(IdempotencyLedger.deriveEventId(payload.getEvent(), eventTs, meeting.getId()))
                .meetingId(meeting.getId())
                .occurredAt(payload.getEventTs() != null
                        ? Instant.ofEpochMilli(payload.getEventTs())
                        : clock.instant());

        if (meeting.getRecordingFiles() != null) {
            for (ZoomWebhookPayload.ZoomRecordingFile file : meeting.getRecordingFiles()) {
                builder.recordingFile(RecordingFile.builder()
                        .id(file.getId())
                        .recordingType(file.getRecordingType())
                        .fileType(file.getFileType())
                        .fileSize(file.getFileSize())
                        .downloadUrl(file.getDownloadUrl())
                        .playUrl(file.getPlayUrl())
                        .recordingStart(parseInstant(file.getRecordingStart()))
                        .recordingEnd(parseInstant(file.getRecordingEnd()))
                        .build());
            }
        }
        return builder.build();
    }

    public VideoWebhookEvent parseVideo(String rawBody, String requestTimestamp) {
        return toVideoEvent(readZoom(rawBody), requestTimestamp);
    }

    /**
     * @param svixId provider-assigned delivery id; may be null
     */
    public EmailWebhookEvent parseEmail(String rawBody, String svixId) {
        ResendWebhookPayload payload = read(rawBody, ResendWebhookPayload.class, WebhookProvider.EMAIL);
        if (payload.getType() == null || payload.getType().isBlank()) {
            throw malformed(WebhookProvider.EMAIL, "Missing event type");
        }
        ResendWebhookPayload.EmailData data = payload.getData();
        if (data == null || data.getEmailId() == null || data.getEmailId().isBlank()) {
            throw malformed(WebhookProvider.EMAIL, "Missing email_id");
        }

        String eventId = svixId != null && !svixId.isBlank()
                ? svixId
                : IdempotencyLedger.deriveEventId(payload.getType(), payload.getCreatedAt(), data.getEmailId());

        Instant occurredAt = parseInstant(payload.getCreatedAt());
        return EmailWebhookEvent.builder()
                .type(EmailEventType.fromWireName(payload.getType()))
                .eventType(payload.getType())
                .eventId(eventId)
                .emailId(data.getEmailId())
                .occurredAt(occurredAt != null ? occurredAt : clock.instant())
                .bounceMessage(data.getBounce() != null ? data.getBounce().getMessage() : null)
                .bounceType(data.getBounce() != null ? data.getBounce().getType() : null)
                .clickedLink(data.getClick() != null ? data.getClick().getLink() : null)
                .build();
    }

    /**
     * Re-parses a stored ledger payload for a retry. Video rows carry their
     * event id inside, so no request timestamp is needed.
     */
    public ProviderEvent reparse(WebhookProvider provider, String rawBody, String eventId) {
        if (provider == WebhookProvider.VIDEO) {
            VideoWebhookEvent parsed = parseVideo(rawBody, timestampFromEventId(eventId));
            return parsed.toBuilder().eventId(eventId).build();
        }
        return parseEmail(rawBody, eventId);
    }

    private static String timestampFromEventId(String eventId) {
        // event-ts-meetingId; the event name itself contains no dash
        String[] parts = eventId != null ? eventId.split("-", 3) : new String[0];
        return parts.length == 3 ? parts[1] : null;
    }

    private <T> T read(String rawBody, Class<T> type, WebhookProvider provider) {
        if (rawBody == null || rawBody.isBlank()) {
            throw malformed(provider, "Empty body");
        }
        try {
            T value = objectMapper.readValue(rawBody, type);
            if (value == null) {
                throw malformed(provider, "Empty body");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new WebhookRejectedException(provider, RejectionReason.MALFORMED_PAYLOAD,
                    "Invalid JSON payload", e);
        }
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp '{}'", value);
            return null;
        }
    }

    private static WebhookRejectedException malformed(WebhookProvider provider, String message) {
        return new WebhookRejectedException(provider, RejectionReason.MALFORMED_PAYLOAD, message);
    }
}
