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
public class DeadLetterView {

    private UUID id;
    private String provider;
    private String eventType;
    private String eventId;
    private String relatedEntityRef;
    private String payload;
    private int attempts;
    private int maxAttempts;
    private Instant lastAttemptAt;
    private String errorMessage;
    private Instant createdAt;

    public static DeadLetterView from(WebhookEvent event) {
        return DeadLetterView.builder()
                .id(event.getId())
                .provider(event.getProvider().getKey())
                .eventType(event.getEventType())
                .eventId(event.getEventId())
                .relatedEntityRef(event.getRelatedEntityRef())
                .payload(event.getPayload())
                .attempts(event.getAttempts())
                .maxAttempts(event.getMaxAttempts())
                .lastAttemptAt(event.getLastAttemptAt())
                .errorMessage(event.getErrorMessage())
                .createdAt(event.getCreatedAt())
                .build();
    }

    public String[] toCsvRow() {
        return new String[]{
                id != null ? id.toString() : "",
                provider,
                eventType,
                eventId,
                relatedEntityRef != null ? relatedEntityRef : "",
                String.valueOf(attempts),
                String.valueOf(maxAttempts),
                lastAttemptAt != null ? lastAttemptAt.toString() : "",
                errorMessage != null ? errorMessage : "",
                createdAt != null ? createdAt.toString() : ""
        };
    }

    public static String[] getCsvHeaders() {
        return new String[]{"Id", "Provider", "EventType", "EventId", "RelatedEntityRef",
                "Attempts", "MaxAttempts", "LastAttemptAt", "ErrorMessage", "CreatedAt"};
    }
}
