package com.talentforge.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Idempotency ledger row: one per externally observed webhook event.
 *
 * <p>Rows are never deleted and double as the webhook audit trail. The
 * {@code (provider, event_id)} unique constraint is what makes concurrent
 * duplicate deliveries safe; application code never checks-then-inserts.
 *
 * <h3>Lifecycle:</h3>
 * <pre>
 * RECEIVED → PROCESSING → COMPLETED
 *                       → FAILED → (sweep) PROCESSING → ...
 *                                → DEAD_LETTER
 * RECEIVED/PROCESSING past the lease timeout → FAILED or DEAD_LETTER
 * </pre>
 */
@Entity
@Table(name = "webhook_events",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_webhook_events_provider_event_id",
                columnNames = {"provider", "event_id"}),
        indexes = {
                @Index(name = "idx_webhook_events_status_next_retry", columnList = "status, next_retry_at"),
                @Index(name = "idx_webhook_events_created", columnList = "created_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "payload")
public class WebhookEvent {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false, length = 20)
    private WebhookProvider provider;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "event_id", nullable = false, length = 255)
    private String eventId;

    @Column(name = "related_entity_ref", length = 255)
    private String relatedEntityRef;

    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;

    @Column(name = "payload_truncated", nullable = false)
    @Builder.Default
    private boolean payloadTruncated = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private WebhookEventStatus status = WebhookEventStatus.RECEIVED;

    @Column(name = "attempts", nullable = false)
    @Builder.Default
    private int attempts = 0;

    @Column(name = "max_attempts", nullable = false)
    @Builder.Default
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (status == null) {
            status = WebhookEventStatus.RECEIVED;
        }
    }

    /**
     * A failed row may be re-attempted once its backoff has elapsed.
     */
    public boolean isDueForRetry(Instant now) {
        return status == WebhookEventStatus.FAILED
                && nextRetryAt != null
                && !nextRetryAt.isAfter(now);
    }

    /**
     * An in-flight row whose last claim (or insert, if never claimed) is
     * older than {@code cutoff} has lost its worker.
     */
    public boolean isLeaseExpired(Instant cutoff) {
        if (status != WebhookEventStatus.RECEIVED && status != WebhookEventStatus.PROCESSING) {
            return false;
        }
        Instant leaseStart = lastAttemptAt != null ? lastAttemptAt : createdAt;
        return leaseStart != null && leaseStart.isBefore(cutoff);
    }
}
