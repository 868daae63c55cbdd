package com.talentforge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentforge.model.WebhookEvent;
import com.talentforge.model.WebhookEventStatus;
import com.talentforge.model.WebhookProvider;
import com.talentforge.repository.WebhookEventRepository;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Durable record of every webhook event seen, keyed by (provider, eventId).
 *
 * <p>Methods here are deliberately not transactional as a group: each one
 * is a single statement that commits on its own, so a handler rollback can
 * never take the ledger row with it. The unique constraint decides which of
 * two concurrent deliveries creates the row; claims are conditional updates.
 */
@Slf4j
@Service
public class IdempotencyLedger {

    private static final String TRUNCATED_MARKER = "_truncated";
    private static final String LEASE_EXPIRED = "Processing lease expired";
    private static final Set<WebhookEventStatus> IN_FLIGHT =
            EnumSet.of(WebhookEventStatus.RECEIVED, WebhookEventStatus.PROCESSING);

    private final WebhookEventRepository repository;
    private final RetryScheduler retryScheduler;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int maxPayloadChars;
    private final int maxAttempts;
    private final Duration leaseTimeout;

    public IdempotencyLedger(WebhookEventRepository repository,
                             RetryScheduler retryScheduler,
                             ObjectMapper objectMapper,
                             Clock clock,
                             @Value("${webhooks.ledger.max-payload-chars:10000}") int maxPayloadChars,
                             @Value("${webhooks.ledger.max-attempts:3}") int maxAttempts,
                             @Value("${webhooks.ledger.lease-timeout-ms:600000}") long leaseTimeoutMs) {
        this.repository = repository;
        this.retryScheduler = retryScheduler;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxPayloadChars = maxPayloadChars;
        this.maxAttempts = maxAttempts;
        this.leaseTimeout = Duration.ofMillis(leaseTimeoutMs);
    }

    /**
     * Deterministic id for providers that do not assign one.
     */
    public static String deriveEventId(String eventType, String eventTimestamp, String relatedEntityRef) {
        return eventType + "-" + eventTimestamp + "-" + relatedEntityRef;
    }

    /**
     * Insert-or-ignore on (provider, eventId). Plain redeliveries are answered
     * from the lookup; only a concurrent race reaches the unique constraint.
     */
    public BeginResult tryBegin(WebhookProvider provider, String eventId, String eventType,
                                String relatedEntityRef, String payload) {
        Optional<WebhookEvent> known = repository.findByProviderAndEventId(provider, eventId);
        if (known.isPresent()) {
            log.info("[{}:{}] Duplicate delivery, existing status {}",
                    provider.getKey(), eventId, known.get().getStatus());
            return BeginResult.alreadyExists(known.get());
        }

        WebhookEvent entry = WebhookEvent.builder()
                .provider(provider)
                .eventId(eventId)
                .eventType(eventType)
                .relatedEntityRef(relatedEntityRef)
                .status(WebhookEventStatus.RECEIVED)
                .maxAttempts(maxAttempts)
                .createdAt(clock.instant())
                .build();
        capPayload(entry, payload);

        try {
            WebhookEvent saved = repository.saveAndFlush(entry);
            log.debug("[{}:{}] Ledger row created: {}", provider.getKey(), eventId, saved.getId());
            return BeginResult.created(saved);
        } catch (DataIntegrityViolationException e) {
            // Lost the race: the row that won is the source of truth
            WebhookEvent existing = repository.findByProviderAndEventId(provider, eventId)
                    .orElseThrow(() -> e);
            log.info("[{}:{}] Concurrent duplicate delivery, existing status {}",
                    provider.getKey(), eventId, existing.getStatus());
            return BeginResult.alreadyExists(existing);
        }
    }

    /**
     * Claims a freshly created row for execution.
     */
    public boolean markProcessing(UUID ledgerId) {
        return repository.claim(ledgerId, EnumSet.of(WebhookEventStatus.RECEIVED), clock.instant()) == 1;
    }

    /**
     * Claims a failed row whose backoff has elapsed. A zero result means a
     * racing worker (sweep or redelivery) already owns it.
     */
    public boolean claimForRetry(UUID ledgerId) {
        return repository.claim(ledgerId, EnumSet.of(WebhookEventStatus.FAILED), clock.instant()) == 1;
    }

    public void markCompleted(UUID ledgerId) {
        if (repository.markCompleted(ledgerId, clock.instant()) == 0) {
            log.warn("Ledger row {} was not PROCESSING when completing", ledgerId);
        }
    }

    /**
     * Records a failed execution: schedules the next retry, or dead-letters
     * the row once the failures already recorded reach the attempt ceiling.
     *
     * @return the status the row ended in
     */
    public WebhookEventStatus markFailedOrDeadLetter(UUID ledgerId, String error) {
        WebhookEvent entry = repository.findById(ledgerId)
                .orElseThrow(() -> new IllegalStateException("Ledger row not found: " + ledgerId));
        Instant now = clock.instant();

        RetryScheduler.Decision decision = retryScheduler.classify(entry.getAttempts(), entry.getMaxAttempts());
        if (decision.isDeadLetter()) {
            repository.markDeadLetter(ledgerId, error, now);
            log.warn("[{}:{}] Dead-lettered after {} failed attempts: {}",
                    entry.getProvider().getKey(), entry.getEventId(), entry.getAttempts() + 1, error);
            return WebhookEventStatus.DEAD_LETTER;
        }

        repository.markFailed(ledgerId, decision.getNextRetryAt(), error, now);
        log.warn("[{}:{}] Attempt {} failed, next retry at {}: {}",
                entry.getProvider().getKey(), entry.getEventId(), entry.getAttempts() + 1,
                decision.getNextRetryAt(), error);
        return WebhookEventStatus.FAILED;
    }

    /**
     * Releases a received or processing row whose worker went away without
     * recording an outcome. The expiry counts as one failed attempt; the row
     * becomes due immediately, or is dead-lettered at the attempt ceiling.
     *
     * @return the status the row ended in, or empty if the lease is still
     *         live or another worker moved the row first
     */
    public Optional<WebhookEventStatus> expireLease(WebhookEvent entry) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(leaseTimeout);
        if (!entry.isLeaseExpired(cutoff)) {
            return Optional.empty();
        }

        RetryScheduler.Decision decision = retryScheduler.classify(entry.getAttempts(), entry.getMaxAttempts());
        if (decision.isDeadLetter()) {
            if (repository.expireLeaseToDeadLetter(entry.getId(), IN_FLIGHT, cutoff, LEASE_EXPIRED, now) == 0) {
                return Optional.empty();
            }
            log.warn("[{}:{}] Lease expired in {}, dead-lettered after {} attempts",
                    entry.getProvider().getKey(), entry.getEventId(), entry.getStatus(), entry.getAttempts() + 1);
            return Optional.of(WebhookEventStatus.DEAD_LETTER);
        }

        if (repository.expireLeaseToFailed(entry.getId(), IN_FLIGHT, cutoff, now, LEASE_EXPIRED, now) == 0) {
            return Optional.empty();
        }
        log.warn("[{}:{}] Lease expired in {}, released for retry",
                entry.getProvider().getKey(), entry.getEventId(), entry.getStatus());
        return Optional.of(WebhookEventStatus.FAILED);
    }

    /**
     * @return how many stuck rows were released
     */
    public int reclaimExpiredLeases(int batchSize) {
        Instant cutoff = clock.instant().minus(leaseTimeout);
        List<WebhookEvent> stuck = repository.findExpiredLeases(IN_FLIGHT, cutoff, PageRequest.of(0, batchSize));

        int reclaimed = 0;
        for (WebhookEvent entry : stuck) {
            if (expireLease(entry).isPresent()) {
                reclaimed++;
            }
        }
        return reclaimed;
    }

    /**
     * Dead-letters a row that cannot be replayed at all (claimed by the caller).
     */
    public void markUnreplayable(UUID ledgerId, String reason) {
        repository.markDeadLetter(ledgerId, reason, clock.instant());
    }

    public List<WebhookEvent> findDueRetries(int batchSize) {
        return repository.findDueRetries(clock.instant(), PageRequest.of(0, batchSize));
    }

    public Map<WebhookEventStatus, Long> countByStatus() {
        Map<WebhookEventStatus, Long> counts = new EnumMap<>(WebhookEventStatus.class);
        for (WebhookEventStatus status : WebhookEventStatus.values()) {
            counts.put(status, repository.countByStatus(status));
        }
        return counts;
    }

    private void capPayload(WebhookEvent entry, String payload) {
        if (payload == null || payload.length() <= maxPayloadChars) {
            entry.setPayload(payload);
            entry.setPayloadTruncated(false);
            return;
        }

        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put(TRUNCATED_MARKER, true);
        marker.put("_originalSize", payload.length());
        marker.put("preview", payload.substring(0, Math.min(payload.length(), maxPayloadChars / 2)));
        try {
            entry.setPayload(objectMapper.writeValueAsString(marker));
        } catch (JsonProcessingException e) {
            entry.setPayload("{\"" + TRUNCATED_MARKER + "\":true}");
        }
        entry.setPayloadTruncated(true);
    }

    @Getter
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    public static class BeginResult {

        private final boolean created;
        private final WebhookEvent entry;

        static BeginResult created(WebhookEvent entry) {
            return new BeginResult(true, entry);
        }

        static BeginResult alreadyExists(WebhookEvent entry) {
            return new BeginResult(false, entry);
        }

        public UUID getLedgerId() {
            return entry.getId();
        }

        public WebhookEventStatus getStatus() {
            return entry.getStatus();
        }
    }
}
