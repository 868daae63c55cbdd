package com.talentforge.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentforge.model.WebhookEvent;
import com.talentforge.model.WebhookEventStatus;
import com.talentforge.model.WebhookProvider;
import com.talentforge.repository.WebhookEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs without a surrounding test transaction so every ledger call commits
 * on its own, the same way it does in production.
 */
@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({IdempotencyLedger.class, RetryScheduler.class, IdempotencyLedgerTest.LedgerTestConfig.class})
@DisplayName("IdempotencyLedger Tests")
class IdempotencyLedgerTest {

    private static final Instant START = Instant.parse("2026-03-02T10:00:00Z");

    @Autowired
    private IdempotencyLedger ledger;

    @Autowired
    private WebhookEventRepository repository;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        clock.set(START);
    }

    private IdempotencyLedger.BeginResult begin(String eventId) {
        return ledger.tryBegin(WebhookProvider.VIDEO, eventId, "meeting.started", "123", "{\"event\":\"meeting.started\"}");
    }

    @Nested
    @DisplayName("Insert-or-ignore")
    class InsertOrIgnore {

        @Test
        @DisplayName("Should create exactly one row for repeated deliveries")
        void shouldCreateOneRowForDuplicates() {
            IdempotencyLedger.BeginResult first = begin("meeting.started-1-123");
            IdempotencyLedger.BeginResult second = begin("meeting.started-1-123");

            assertThat(first.isCreated()).isTrue();
            assertThat(second.isCreated()).isFalse();
            assertThat(second.getLedgerId()).isEqualTo(first.getLedgerId());
            assertThat(repository.count()).isEqualTo(1);
        }

        @Test
        @ExtendWith(OutputCaptureExtension.class)
        @DisplayName("Should answer a redelivery without tripping the unique constraint")
        void shouldNotLogConstraintViolationForRedelivery(CapturedOutput output) {
            begin("meeting.started-13-123");
            begin("meeting.started-13-123");

            assertThat(output).doesNotContain("uk_webhook_events_provider_event_id")
                    .doesNotContain("SqlExceptionHelper");
        }

        @Test
        @DisplayName("Should treat the same event id from another provider as distinct")
        void shouldScopeEventIdByProvider() {
            begin("shared-id");
            IdempotencyLedger.BeginResult email =
                    ledger.tryBegin(WebhookProvider.EMAIL, "shared-id", "email.opened", "em_1", "{}");

            assertThat(email.isCreated()).isTrue();
            assertThat(repository.count()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should report the existing row's status to a duplicate")
        void shouldReturnExistingStatus() {
            IdempotencyLedger.BeginResult first = begin("meeting.started-2-123");
            ledger.markProcessing(first.getLedgerId());
            ledger.markCompleted(first.getLedgerId());

            IdempotencyLedger.BeginResult duplicate = begin("meeting.started-2-123");

            assertThat(duplicate.getStatus()).isEqualTo(WebhookEventStatus.COMPLETED);
        }

        @Test
        @DisplayName("Should store a marker instead of an oversized payload")
        void shouldTruncateOversizedPayload() throws Exception {
            String huge = "{\"data\":\"" + "x".repeat(20_000) + "\"}";

            IdempotencyLedger.BeginResult result =
                    ledger.tryBegin(WebhookProvider.EMAIL, "msg_big", "email.opened", "em_1", huge);

            WebhookEvent stored = repository.findById(result.getLedgerId()).orElseThrow();
            JsonNode marker = new ObjectMapper().readTree(stored.getPayload());
            assertThat(stored.isPayloadTruncated()).isTrue();
            assertThat(marker.get("_truncated").asBoolean()).isTrue();
            assertThat(marker.get("_originalSize").asInt()).isEqualTo(huge.length());
        }
    }

    @Nested
    @DisplayName("Claims")
    class Claims {

        @Test
        @DisplayName("Should let only one worker claim a received row")
        void shouldClaimOnce() {
            IdempotencyLedger.BeginResult result = begin("meeting.started-3-123");

            assertThat(ledger.markProcessing(result.getLedgerId())).isTrue();
            assertThat(ledger.markProcessing(result.getLedgerId())).isFalse();
            assertThat(ledger.claimForRetry(result.getLedgerId())).isFalse();
        }

        @Test
        @DisplayName("Should let a failed row be claimed for retry once")
        void shouldClaimFailedRowOnce() {
            IdempotencyLedger.BeginResult result = begin("meeting.started-4-123");
            ledger.markProcessing(result.getLedgerId());
            ledger.markFailedOrDeadLetter(result.getLedgerId(), "boom");

            assertThat(ledger.claimForRetry(result.getLedgerId())).isTrue();
            assertThat(ledger.claimForRetry(result.getLedgerId())).isFalse();
        }
    }

    @Nested
    @DisplayName("Failure progression")
    class FailureProgression {

        @Test
        @DisplayName("Should back off 5, 15 then 60 minutes and dead-letter on the fourth failure")
        void shouldProgressToDeadLetter() {
            var id = begin("meeting.started-5-123").getLedgerId();
            ledger.markProcessing(id);

            assertThat(ledger.markFailedOrDeadLetter(id, "e1")).isEqualTo(WebhookEventStatus.FAILED);
            assertThat(repository.findById(id).orElseThrow().getNextRetryAt())
                    .isEqualTo(START.plus(Duration.ofMinutes(5)));

            ledger.claimForRetry(id);
            assertThat(ledger.markFailedOrDeadLetter(id, "e2")).isEqualTo(WebhookEventStatus.FAILED);
            assertThat(repository.findById(id).orElseThrow().getNextRetryAt())
                    .isEqualTo(START.plus(Duration.ofMinutes(15)));

            ledger.claimForRetry(id);
            assertThat(ledger.markFailedOrDeadLetter(id, "e3")).isEqualTo(WebhookEventStatus.FAILED);
            assertThat(repository.findById(id).orElseThrow().getNextRetryAt())
                    .isEqualTo(START.plus(Duration.ofMinutes(60)));

            ledger.claimForRetry(id);
            assertThat(ledger.markFailedOrDeadLetter(id, "e4")).isEqualTo(WebhookEventStatus.DEAD_LETTER);

            WebhookEvent dead = repository.findById(id).orElseThrow();
            assertThat(dead.getStatus()).isEqualTo(WebhookEventStatus.DEAD_LETTER);
            assertThat(dead.getAttempts()).isEqualTo(4);
            assertThat(dead.getErrorMessage()).isEqualTo("e4");
            assertThat(dead.getNextRetryAt()).isNull();
        }

        @Test
        @DisplayName("Should only return failed rows whose backoff has elapsed")
        void shouldFindDueRetries() {
            var id = begin("meeting.started-6-123").getLedgerId();
            ledger.markProcessing(id);
            ledger.markFailedOrDeadLetter(id, "boom");

            assertThat(ledger.findDueRetries(10)).isEmpty();

            clock.set(START.plus(Duration.ofMinutes(6)));

            assertThat(ledger.findDueRetries(10)).extracting(WebhookEvent::getId).containsExactly(id);
        }

        @Test
        @DisplayName("Should clear the error when a retry completes")
        void shouldClearErrorOnCompletion() {
            var id = begin("meeting.started-7-123").getLedgerId();
            ledger.markProcessing(id);
            ledger.markFailedOrDeadLetter(id, "boom");
            ledger.claimForRetry(id);

            ledger.markCompleted(id);

            WebhookEvent done = repository.findById(id).orElseThrow();
            assertThat(done.getStatus()).isEqualTo(WebhookEventStatus.COMPLETED);
            assertThat(done.getErrorMessage()).isNull();
            assertThat(done.getProcessedAt()).isEqualTo(START);
        }
    }

    @Nested
    @DisplayName("Lease expiry")
    class LeaseExpiry {

        @Test
        @DisplayName("Should release a row stuck in processing once the lease times out")
        void shouldReleaseStuckProcessingRow() {
            var id = begin("meeting.started-8-123").getLedgerId();
            ledger.markProcessing(id);
            Instant later = START.plus(Duration.ofHours(24));
            clock.set(later);

            int reclaimed = ledger.reclaimExpiredLeases(10);

            WebhookEvent released = repository.findById(id).orElseThrow();
            assertThat(reclaimed).isEqualTo(1);
            assertThat(released.getStatus()).isEqualTo(WebhookEventStatus.FAILED);
            assertThat(released.getAttempts()).isEqualTo(1);
            assertThat(released.getNextRetryAt()).isEqualTo(later);
            assertThat(released.getErrorMessage()).isEqualTo("Processing lease expired");
            assertThat(ledger.findDueRetries(10)).extracting(WebhookEvent::getId).containsExactly(id);
        }

        @Test
        @DisplayName("Should fall back to the insert time for a row never claimed")
        void shouldReleaseUnclaimedRow() {
            var id = begin("meeting.started-9-123").getLedgerId();
            clock.set(START.plus(Duration.ofMinutes(11)));

            assertThat(ledger.reclaimExpiredLeases(10)).isEqualTo(1);
            assertThat(repository.findById(id).orElseThrow().getStatus()).isEqualTo(WebhookEventStatus.FAILED);
        }

        @Test
        @DisplayName("Should leave a row alone while its lease is live")
        void shouldKeepLiveLease() {
            var id = begin("meeting.started-10-123").getLedgerId();
            ledger.markProcessing(id);
            clock.set(START.plus(Duration.ofMinutes(5)));

            assertThat(ledger.reclaimExpiredLeases(10)).isZero();
            assertThat(ledger.expireLease(repository.findById(id).orElseThrow())).isEmpty();
            assertThat(repository.findById(id).orElseThrow().getStatus()).isEqualTo(WebhookEventStatus.PROCESSING);
        }

        @Test
        @DisplayName("Should not release a row that was re-claimed after it was read")
        void shouldNotReleaseReclaimedRow() {
            var id = begin("meeting.started-11-123").getLedgerId();
            ledger.markProcessing(id);
            clock.set(START.plus(Duration.ofMinutes(30)));
            WebhookEvent staleRead = repository.findById(id).orElseThrow();
            ledger.markFailedOrDeadLetter(id, "boom");
            ledger.claimForRetry(id);

            assertThat(ledger.expireLease(staleRead)).isEmpty();
            assertThat(repository.findById(id).orElseThrow().getAttempts()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should dead-letter a stuck row that is already at the attempt ceiling")
        void shouldDeadLetterAtCeiling() {
            var id = begin("meeting.started-12-123").getLedgerId();
            ledger.markProcessing(id);
            for (int i = 0; i < 3; i++) {
                ledger.markFailedOrDeadLetter(id, "e" + i);
                ledger.claimForRetry(id);
            }
            clock.set(START.plus(Duration.ofHours(1)));

            assertThat(ledger.reclaimExpiredLeases(10)).isEqualTo(1);

            WebhookEvent dead = repository.findById(id).orElseThrow();
            assertThat(dead.getStatus()).isEqualTo(WebhookEventStatus.DEAD_LETTER);
            assertThat(dead.getAttempts()).isEqualTo(4);
            assertThat(dead.getNextRetryAt()).isNull();
        }
    }

    @Test
    @DisplayName("Should count rows for every status")
    void shouldCountByStatus() {
        begin("a");
        ledger.markProcessing(begin("b").getLedgerId());

        Map<WebhookEventStatus, Long> counts = ledger.countByStatus();

        assertThat(counts).containsEntry(WebhookEventStatus.RECEIVED, 1L)
                .containsEntry(WebhookEventStatus.PROCESSING, 1L)
                .containsEntry(WebhookEventStatus.DEAD_LETTER, 0L)
                .hasSize(WebhookEventStatus.values().length);
    }

    @TestConfiguration
    static class LedgerTestConfig {

        @Bean
        MutableClock clock() {
            return new MutableClock(START);
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }

    static class MutableClock extends Clock {

        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void set(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
