package com.talentforge.service;

import com.talentforge.exception.WebhookRejectedException;
import com.talentforge.model.HandlerResult;
import com.talentforge.model.ProviderEvent;
import com.talentforge.model.WebhookAck;
import com.talentforge.model.WebhookEvent;
import com.talentforge.model.WebhookEventStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger, dispatch and retry bookkeeping for one verified event.
 *
 * <p>Not transactional: the ledger commits per statement and each handler
 * runs in its own transaction, so a handler rollback leaves the ledger row
 * behind to record the failure. Nothing past this point is reported to the
 * provider as an error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookProcessingService {

    public enum ExecutionOutcome {
        SUCCEEDED,
        FAILED,
        DEAD_LETTER,
        SKIPPED
    }

    private static final int MAX_ERROR_LENGTH = 2000;

    private final IdempotencyLedger ledger;
    private final EventDispatcher dispatcher;
    private final WebhookPayloadParser parser;
    private final RecordingPipelineTrigger pipelineTrigger;
    private final Clock clock;

    public WebhookAck process(ProviderEvent event, String rawBody) {
        String tag = event.getProvider().getKey() + ":" + event.getEventId();

        IdempotencyLedger.BeginResult begin = ledger.tryBegin(event.getProvider(), event.getEventId(),
                event.getEventType(), event.getRelatedEntityRef(), rawBody);

        if (begin.isCreated()) {
            if (!ledger.markProcessing(begin.getLedgerId())) {
                log.info("[{}] Claimed by another worker", tag);
                return WebhookAck.inProgress();
            }
            execute(begin.getLedgerId(), event);
            return WebhookAck.received();
        }

        WebhookEvent existing = begin.getEntry();
        switch (existing.getStatus()) {
            case COMPLETED:
                log.info("[{}] Already processed, returning cached acknowledgement", tag);
                return WebhookAck.cached();
            case RECEIVED:
            case PROCESSING:
                Optional<WebhookEventStatus> released = ledger.expireLease(existing);
                if (released.isEmpty()) {
                    log.info("[{}] Currently being processed", tag);
                    return WebhookAck.inProgress();
                }
                if (released.get() == WebhookEventStatus.FAILED && ledger.claimForRetry(existing.getId())) {
                    log.info("[{}] Redelivery after an expired lease, re-attempting", tag);
                    execute(existing.getId(), event);
                }
                return WebhookAck.received();
            case FAILED:
                if (existing.isDueForRetry(clock.instant()) && ledger.claimForRetry(existing.getId())) {
                    log.info("[{}] Redelivery after backoff, re-attempting", tag);
                    execute(existing.getId(), event);
                } else {
                    log.info("[{}] Failed earlier, retry scheduled for {}", tag, existing.getNextRetryAt());
                }
                return WebhookAck.received();
            case DEAD_LETTER:
            default:
                log.warn("[{}] Redelivery of a dead-lettered event ignored", tag);
                return WebhookAck.received();
        }
    }

    /**
     * Re-runs a failed ledger row from its stored payload. The conditional
     * claim makes a sweep racing a fresh redelivery safe.
     */
    public ExecutionOutcome replay(WebhookEvent entry) {
        String tag = entry.getProvider().getKey() + ":" + entry.getEventId();
        if (!ledger.claimForRetry(entry.getId())) {
            log.debug("[{}] Already claimed, skipping", tag);
            return ExecutionOutcome.SKIPPED;
        }

        if (entry.isPayloadTruncated()) {
            log.warn("[{}] Payload was truncated at intake and cannot be replayed", tag);
            ledger.markUnreplayable(entry.getId(), "Payload truncated; cannot replay");
            return ExecutionOutcome.DEAD_LETTER;
        }

        ProviderEvent event;
        try {
            event = parser.reparse(entry.getProvider(), entry.getPayload(), entry.getEventId());
        } catch (WebhookRejectedException e) {
            log.warn("[{}] Stored payload no longer parses: {}", tag, e.getMessage());
            ledger.markUnreplayable(entry.getId(), "Stored payload unparseable: " + e.getMessage());
            return ExecutionOutcome.DEAD_LETTER;
        }
        return execute(entry.getId(), event);
    }

    private ExecutionOutcome execute(UUID ledgerId, ProviderEvent event) {
        String tag = event.getProvider().getKey() + ":" + event.getEventId();

        HandlerResult result;
        try {
            result = dispatcher.dispatch(event);
        } catch (RuntimeException e) {
            log.error("[{}] Handler failed: {}", tag, e.getMessage(), e);
            WebhookEventStatus status = ledger.markFailedOrDeadLetter(ledgerId, describe(e));
            return status == WebhookEventStatus.DEAD_LETTER ? ExecutionOutcome.DEAD_LETTER : ExecutionOutcome.FAILED;
        }

        ledger.markCompleted(ledgerId);
        result.pipelineInterviewId().ifPresent(interviewId -> firePipeline(tag, interviewId));
        return ExecutionOutcome.SUCCEEDED;
    }

    private void firePipeline(String tag, UUID interviewId) {
        try {
            pipelineTrigger.trigger(interviewId);
            log.info("[{}] Pipeline triggered for interview {}", tag, interviewId);
        } catch (RuntimeException e) {
            // Executor saturated or shut down; the interview stays transcript-pending
            log.error("[{}] Could not hand off pipeline for interview {}: {}", tag, interviewId, e.getMessage());
        }
    }

    private static String describe(RuntimeException e) {
        String message = e.getClass().getSimpleName() + ": " + e.getMessage();
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
