package com.talentforge.service;

import com.talentforge.model.RetrySweepResult;
import com.talentforge.model.WebhookEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Out-of-band companion to the ingress path: releases rows whose worker
 * died mid-flight, then picks up failed ledger rows whose backoff has
 * elapsed and re-enters them at the dispatcher.
 */
@Slf4j
@Service
public class WebhookRetrySweeper {

    private final IdempotencyLedger ledger;
    private final WebhookProcessingService processingService;
    private final int batchSize;

    public WebhookRetrySweeper(IdempotencyLedger ledger,
                               WebhookProcessingService processingService,
                               @Value("${webhooks.retry.batch-size:10}") int batchSize) {
        this.ledger = ledger;
        this.processingService = processingService;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${webhooks.retry.sweep-interval-ms:300000}",
               initialDelayString = "${webhooks.retry.initial-delay-ms:60000}")
    public void scheduledSweep() {
        RetrySweepResult result = sweep();
        if (result.getProcessed() > 0 || result.getSkipped() > 0 || result.getReclaimed() > 0) {
            log.info("Retry sweep: reclaimed={}, processed={}, succeeded={}, failed={}, deadLetters={}, skipped={}",
                    result.getReclaimed(), result.getProcessed(), result.getSucceeded(), result.getFailed(),
                    result.getDeadLetters(), result.getSkipped());
        }
    }

    public RetrySweepResult sweep() {
        RetrySweepResult result = new RetrySweepResult();
        result.setReclaimed(ledger.reclaimExpiredLeases(batchSize));
        List<WebhookEvent> due = ledger.findDueRetries(batchSize);

        for (WebhookEvent entry : due) {
            WebhookProcessingService.ExecutionOutcome outcome = processingService.replay(entry);
            switch (outcome) {
                case SUCCEEDED:
                    result.recordSucceeded();
                    break;
                case FAILED:
                    result.recordFailed();
                    break;
                case DEAD_LETTER:
                    result.recordDeadLetter();
                    break;
                default:
                    result.recordSkipped();
            }
        }
        return result;
    }
}
