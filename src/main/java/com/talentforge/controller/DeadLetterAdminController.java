package com.talentforge.controller;

import com.talentforge.model.ApiResponse;
import com.talentforge.model.DeadLetterPage;
import com.talentforge.model.DeadLetterRetryRequest;
import com.talentforge.model.DeadLetterView;
import com.talentforge.model.RetrySweepResult;
import com.talentforge.service.DeadLetterService;
import com.talentforge.service.WebhookRetrySweeper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Operator endpoints. Bearer auth and rate limiting are applied by
 * interceptors registered in {@code WebMvcConfig}.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class DeadLetterAdminController {

    private final DeadLetterService deadLetterService;
    private final WebhookRetrySweeper retrySweeper;

    /**
     * List dead-lettered webhook events
     */
    @GetMapping("/webhook-dead-letters")
    public ResponseEntity<ApiResponse<DeadLetterPage>> list(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) String provider,
            @RequestParam(required = false) String eventType) {

        DeadLetterPage result = deadLetterService.list(page, limit, provider, eventType);
        return ResponseEntity.ok(ApiResponse.success("Found " + result.getTotal() + " dead letters", result));
    }

    /**
     * Requeue one dead letter for retry
     */
    @PostMapping("/webhook-dead-letters")
    public ResponseEntity<ApiResponse<DeadLetterView>> requeue(@Valid @RequestBody DeadLetterRetryRequest request) {
        log.info("Operator requeue of webhook event {}", request.getWebhookEventId());
        DeadLetterView view = deadLetterService.requeue(request.getWebhookEventId());
        return ResponseEntity.ok(ApiResponse.success("Webhook event queued for retry", view));
    }

    /**
     * Download all dead letters as CSV
     */
    @GetMapping("/webhook-dead-letters/export")
    public ResponseEntity<String> export() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"webhook-dead-letters.csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(deadLetterService.exportCsv());
    }

    /**
     * Run the retry sweep now
     */
    @PostMapping("/webhook-retries/run")
    public ResponseEntity<ApiResponse<RetrySweepResult>> runRetries() {
        RetrySweepResult result = retrySweeper.sweep();
        log.info("Manual retry sweep: processed={}, succeeded={}, failed={}, deadLetters={}",
                result.getProcessed(), result.getSucceeded(), result.getFailed(), result.getDeadLetters());
        return ResponseEntity.ok(ApiResponse.success("Retry sweep completed", result));
    }
}
