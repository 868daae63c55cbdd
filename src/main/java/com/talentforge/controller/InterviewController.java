package com.talentforge.controller;

import com.talentforge.model.ApiResponse;
import com.talentforge.model.InterviewSnapshot;
import com.talentforge.model.RescheduleRequest;
import com.talentforge.model.TranscriptionCallback;
import com.talentforge.model.WebhookEventStatus;
import com.talentforge.service.IdempotencyLedger;
import com.talentforge.service.InterviewService;
import com.talentforge.service.TranscriptService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class InterviewController {

    private final InterviewService interviewService;
    private final TranscriptService transcriptService;
    private final IdempotencyLedger ledger;
    private final Clock clock;

    /**
     * Get interview lifecycle status
     */
    @GetMapping("/interviews/{id}")
    public ResponseEntity<ApiResponse<InterviewSnapshot>> getInterview(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success("Interview found", interviewService.getInterview(id)));
    }

    /**
     * Cancel a scheduled or running interview
     */
    @PostMapping("/interviews/{id}/cancel")
    public ResponseEntity<ApiResponse<InterviewSnapshot>> cancel(@PathVariable UUID id) {
        log.info("Cancel requested for interview {}", id);
        return ResponseEntity.ok(ApiResponse.success("Interview cancelled", interviewService.cancel(id)));
    }

    /**
     * Move a scheduled interview to a new time
     */
    @PostMapping("/interviews/{id}/reschedule")
    public ResponseEntity<ApiResponse<InterviewSnapshot>> reschedule(
            @PathVariable UUID id,
            @Valid @RequestBody RescheduleRequest request) {

        log.info("Reschedule requested for interview {}: {}", id, request.getScheduledAt());
        return ResponseEntity.ok(ApiResponse.success("Interview rescheduled", interviewService.reschedule(id, request)));
    }

    /**
     * Result posted back by the transcription service
     */
    @PostMapping("/interviews/{id}/transcript/callback")
    public ResponseEntity<ApiResponse<InterviewSnapshot>> transcriptCallback(
            @PathVariable UUID id,
            @Valid @RequestBody TranscriptionCallback callback) {

        log.info("[{}] Transcript callback received: status={}, entries={}",
                id, callback.getStatus(), callback.getTotalEntries());
        return ResponseEntity.ok(ApiResponse.success("Transcript recorded", transcriptService.applyCallback(id, callback)));
    }

    /**
     * Health check endpoint
     */
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<Map<String, Object>>> healthCheck() {
        Map<String, Long> ledgerCounts = new LinkedHashMap<>();
        ledger.countByStatus().forEach((status, count) ->
                ledgerCounts.put(status.name().toLowerCase(Locale.ROOT), count));

        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("webhookEvents", ledgerCounts);
        health.put("deadLetters", ledgerCounts.getOrDefault(
                WebhookEventStatus.DEAD_LETTER.name().toLowerCase(Locale.ROOT), 0L));
        health.put("timestamp", clock.instant().toString());

        return ResponseEntity.ok(ApiResponse.success("Service is healthy", health));
    }
}
