package com.talentforge.controller;

import com.talentforge.model.UrlValidationResponse;
import com.talentforge.model.VideoEventType;
import com.talentforge.model.VideoWebhookEvent;
import com.talentforge.model.WebhookAck;
import com.talentforge.model.ZoomWebhookPayload;
import com.talentforge.security.ZoomSignatureVerifier;
import com.talentforge.service.WebhookPayloadParser;
import com.talentforge.service.WebhookProcessingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/webhooks/zoom")
@RequiredArgsConstructor
public class ZoomWebhookController {

    private final ZoomSignatureVerifier signatureVerifier;
    private final WebhookPayloadParser parser;
    private final WebhookProcessingService processingService;

    /**
     * Video provider events. The URL validation challenge is answered
     * before signature checking; everything else must be signed.
     */
    @PostMapping
    public ResponseEntity<?> receive(@RequestBody(required = false) String rawBody,
                                     @RequestHeader HttpHeaders headers) {
        ZoomWebhookPayload payload = parser.readZoom(rawBody);

        if (VideoEventType.fromWireName(payload.getEvent()) == VideoEventType.URL_VALIDATION) {
            String plainToken = payload.getPayload() != null ? payload.getPayload().getPlainToken() : null;
            return validate(plainToken);
        }

        signatureVerifier.verify(rawBody, headers);

        VideoWebhookEvent event = parser.toVideoEvent(payload,
                headers.getFirst(ZoomSignatureVerifier.TIMESTAMP_HEADER));
        log.info("[zoom:{}] Received {} for meeting {}", event.getEventId(), event.getEventType(), event.getMeetingId());

        WebhookAck ack = processingService.process(event, rawBody);
        return ResponseEntity.ok(ack);
    }

    /**
     * Endpoint ownership challenge, query-string form
     */
    @GetMapping("/validation")
    public ResponseEntity<?> validationGet(@RequestParam(required = false) String plainToken) {
        return validate(plainToken);
    }

    /**
     * Endpoint ownership challenge, body form
     */
    @PostMapping("/validation")
    public ResponseEntity<?> validationPost(@RequestBody(required = false) String rawBody) {
        ZoomWebhookPayload payload = parser.readZoom(rawBody);
        String plainToken = payload.getPayload() != null ? payload.getPayload().getPlainToken() : null;
        return validate(plainToken);
    }

    private ResponseEntity<?> validate(String plainToken) {
        if (!signatureVerifier.isConfigured()) {
            log.error("[zoom] Webhook secret not configured for URL validation");
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(WebhookAck.rejected("Webhook secret not configured"));
        }
        if (plainToken == null || plainToken.isBlank()) {
            log.warn("[zoom] URL validation without plainToken");
            return ResponseEntity.badRequest().body(WebhookAck.rejected("Missing plainToken"));
        }

        log.info("[zoom] URL validation successful");
        return ResponseEntity.ok(new UrlValidationResponse(plainToken, signatureVerifier.encryptToken(plainToken)));
    }
}
