package com.talentforge.controller;

import com.talentforge.model.EmailWebhookEvent;
import com.talentforge.model.WebhookAck;
import com.talentforge.security.SvixSignatureVerifier;
import com.talentforge.service.WebhookPayloadParser;
import com.talentforge.service.WebhookProcessingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/webhooks/email")
@RequiredArgsConstructor
public class EmailWebhookController {

    private final SvixSignatureVerifier signatureVerifier;
    private final WebhookPayloadParser parser;
    private final WebhookProcessingService processingService;

    /**
     * Email delivery events, signed through Svix
     */
    @PostMapping
    public ResponseEntity<WebhookAck> receive(@RequestBody(required = false) String rawBody,
                                              @RequestHeader HttpHeaders headers) {
        signatureVerifier.verify(rawBody != null ? rawBody : "", headers);

        EmailWebhookEvent event = parser.parseEmail(rawBody, headers.getFirst(SvixSignatureVerifier.ID_HEADER));
        log.info("[resend:{}] Received {} for email {}", event.getEventId(), event.getEventType(), event.getEmailId());

        return ResponseEntity.ok(processingService.process(event, rawBody));
    }
}
