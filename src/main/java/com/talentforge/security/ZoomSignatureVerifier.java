package com.talentforge.security;

import com.talentforge.exception.RejectionReason;
import com.talentforge.exception.WebhookRejectedException;
import com.talentforge.model.WebhookProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Video provider scheme: {@code x-zm-signature: v0=<hex>} over
 * {@code v0:{timestamp}:{body}}, keyed with the raw shared secret.
 */
@Slf4j
@Component
public class ZoomSignatureVerifier implements SignatureVerifier {

    public static final String SIGNATURE_HEADER = "x-zm-signature";
    public static final String TIMESTAMP_HEADER = "x-zm-request-timestamp";
    private static final String VERSION_PREFIX = "v0=";

    private final String secret;
    private final long toleranceSeconds;
    private final boolean allowUnsigned;
    private final Clock clock;

    public ZoomSignatureVerifier(@Value("${webhooks.zoom.secret:}") String secret,
                                 @Value("${webhooks.signature.tolerance-seconds:300}") long toleranceSeconds,
                                 @Value("${webhooks.signature.allow-unsigned:false}") boolean allowUnsigned,
                                 Clock clock) {
        this.secret = secret;
        this.toleranceSeconds = toleranceSeconds;
        this.allowUnsigned = allowUnsigned;
        this.clock = clock;
    }

    @Override
    public WebhookProvider getProvider() {
        return WebhookProvider.VIDEO;
    }

    @Override
    public void verify(String rawBody, HttpHeaders headers) {
        if (!isConfigured()) {
            if (allowUnsigned) {
                log.warn("[zoom] Webhook secret not configured, accepting unsigned request");
                return;
            }
            throw reject(RejectionReason.SECRET_NOT_CONFIGURED, "Webhook secret not configured");
        }

        String signature = headers.getFirst(SIGNATURE_HEADER);
        String timestamp = headers.getFirst(TIMESTAMP_HEADER);
        if (signature == null || timestamp == null) {
            throw reject(RejectionReason.MISSING_HEADERS, "Missing signature headers");
        }

        TimestampWindow.check(getProvider(), timestamp, toleranceSeconds, clock);

        String expected = VERSION_PREFIX + HmacSigner.signHex(secretBytes(), "v0:" + timestamp + ":" + rawBody);
        if (!HmacSigner.constantTimeEquals(expected, signature)) {
            throw reject(RejectionReason.SIGNATURE_INVALID, "Signature mismatch");
        }
    }

    /**
     * Response token for the endpoint ownership challenge: hex HMAC of the
     * provider's nonce under the shared secret.
     */
    public String encryptToken(String plainToken) {
        if (!isConfigured()) {
            throw new IllegalStateException("Webhook secret not configured");
        }
        return HmacSigner.signHex(secretBytes(), plainToken);
    }

    public boolean isConfigured() {
        return secret != null && !secret.isBlank();
    }

    private byte[] secretBytes() {
        return secret.getBytes(StandardCharsets.UTF_8);
    }

    private WebhookRejectedException reject(RejectionReason reason, String message) {
        return new WebhookRejectedException(getProvider(), reason, message);
    }
}
