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
import java.util.Base64;

/**
 * Email provider scheme (Svix): {@code svix-signature} holds one or more
 * space-separated {@code v1,<base64>} entries over {@code {id}.{timestamp}.{body}}.
 * The key is the secret with its {@code whsec_} prefix stripped, base64-decoded.
 */
@Slf4j
@Component
public class SvixSignatureVerifier implements SignatureVerifier {

    public static final String ID_HEADER = "svix-id";
    public static final String TIMESTAMP_HEADER = "svix-timestamp";
    public static final String SIGNATURE_HEADER = "svix-signature";
    private static final String SECRET_PREFIX = "whsec_";
    private static final String VERSION = "v1";

    private final String secret;
    private final long toleranceSeconds;
    private final boolean allowUnsigned;
    private final Clock clock;

    public SvixSignatureVerifier(@Value("${webhooks.resend.secret:}") String secret,
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
        return WebhookProvider.EMAIL;
    }

    @Override
    public void verify(String rawBody, HttpHeaders headers) {
        if (secret == null || secret.isBlank()) {
            if (allowUnsigned) {
                log.warn("[resend] Webhook secret not configured, accepting unsigned request");
                return;
            }
            throw reject(RejectionReason.SECRET_NOT_CONFIGURED, "Webhook secret not configured");
        }

        String id = headers.getFirst(ID_HEADER);
        String timestamp = headers.getFirst(TIMESTAMP_HEADER);
        String signatures = headers.getFirst(SIGNATURE_HEADER);
        if (id == null || timestamp == null || signatures == null) {
            throw reject(RejectionReason.MISSING_HEADERS, "Missing svix headers");
        }

        TimestampWindow.check(getProvider(), timestamp, toleranceSeconds, clock);

        String expected = HmacSigner.signBase64(decodeKey(), id + "." + timestamp + "." + rawBody);
        for (String candidate : signatures.trim().split(" +")) {
            int comma = candidate.indexOf(',');
            if (comma < 0 || !VERSION.equals(candidate.substring(0, comma))) {
                continue;
            }
            if (HmacSigner.constantTimeEquals(expected, candidate.substring(comma + 1))) {
                return;
            }
        }
        throw reject(RejectionReason.SIGNATURE_INVALID, "No matching v1 signature");
    }

    private byte[] decodeKey() {
        String encoded = secret.startsWith(SECRET_PREFIX) ? secret.substring(SECRET_PREFIX.length()) : secret;
        try {
            return Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            // Not base64: use the configured value as-is
            return encoded.getBytes(StandardCharsets.UTF_8);
        }
    }

    private WebhookRejectedException reject(RejectionReason reason, String message) {
        return new WebhookRejectedException(getProvider(), reason, message);
    }
}
