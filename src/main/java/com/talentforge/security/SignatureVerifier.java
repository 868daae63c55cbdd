package com.talentforge.security;

import com.talentforge.exception.WebhookRejectedException;
import com.talentforge.model.WebhookProvider;
import org.springframework.http.HttpHeaders;

/**
 * Authenticates an inbound webhook body. Pure check: no state is touched
 * and a rejection must happen before the ledger sees the event.
 */
public interface SignatureVerifier {

    WebhookProvider getProvider();

    /**
     * @throws WebhookRejectedException when the body is unsigned, forged or stale
     */
    void verify(String rawBody, HttpHeaders headers);
}
