package com.talentforge.exception;

import com.talentforge.model.WebhookProvider;
import lombok.Getter;

/**
 * A webhook that must not reach the ledger: bad signature, stale
 * timestamp, or a body that cannot be parsed.
 */
@Getter
public class WebhookRejectedException extends RuntimeException {

    private final WebhookProvider provider;
    private final RejectionReason reason;

    public WebhookRejectedException(WebhookProvider provider, RejectionReason reason, String message) {
        super(message);
        this.provider = provider;
        this.reason = reason;
    }

    public WebhookRejectedException(WebhookProvider provider, RejectionReason reason, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.reason = reason;
    }
}
