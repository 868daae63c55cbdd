package com.talentforge.security;

import com.talentforge.exception.RejectionReason;
import com.talentforge.exception.WebhookRejectedException;
import com.talentforge.model.WebhookProvider;

import java.time.Clock;

/**
 * Freshness rule shared by both providers: a signed timestamp (epoch
 * seconds) must be within the tolerance of the current time, either side.
 */
final class TimestampWindow {

    private TimestampWindow() {
    }

    static void check(WebhookProvider provider, String timestamp, long toleranceSeconds, Clock clock) {
        long signedAt;
        try {
            signedAt = Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            throw new WebhookRejectedException(provider, RejectionReason.TIMESTAMP_STALE,
                    "Unparseable timestamp: " + timestamp, e);
        }

        long now = clock.instant().getEpochSecond();
        if (Math.abs(now - signedAt) > toleranceSeconds) {
            throw new WebhookRejectedException(provider, RejectionReason.TIMESTAMP_STALE,
                    "Timestamp outside tolerance window: " + timestamp);
        }
    }
}
