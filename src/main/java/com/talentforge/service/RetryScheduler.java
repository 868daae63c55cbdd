package com.talentforge.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Backoff policy for failed ledger rows. Never retries inline: it only
 * decides what the row should say next.
 */
@Component
@RequiredArgsConstructor
public class RetryScheduler {

    static final List<Duration> BACKOFF = List.of(
            Duration.ofMinutes(5),
            Duration.ofMinutes(15),
            Duration.ofMinutes(60));

    private final Clock clock;

    /**
     * @param attempts failed executions before this one (0-based)
     */
    public Instant computeNextRetry(int attempts) {
        int index = Math.min(Math.max(attempts, 0), BACKOFF.size() - 1);
        return clock.instant().plus(BACKOFF.get(index));
    }

    public Decision classify(int attempts, int maxAttempts) {
        if (attempts >= maxAttempts) {
            return Decision.deadLetter();
        }
        return Decision.retryAt(computeNextRetry(attempts));
    }

    @Getter
    @ToString
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    public static class Decision {

        private final boolean deadLetter;
        private final Instant nextRetryAt;

        static Decision retryAt(Instant nextRetryAt) {
            return new Decision(false, nextRetryAt);
        }

        static Decision deadLetter() {
            return new Decision(true, null);
        }
    }
}
