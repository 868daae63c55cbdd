package com.talentforge.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RetryScheduler Tests")
class RetrySchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private final RetryScheduler scheduler = new RetryScheduler(Clock.fixed(NOW, ZoneOffset.UTC));

    @ParameterizedTest(name = "attempts={0} -> +{1} minutes")
    @CsvSource({"0, 5", "1, 15", "2, 60", "3, 60", "10, 60"})
    @DisplayName("Should index the backoff table by attempts, capped at the last entry")
    void shouldComputeBackoff(int attempts, long minutes) {
        assertThat(scheduler.computeNextRetry(attempts)).isEqualTo(NOW.plus(Duration.ofMinutes(minutes)));
    }

    @Test
    @DisplayName("Should schedule a retry while below the attempt ceiling")
    void shouldRetryBelowCeiling() {
        RetryScheduler.Decision decision = scheduler.classify(2, 3);

        assertThat(decision.isDeadLetter()).isFalse();
        assertThat(decision.getNextRetryAt()).isEqualTo(NOW.plus(Duration.ofMinutes(60)));
    }

    @Test
    @DisplayName("Should dead-letter once attempts reach the ceiling")
    void shouldDeadLetterAtCeiling() {
        RetryScheduler.Decision decision = scheduler.classify(3, 3);

        assertThat(decision.isDeadLetter()).isTrue();
        assertThat(decision.getNextRetryAt()).isNull();
    }

    @Test
    @DisplayName("Should respect a custom attempt ceiling")
    void shouldHonourCustomCeiling() {
        assertThat(scheduler.classify(1, 1).isDeadLetter()).isTrue();
        assertThat(scheduler.classify(4, 5).isDeadLetter()).isFalse();
    }
}
