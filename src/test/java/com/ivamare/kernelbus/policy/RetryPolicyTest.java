package com.ivamare.kernelbus.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy")
class RetryPolicyTest {

    @Test
    @DisplayName("should create default policy with 3 attempts")
    void shouldCreateDefaultPolicyWithThreeAttempts() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(3, policy.maxAttempts());
        assertEquals(List.of(50L, 200L), policy.backoffSchedule());
    }

    @Test
    @DisplayName("should create no retry policy")
    void shouldCreateNoRetryPolicy() {
        RetryPolicy policy = RetryPolicy.noRetry();

        assertEquals(1, policy.maxAttempts());
        assertTrue(policy.backoffSchedule().isEmpty());
        assertFalse(policy.shouldRetry(1));
    }

    @Test
    @DisplayName("should make backoff schedule immutable")
    void shouldMakeBackoffScheduleImmutable() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertThrows(UnsupportedOperationException.class, () ->
            policy.backoffSchedule().add(500L)
        );
    }

    @Test
    @DisplayName("should return backoff per failed attempt")
    void shouldReturnBackoffPerAttempt() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(Duration.ofMillis(50), policy.getBackoff(1));
        assertEquals(Duration.ofMillis(200), policy.getBackoff(2));
    }

    @Test
    @DisplayName("should return last backoff for attempt beyond schedule")
    void shouldReturnLastBackoffForAttemptBeyondSchedule() {
        RetryPolicy policy = new RetryPolicy(5, List.of(10L, 60L));

        assertEquals(Duration.ofMillis(60), policy.getBackoff(3));
        assertEquals(Duration.ofMillis(60), policy.getBackoff(4));
    }

    @Test
    @DisplayName("should return zero for exhausted attempts")
    void shouldReturnZeroForExhaustedAttempts() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(Duration.ZERO, policy.getBackoff(3));
        assertEquals(Duration.ZERO, policy.getBackoff(4));
    }

    @Test
    @DisplayName("should retry immediately when schedule is empty")
    void shouldRetryImmediatelyWhenScheduleEmpty() {
        RetryPolicy policy = new RetryPolicy(3, List.of());

        assertEquals(Duration.ZERO, policy.getBackoff(1));
        assertTrue(policy.shouldRetry(2));
        assertFalse(policy.shouldRetry(3));
    }

    @Test
    @DisplayName("should reject fewer than one attempt")
    void shouldRejectZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, List.of()));
    }
}
