package com.ivamare.kernelbus.policy;

import java.time.Duration;
import java.util.List;

/**
 * Policy for retrying failed audit appends.
 *
 * @param maxAttempts Maximum number of attempts before giving up (including the first)
 * @param backoffSchedule Delay in milliseconds before each retry
 */
public record RetryPolicy(
    int maxAttempts,
    List<Long> backoffSchedule
) {
    /**
     * Creates a RetryPolicy with immutable backoff schedule.
     */
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        backoffSchedule = List.copyOf(backoffSchedule);
    }

    /**
     * Default retry policy: 3 attempts with backoff [50, 200] ms.
     *
     * @return Default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, List.of(50L, 200L));
    }

    /**
     * Create a policy with no retries.
     *
     * @return No retry policy
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, List.of());
    }

    /**
     * Get the delay before the retry following a failed attempt.
     *
     * @param attempt The attempt that just failed (1-based)
     * @return Delay before the next attempt; zero when no retry remains
     */
    public Duration getBackoff(int attempt) {
        if (attempt >= maxAttempts || backoffSchedule.isEmpty()) {
            return Duration.ZERO;
        }

        int index = Math.max(0, attempt - 1);
        if (index < backoffSchedule.size()) {
            return Duration.ofMillis(backoffSchedule.get(index));
        }

        // Use last value for attempts beyond schedule
        return Duration.ofMillis(backoffSchedule.get(backoffSchedule.size() - 1));
    }

    /**
     * Check if another retry should be attempted.
     *
     * @param attempt The current attempt number (1-based)
     * @return true if more attempts are allowed
     */
    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }
}
