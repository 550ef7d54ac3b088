package com.darwinlink.infrastructure.connection;

import java.time.Duration;
import java.time.Instant;

/**
 * Bounded retry with exponential backoff for establishing a session.
 *
 * Only used for the initial connect when the caller asks for more than one
 * attempt. Once the attempts are spent the policy stays exhausted; nothing
 * in this library retries on its own after that.
 *
 * Usage:
 * <pre>
 * ConnectRetryPolicy policy = ConnectRetryPolicy.builder()
 *     .initialDelay(Duration.ofMillis(200))
 *     .maxAttempts(3)
 *     .build();
 *
 * while (policy.shouldRetry()) {
 *     try {
 *         open();
 *         policy.recordSuccess();
 *         break;
 *     } catch (DarwinConnectionException e) {
 *         policy.recordFailure();
 *         Thread.sleep(policy.getNextDelay().toMillis());
 *     }
 * }
 * </pre>
 */
public class ConnectRetryPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int failedAttempts = 0;
    private Duration currentDelay;
    private Instant lastFailureTime;

    private ConnectRetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true while attempts remain
     */
    public synchronized boolean shouldRetry() {
        return failedAttempts < maxAttempts;
    }

    /**
     * Delay to wait before the next attempt.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Count a failed attempt and grow the delay, capped at maxDelay.
     */
    public synchronized void recordFailure() {
        if (failedAttempts > 0) {
            long grown = (long) (currentDelay.toMillis() * multiplier);
            currentDelay = Duration.ofMillis(Math.min(grown, maxDelay.toMillis()));
        }
        failedAttempts++;
        lastFailureTime = Instant.now();
    }

    public synchronized void recordSuccess() {
        failedAttempts = 0;
        currentDelay = initialDelay;
        lastFailureTime = null;
    }

    public synchronized boolean isExhausted() {
        return failedAttempts >= maxAttempts;
    }

    public synchronized int getFailedAttempts() {
        return failedAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(5);
        private double multiplier = 2.0;
        private int maxAttempts = 1;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ConnectRetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ConnectRetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
