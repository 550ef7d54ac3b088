package com.darwinlink.infrastructure.connection;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConnectRetryPolicy.
 *
 * Tests:
 * - Exponential backoff calculations
 * - Attempt bound
 * - Reset on success
 * - Builder validation
 */
class ConnectRetryPolicyTest {

    @Test
    void testInitialState() {
        ConnectRetryPolicy policy = ConnectRetryPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .maxAttempts(3)
            .build();

        assertTrue(policy.shouldRetry(), "Should allow the first attempt");
        assertEquals(0, policy.getFailedAttempts());
        assertFalse(policy.isExhausted());
        assertNull(policy.getLastFailureTime(), "No failures yet");
    }

    @Test
    void testExponentialBackoff() {
        ConnectRetryPolicy policy = ConnectRetryPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofSeconds(10))
            .multiplier(2.0)
            .maxAttempts(10)
            .build();

        policy.recordFailure();
        assertEquals(Duration.ofMillis(100), policy.getNextDelay(), "First wait is the initial delay");

        policy.recordFailure();
        assertEquals(Duration.ofMillis(200), policy.getNextDelay());

        policy.recordFailure();
        assertEquals(Duration.ofMillis(400), policy.getNextDelay());
    }

    @Test
    void testDelayIsCapped() {
        ConnectRetryPolicy policy = ConnectRetryPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofMillis(250))
            .maxAttempts(10)
            .build();

        for (int i = 0; i < 5; i++) {
            policy.recordFailure();
        }

        assertEquals(Duration.ofMillis(250), policy.getNextDelay(), "Delay should be capped at max");
    }

    @Test
    void testExhaustedAfterMaxAttempts() {
        ConnectRetryPolicy policy = ConnectRetryPolicy.builder()
            .maxAttempts(2)
            .build();

        policy.recordFailure();
        assertTrue(policy.shouldRetry());

        policy.recordFailure();
        assertFalse(policy.shouldRetry(), "No attempts left");
        assertTrue(policy.isExhausted());
        assertNotNull(policy.getLastFailureTime());
    }

    @Test
    void testSuccessResets() {
        ConnectRetryPolicy policy = ConnectRetryPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .maxAttempts(5)
            .build();

        policy.recordFailure();
        policy.recordFailure();
        policy.recordSuccess();

        assertEquals(0, policy.getFailedAttempts());
        assertEquals(Duration.ofMillis(100), policy.getNextDelay());
        assertNull(policy.getLastFailureTime());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> ConnectRetryPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class,
            () -> ConnectRetryPolicy.builder().multiplier(0.5));
        assertThrows(IllegalArgumentException.class,
            () -> ConnectRetryPolicy.builder().initialDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> ConnectRetryPolicy.builder()
                .initialDelay(Duration.ofSeconds(10))
                .maxDelay(Duration.ofSeconds(1))
                .build());
    }
}
