package com.darwinlink.infrastructure.metrics;

import com.darwinlink.domain.session.LivenessState;
import com.darwinlink.infrastructure.protocol.RecordKind;

import java.time.Duration;

/**
 * Connection metrics for monitoring a daemon session.
 *
 * Key metrics:
 * - Connection attempts and outcomes
 * - Liveness state transitions
 * - Decoded / skipped lines per endpoint
 * - Request outcomes and latency
 */
public interface ConnectionMetrics {

    /**
     * Record the start of a connection attempt.
     *
     * @param endpoint Endpoint name ("trading", "historical")
     */
    void recordConnectAttempt(String endpoint);

    /**
     * Record the outcome of a connection attempt.
     *
     * @param endpoint Endpoint name
     * @param success Whether the socket was opened
     * @param latency Time spent connecting
     */
    void recordConnectResult(String endpoint, boolean success, Duration latency);

    /**
     * Record a liveness transition.
     */
    void recordStateChange(String endpoint, LivenessState from, LivenessState to);

    /**
     * Record a successfully decoded inbound line.
     */
    void recordDecodedLine(String endpoint, RecordKind kind);

    /**
     * Record an inbound line that was skipped.
     *
     * @param reason MALFORMED or UNKNOWN_KIND
     */
    void recordSkippedLine(String endpoint, String reason);

    /**
     * Record a platform status reply (heartbeat).
     */
    void recordStatusCheck(String endpoint);

    /**
     * Record a completed synchronous request.
     *
     * @param outcome OK, ERROR, TIMEOUT or CANCELLED
     */
    void recordRequest(String endpoint, String correlationKey, String outcome, Duration latency);

    /**
     * Current aggregated view for one endpoint.
     */
    ConnectionMetricsSnapshot snapshot(String endpoint);

    /**
     * Drop aggregated state for one endpoint.
     */
    void reset(String endpoint);

    /**
     * Metrics sink that records nothing. Used by the simulated gateway.
     */
    static ConnectionMetrics noop() {
        return NoopConnectionMetrics.INSTANCE;
    }
}
