package com.darwinlink.infrastructure.metrics;

import com.darwinlink.domain.session.LivenessState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time connection metrics for one endpoint.
 */
public record ConnectionMetricsSnapshot(
    String endpoint,
    long connectionAttempts,
    long successfulConnections,
    long failedConnections,
    LivenessState currentState,
    List<StateChange> recentStateChanges,   // Oldest first, at most 10
    double uptimePercent,                   // Share of tracked time spent CONNECTED or DEGRADED
    Instant lastConnectTime,
    Instant lastStatusCheck,
    long decodedLines,
    long skippedLines
) {
    public ConnectionMetricsSnapshot {
        recentStateChanges = List.copyOf(recentStateChanges);
    }

    /**
     * One liveness transition and how long the previous state lasted.
     */
    public record StateChange(
        LivenessState from,
        LivenessState to,
        Instant at,
        Duration timeInPreviousState
    ) {}
}
