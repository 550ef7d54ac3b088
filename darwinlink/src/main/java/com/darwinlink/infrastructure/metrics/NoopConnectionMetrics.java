package com.darwinlink.infrastructure.metrics;

import com.darwinlink.domain.session.LivenessState;
import com.darwinlink.infrastructure.protocol.RecordKind;

import java.time.Duration;
import java.util.List;

final class NoopConnectionMetrics implements ConnectionMetrics {

    static final NoopConnectionMetrics INSTANCE = new NoopConnectionMetrics();

    private NoopConnectionMetrics() {
    }

    @Override
    public void recordConnectAttempt(String endpoint) {
    }

    @Override
    public void recordConnectResult(String endpoint, boolean success, Duration latency) {
    }

    @Override
    public void recordStateChange(String endpoint, LivenessState from, LivenessState to) {
    }

    @Override
    public void recordDecodedLine(String endpoint, RecordKind kind) {
    }

    @Override
    public void recordSkippedLine(String endpoint, String reason) {
    }

    @Override
    public void recordStatusCheck(String endpoint) {
    }

    @Override
    public void recordRequest(String endpoint, String correlationKey, String outcome, Duration latency) {
    }

    @Override
    public ConnectionMetricsSnapshot snapshot(String endpoint) {
        return new ConnectionMetricsSnapshot(endpoint, 0, 0, 0, LivenessState.DISCONNECTED,
            List.of(), 0.0, null, null, 0, 0);
    }

    @Override
    public void reset(String endpoint) {
    }
}
