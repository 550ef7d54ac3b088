package com.darwinlink.infrastructure.metrics;

import com.darwinlink.domain.session.LivenessState;
import com.darwinlink.infrastructure.protocol.RecordKind;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusConnectionMetricsTest {

    private CollectorRegistry registry;
    private StepClock clock;
    private PrometheusConnectionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        clock = new StepClock(Instant.parse("2024-01-15T09:00:00Z"));
        metrics = new PrometheusConnectionMetrics(registry, clock);
    }

    @Test
    void testConnectOutcomesAreCounted() {
        metrics.recordConnectAttempt("trading");
        metrics.recordConnectResult("trading", false, Duration.ofMillis(5));
        metrics.recordConnectAttempt("trading");
        metrics.recordConnectResult("trading", true, Duration.ofMillis(3));

        ConnectionMetricsSnapshot snapshot = metrics.snapshot("trading");
        assertEquals(2, snapshot.connectionAttempts());
        assertEquals(1, snapshot.successfulConnections());
        assertEquals(1, snapshot.failedConnections());
        assertNotNull(snapshot.lastConnectTime());

        assertEquals(1.0, registry.getSampleValue("darwin_connection_attempts_total",
            new String[]{"endpoint", "outcome"}, new String[]{"trading", "success"}));
        assertEquals(1.0, registry.getSampleValue("darwin_connection_attempts_total",
            new String[]{"endpoint", "outcome"}, new String[]{"trading", "failure"}));
    }

    @Test
    void testStateChangesAndUptime() {
        metrics.recordStateChange("trading", LivenessState.DISCONNECTED, LivenessState.CONNECTED);
        clock.advance(Duration.ofSeconds(30));
        metrics.recordStateChange("trading", LivenessState.CONNECTED, LivenessState.DISCONNECTED);
        clock.advance(Duration.ofSeconds(10));

        ConnectionMetricsSnapshot snapshot = metrics.snapshot("trading");
        assertEquals(LivenessState.DISCONNECTED, snapshot.currentState());
        assertEquals(2, snapshot.recentStateChanges().size());
        assertEquals(Duration.ofSeconds(30), snapshot.recentStateChanges().get(1).timeInPreviousState());
        assertEquals(75.0, snapshot.uptimePercent(), 0.01);
        assertEquals((double) LivenessState.DISCONNECTED.ordinal(),
            registry.getSampleValue("darwin_liveness_state", new String[]{"endpoint"}, new String[]{"trading"}));
    }

    @Test
    void testDegradedCountsAsUptime() {
        metrics.recordStateChange("trading", LivenessState.DISCONNECTED, LivenessState.CONNECTED);
        clock.advance(Duration.ofSeconds(10));
        metrics.recordStateChange("trading", LivenessState.CONNECTED, LivenessState.DEGRADED);
        clock.advance(Duration.ofSeconds(10));

        assertEquals(100.0, metrics.snapshot("trading").uptimePercent(), 0.01);
    }

    @Test
    void testRecentStateChangesAreBounded() {
        for (int i = 0; i < 15; i++) {
            metrics.recordStateChange("trading", LivenessState.CONNECTED, LivenessState.DEGRADED);
            metrics.recordStateChange("trading", LivenessState.DEGRADED, LivenessState.CONNECTED);
        }

        assertEquals(10, metrics.snapshot("trading").recentStateChanges().size());
    }

    @Test
    void testLineCounters() {
        metrics.recordDecodedLine("historical", RecordKind.CANDLE);
        metrics.recordDecodedLine("historical", RecordKind.CANDLE);
        metrics.recordSkippedLine("historical", "MALFORMED");

        ConnectionMetricsSnapshot snapshot = metrics.snapshot("historical");
        assertEquals(2, snapshot.decodedLines());
        assertEquals(1, snapshot.skippedLines());
        assertEquals(2.0, registry.getSampleValue("darwin_lines_decoded_total",
            new String[]{"endpoint", "kind"}, new String[]{"historical", "CANDLE"}));
    }

    @Test
    void testRequestsByOutcome() {
        metrics.recordRequest("trading", "TRADE", "OK", Duration.ofMillis(20));
        metrics.recordRequest("trading", "TRADE", "TIMEOUT", Duration.ofSeconds(5));

        assertEquals(1.0, registry.getSampleValue("darwin_requests_total",
            new String[]{"endpoint", "key", "outcome"}, new String[]{"trading", "TRADE", "TIMEOUT"}));
        assertEquals(2.0, registry.getSampleValue("darwin_request_latency_seconds_count",
            new String[]{"endpoint", "key"}, new String[]{"trading", "TRADE"}));
    }

    @Test
    void testStatusCheckTime() {
        metrics.recordStatusCheck("trading");

        assertEquals(clock.instant(), metrics.snapshot("trading").lastStatusCheck());
    }

    @Test
    void testEndpointsAreIndependent() {
        metrics.recordConnectAttempt("trading");

        assertEquals(1, metrics.snapshot("trading").connectionAttempts());
        assertEquals(0, metrics.snapshot("historical").connectionAttempts());
    }

    @Test
    void testReset() {
        metrics.recordConnectAttempt("trading");
        metrics.reset("trading");

        assertEquals(0, metrics.snapshot("trading").connectionAttempts());
    }

    @Test
    void testEachInstanceOwnsItsRegistry() {
        PrometheusConnectionMetrics first = new PrometheusConnectionMetrics();
        PrometheusConnectionMetrics second = new PrometheusConnectionMetrics();

        assertNotSame(first.getRegistry(), second.getRegistry());
    }

    @Test
    void testNoopMetrics() {
        ConnectionMetrics noop = ConnectionMetrics.noop();
        noop.recordConnectAttempt("trading");

        assertNotNull(noop.snapshot("trading"));
    }

    private static final class StepClock extends Clock {
        private Instant now;

        StepClock(Instant start) {
            this.now = start;
        }

        void advance(Duration step) {
            now = now.plus(step);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
