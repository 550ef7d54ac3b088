package com.darwinlink.infrastructure.metrics;

import com.darwinlink.domain.session.LivenessState;
import com.darwinlink.infrastructure.protocol.RecordKind;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus implementation of ConnectionMetrics.
 *
 * Key Metrics:
 * - darwin_connection_attempts_total{endpoint, outcome}
 * - darwin_connect_latency_seconds{endpoint}
 * - darwin_state_transitions_total{endpoint, to}
 * - darwin_liveness_state{endpoint} - ordinal of LivenessState
 * - darwin_lines_decoded_total{endpoint, kind}
 * - darwin_lines_skipped_total{endpoint, reason}
 * - darwin_requests_total{endpoint, key, outcome}
 * - darwin_request_latency_seconds{endpoint, key}
 *
 * Each instance registers into its own registry unless one is passed in;
 * registering twice into the same registry fails.
 */
public class PrometheusConnectionMetrics implements ConnectionMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusConnectionMetrics.class);

    private static final int MAX_STATE_CHANGES = 10;

    private final CollectorRegistry registry;
    private final Clock clock;

    private final Counter connectionAttempts;
    private final Histogram connectLatency;
    private final Counter stateTransitions;
    private final Gauge livenessState;
    private final Counter linesDecoded;
    private final Counter linesSkipped;
    private final Counter statusChecks;
    private final Counter requests;
    private final Histogram requestLatency;

    // In-memory state for snapshots
    private final Map<String, EndpointState> stateMap = new ConcurrentHashMap<>();

    public PrometheusConnectionMetrics() {
        this(new CollectorRegistry(), Clock.systemUTC());
    }

    public PrometheusConnectionMetrics(CollectorRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    public PrometheusConnectionMetrics(CollectorRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;

        this.connectionAttempts = Counter.build()
            .name("darwin_connection_attempts_total")
            .help("Connection attempts by outcome")
            .labelNames("endpoint", "outcome")
            .register(registry);

        this.connectLatency = Histogram.build()
            .name("darwin_connect_latency_seconds")
            .help("Time to open the daemon socket in seconds")
            .labelNames("endpoint")
            .buckets(0.001, 0.01, 0.05, 0.1, 0.5, 1.0, 3.0)
            .register(registry);

        this.stateTransitions = Counter.build()
            .name("darwin_state_transitions_total")
            .help("Liveness state transitions")
            .labelNames("endpoint", "to")
            .register(registry);

        this.livenessState = Gauge.build()
            .name("darwin_liveness_state")
            .help("Current liveness state (0=disconnected, 1=connecting, 2=connected, 3=degraded)")
            .labelNames("endpoint")
            .register(registry);

        this.linesDecoded = Counter.build()
            .name("darwin_lines_decoded_total")
            .help("Inbound lines decoded by record kind")
            .labelNames("endpoint", "kind")
            .register(registry);

        this.linesSkipped = Counter.build()
            .name("darwin_lines_skipped_total")
            .help("Inbound lines skipped by reason")
            .labelNames("endpoint", "reason")
            .register(registry);

        this.statusChecks = Counter.build()
            .name("darwin_status_checks_total")
            .help("Platform status replies received")
            .labelNames("endpoint")
            .register(registry);

        this.requests = Counter.build()
            .name("darwin_requests_total")
            .help("Synchronous requests by outcome")
            .labelNames("endpoint", "key", "outcome")
            .register(registry);

        this.requestLatency = Histogram.build()
            .name("darwin_request_latency_seconds")
            .help("Synchronous request latency in seconds")
            .labelNames("endpoint", "key")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 5.0)
            .register(registry);

        log.debug("[PrometheusConnectionMetrics] Initialized");
    }

    @Override
    public void recordConnectAttempt(String endpoint) {
        getState(endpoint).recordAttempt();
    }

    @Override
    public void recordConnectResult(String endpoint, boolean success, Duration latency) {
        connectionAttempts.labels(endpoint, success ? "success" : "failure").inc();
        connectLatency.labels(endpoint).observe(latency.toMillis() / 1000.0);
        getState(endpoint).recordResult(success, clock.instant());
    }

    @Override
    public void recordStateChange(String endpoint, LivenessState from, LivenessState to) {
        stateTransitions.labels(endpoint, to.name()).inc();
        livenessState.labels(endpoint).set(to.ordinal());
        getState(endpoint).recordTransition(from, to, clock.instant());
    }

    @Override
    public void recordDecodedLine(String endpoint, RecordKind kind) {
        linesDecoded.labels(endpoint, kind.name()).inc();
        getState(endpoint).recordDecoded();
    }

    @Override
    public void recordSkippedLine(String endpoint, String reason) {
        linesSkipped.labels(endpoint, reason).inc();
        getState(endpoint).recordSkipped();
    }

    @Override
    public void recordStatusCheck(String endpoint) {
        statusChecks.labels(endpoint).inc();
        getState(endpoint).recordStatusCheck(clock.instant());
    }

    @Override
    public void recordRequest(String endpoint, String correlationKey, String outcome, Duration latency) {
        requests.labels(endpoint, correlationKey, outcome).inc();
        requestLatency.labels(endpoint, correlationKey).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public ConnectionMetricsSnapshot snapshot(String endpoint) {
        return getState(endpoint).toSnapshot(clock.instant());
    }

    @Override
    public void reset(String endpoint) {
        stateMap.remove(endpoint);
        log.info("[PrometheusConnectionMetrics] Reset metrics for {}", endpoint);
    }

    /**
     * Prometheus registry, for exposition by the embedding application.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }

    private EndpointState getState(String endpoint) {
        return stateMap.computeIfAbsent(endpoint, EndpointState::new);
    }

    /**
     * Aggregated per-endpoint state. Mutations are synchronized; the read
     * loop, heartbeat thread and callers all record into it.
     */
    private static class EndpointState {
        private final String endpoint;
        private long attempts = 0;
        private long successes = 0;
        private long failures = 0;
        private long decoded = 0;
        private long skipped = 0;
        private LivenessState current = LivenessState.DISCONNECTED;
        private Instant trackingSince;
        private Instant stateSince;
        private long usableMillis = 0;
        private Instant lastConnectTime;
        private Instant lastStatusCheck;
        private final Deque<ConnectionMetricsSnapshot.StateChange> changes = new ArrayDeque<>();

        EndpointState(String endpoint) {
            this.endpoint = endpoint;
        }

        synchronized void recordAttempt() {
            attempts++;
        }

        synchronized void recordResult(boolean success, Instant now) {
            if (success) {
                successes++;
                lastConnectTime = now;
            } else {
                failures++;
            }
        }

        synchronized void recordTransition(LivenessState from, LivenessState to, Instant now) {
            if (trackingSince == null) {
                trackingSince = now;
                stateSince = now;
            }
            Duration inPrevious = Duration.between(stateSince, now);
            if (current.isUsable()) {
                usableMillis += inPrevious.toMillis();
            }
            changes.addLast(new ConnectionMetricsSnapshot.StateChange(from, to, now, inPrevious));
            while (changes.size() > MAX_STATE_CHANGES) {
                changes.removeFirst();
            }
            current = to;
            stateSince = now;
        }

        synchronized void recordDecoded() {
            decoded++;
        }

        synchronized void recordSkipped() {
            skipped++;
        }

        synchronized void recordStatusCheck(Instant now) {
            lastStatusCheck = now;
        }

        synchronized ConnectionMetricsSnapshot toSnapshot(Instant now) {
            double uptime = 0.0;
            if (trackingSince != null) {
                long total = Duration.between(trackingSince, now).toMillis();
                long usable = usableMillis + (current.isUsable() ? Duration.between(stateSince, now).toMillis() : 0);
                uptime = total > 0 ? usable * 100.0 / total : (current.isUsable() ? 100.0 : 0.0);
            }
            return new ConnectionMetricsSnapshot(endpoint, attempts, successes, failures, current,
                new ArrayList<>(changes), uptime, lastConnectTime, lastStatusCheck, decoded, skipped);
        }
    }
}
