package com.darwinlink.application.client;

import com.darwinlink.application.port.TradingGateway;
import com.darwinlink.application.simulation.SimulationEngine;
import com.darwinlink.config.SimulationSettings;
import com.darwinlink.domain.order.Order;
import com.darwinlink.domain.session.LivenessState;
import com.darwinlink.domain.session.Session;
import com.darwinlink.domain.session.SessionMode;
import com.darwinlink.infrastructure.connection.NotConnectedException;
import com.darwinlink.infrastructure.metrics.ConnectionMetrics;
import com.darwinlink.infrastructure.metrics.ConnectionMetricsSnapshot;
import com.darwinlink.infrastructure.protocol.Command;
import com.darwinlink.infrastructure.protocol.RecordKind;
import com.darwinlink.infrastructure.protocol.WireRecord;
import com.darwinlink.infrastructure.routing.RecordSubscriber;
import com.darwinlink.infrastructure.routing.ResponseRouter;
import com.darwinlink.infrastructure.routing.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Trading gateway backed by the in-process simulation engine.
 *
 * No socket is opened. Events go through a router's subscriber registry
 * exactly like live pushes, and the engine starts empty on every connect.
 */
public class SimulatedTradingGateway implements TradingGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatedTradingGateway.class);

    static final String ENDPOINT = "simulation";

    private final ConnectionMetrics metrics;
    private final ResponseRouter router;
    private final SimulationEngine engine;
    private final Object lifecycleLock = new Object();

    private volatile LivenessState state = LivenessState.DISCONNECTED;
    private volatile Instant connectedAt;

    public SimulatedTradingGateway(SimulationSettings settings, ConnectionMetrics metrics) {
        this.metrics = metrics;
        this.router = new ResponseRouter(ENDPOINT, metrics, Duration.ZERO);
        this.engine = new SimulationEngine(settings, router::publish);
    }

    @Override
    public SessionMode mode() {
        return SessionMode.SIMULATION;
    }

    @Override
    public void connect() {
        synchronized (lifecycleLock) {
            if (state.isUsable()) {
                return;
            }
            metrics.recordConnectAttempt(ENDPOINT);
            engine.reset();
            connectedAt = Instant.now();
            metrics.recordConnectResult(ENDPOINT, true, Duration.ZERO);
            setState(LivenessState.CONNECTED);
            log.warn("⚠️ [SIM] SIMULATION MODE ACTIVE - orders never reach the market");
        }
    }

    @Override
    public void disconnect() {
        synchronized (lifecycleLock) {
            if (state == LivenessState.DISCONNECTED) {
                return;
            }
            setState(LivenessState.DISCONNECTED);
            log.info("[SIM] Session closed");
        }
    }

    @Override
    public Session session() {
        return new Session(ENDPOINT, "in-process", 0, SessionMode.SIMULATION, state, connectedAt);
    }

    @Override
    public List<WireRecord> execute(Command command, Duration timeout) {
        requireConnected();
        List<WireRecord> records = engine.execute(command);
        for (WireRecord record : records) {
            metrics.recordDecodedLine(ENDPOINT, record.kind());
        }
        return records;
    }

    @Override
    public Subscription subscribe(RecordKind kind, RecordSubscriber subscriber) {
        return router.subscribe(kind, subscriber);
    }

    @Override
    public ConnectionMetricsSnapshot metrics() {
        return metrics.snapshot(ENDPOINT);
    }

    @Override
    public boolean supportsSimulation() {
        return true;
    }

    @Override
    public Order simulateExecution(String orderId, BigDecimal price, Long quantity) {
        requireConnected();
        return engine.executeOrder(orderId, price, quantity);
    }

    @Override
    public void updateAccount(BigDecimal liquidity) {
        requireConnected();
        engine.updateAccount(liquidity);
    }

    SimulationEngine engine() {
        return engine;
    }

    private void requireConnected() {
        LivenessState current = state;
        if (!current.isUsable()) {
            throw new NotConnectedException(ENDPOINT, current);
        }
    }

    private void setState(LivenessState next) {
        LivenessState previous = state;
        state = next;
        metrics.recordStateChange(ENDPOINT, previous, next);
    }
}
