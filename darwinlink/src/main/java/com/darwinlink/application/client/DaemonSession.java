package com.darwinlink.application.client;

import com.darwinlink.config.ClientConfig;
import com.darwinlink.domain.session.Session;
import com.darwinlink.domain.session.SessionMode;
import com.darwinlink.infrastructure.connection.ConnectionManager;
import com.darwinlink.infrastructure.connection.Endpoint;
import com.darwinlink.infrastructure.connection.NotConnectedException;
import com.darwinlink.infrastructure.metrics.ConnectionMetrics;
import com.darwinlink.infrastructure.metrics.ConnectionMetricsSnapshot;
import com.darwinlink.infrastructure.protocol.Command;
import com.darwinlink.infrastructure.protocol.RecordKind;
import com.darwinlink.infrastructure.protocol.WireRecord;
import com.darwinlink.infrastructure.routing.RecordSubscriber;
import com.darwinlink.infrastructure.routing.ResponseRouter;
import com.darwinlink.infrastructure.routing.Subscription;

import java.time.Duration;
import java.util.List;

/**
 * One live socket with its router: what both facades talk to in live mode.
 */
final class DaemonSession {

    private final Endpoint endpoint;
    private final ClientConfig config;
    private final ConnectionMetrics metrics;
    private final ResponseRouter router;
    private final ConnectionManager connection;

    DaemonSession(Endpoint endpoint, ClientConfig config, ConnectionMetrics metrics) {
        this.endpoint = endpoint;
        this.config = config;
        this.metrics = metrics;
        this.router = new ResponseRouter(endpoint.name(), metrics, config.listSettle());
        this.connection = new ConnectionManager(endpoint, router, metrics);
        if (endpoint.isTrading() && config.heartbeatInterval() != null && !config.heartbeatInterval().isZero()) {
            connection.enableHeartbeat(config.heartbeatInterval(), config.heartbeatTimeout());
        }
    }

    void connect() {
        connection.connect(config.connectTimeout(), config.connectAttempts());
    }

    void disconnect() {
        connection.disconnect();
    }

    List<WireRecord> execute(Command command, Duration timeout) {
        if (!connection.isConnected()) {
            throw new NotConnectedException(endpoint.name(), connection.state());
        }
        return router.request(command, connection::send, timeout);
    }

    Subscription subscribe(RecordKind kind, RecordSubscriber subscriber) {
        return router.subscribe(kind, subscriber);
    }

    Session session() {
        return connection.session(SessionMode.LIVE);
    }

    ConnectionMetricsSnapshot metrics() {
        return metrics.snapshot(endpoint.name());
    }

    ConnectionManager connection() {
        return connection;
    }
}
