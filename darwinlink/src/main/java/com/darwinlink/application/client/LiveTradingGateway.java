package com.darwinlink.application.client;

import com.darwinlink.application.port.TradingGateway;
import com.darwinlink.config.ClientConfig;
import com.darwinlink.domain.session.Session;
import com.darwinlink.domain.session.SessionMode;
import com.darwinlink.infrastructure.connection.Endpoint;
import com.darwinlink.infrastructure.metrics.ConnectionMetrics;
import com.darwinlink.infrastructure.metrics.ConnectionMetricsSnapshot;
import com.darwinlink.infrastructure.protocol.Command;
import com.darwinlink.infrastructure.protocol.RecordKind;
import com.darwinlink.infrastructure.protocol.WireRecord;
import com.darwinlink.infrastructure.routing.RecordSubscriber;
import com.darwinlink.infrastructure.routing.Subscription;

import java.time.Duration;
import java.util.List;

/**
 * Trading gateway backed by the daemon's trading socket.
 */
public class LiveTradingGateway implements TradingGateway {

    private final DaemonSession daemon;

    public LiveTradingGateway(ClientConfig config, ConnectionMetrics metrics) {
        this.daemon = new DaemonSession(Endpoint.trading(config.host(), config.tradingPort()), config, metrics);
    }

    @Override
    public SessionMode mode() {
        return SessionMode.LIVE;
    }

    @Override
    public void connect() {
        daemon.connect();
    }

    @Override
    public void disconnect() {
        daemon.disconnect();
    }

    @Override
    public Session session() {
        return daemon.session();
    }

    @Override
    public List<WireRecord> execute(Command command, Duration timeout) {
        return daemon.execute(command, timeout);
    }

    @Override
    public Subscription subscribe(RecordKind kind, RecordSubscriber subscriber) {
        return daemon.subscribe(kind, subscriber);
    }

    @Override
    public ConnectionMetricsSnapshot metrics() {
        return daemon.metrics();
    }
}
