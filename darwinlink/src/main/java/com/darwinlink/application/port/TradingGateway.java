package com.darwinlink.application.port;

import com.darwinlink.domain.order.Order;
import com.darwinlink.domain.session.Session;
import com.darwinlink.domain.session.SessionMode;
import com.darwinlink.infrastructure.metrics.ConnectionMetricsSnapshot;
import com.darwinlink.infrastructure.protocol.Command;
import com.darwinlink.infrastructure.protocol.RecordKind;
import com.darwinlink.infrastructure.protocol.WireRecord;
import com.darwinlink.infrastructure.routing.RecordSubscriber;
import com.darwinlink.infrastructure.routing.Subscription;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Where trading commands go: the live daemon or the simulation engine.
 * Chosen once per client; the two are never mixed in one session.
 *
 * Both variants answer with the same record shapes and push the same
 * events, so callers do not branch on the mode.
 */
public interface TradingGateway {

    SessionMode mode();

    /**
     * Start the session. No-op when already connected.
     *
     * @throws com.darwinlink.infrastructure.connection.DarwinConnectionException on failure
     */
    void connect();

    /**
     * End the session and release waiting callers. Always safe.
     */
    void disconnect();

    Session session();

    /**
     * Send a command and wait for its complete response.
     *
     * @throws com.darwinlink.infrastructure.connection.NotConnectedException before connect()
     * @throws com.darwinlink.infrastructure.routing.RequestTimeoutException live only
     * @throws com.darwinlink.infrastructure.routing.RequestCancelledException live only
     */
    List<WireRecord> execute(Command command, Duration timeout);

    Subscription subscribe(RecordKind kind, RecordSubscriber subscriber);

    ConnectionMetricsSnapshot metrics();

    // ═══════════════════════════════════════════════════════════════════════
    // SIMULATION-ONLY CAPABILITIES
    // ═══════════════════════════════════════════════════════════════════════

    default boolean supportsSimulation() {
        return false;
    }

    /**
     * Fill a simulated order. Null price / quantity take the order price and
     * the whole remainder.
     */
    default Order simulateExecution(String orderId, BigDecimal price, Long quantity) {
        throw new UnsupportedOperationException("Order execution can only be simulated in simulation mode");
    }

    default void updateAccount(BigDecimal liquidity) {
        throw new UnsupportedOperationException("Account can only be updated in simulation mode");
    }
}
