package com.darwinlink.config;

import com.darwinlink.util.Env;

import java.time.Duration;

/**
 * Client settings.
 *
 * {@link #fromEnv()} reads DARWIN_* environment variables (or system
 * properties of the same name); anything unset keeps its default.
 */
public record ClientConfig(
    String host,
    int tradingPort,
    int historicalPort,
    Duration connectTimeout,
    int connectAttempts,
    Duration requestTimeout,
    Duration listSettle,            // Quiet period that ends a multi-line answer
    Duration heartbeatInterval,     // Zero disables the heartbeat
    Duration heartbeatTimeout,
    boolean autoConfirmOrders,      // Answer TRADCONFIRM with CONFORD
    boolean simulation,
    SimulationSettings simulationSettings
) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_TRADING_PORT = 10002;
    public static final int DEFAULT_HISTORICAL_PORT = 10003;

    public ClientConfig {
        if (connectAttempts < 1) {
            throw new IllegalArgumentException("connectAttempts must be at least 1");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (simulationSettings == null) {
            simulationSettings = SimulationSettings.defaults();
        }
    }

    public static ClientConfig defaults() {
        return new ClientConfig(
            DEFAULT_HOST,
            DEFAULT_TRADING_PORT,
            DEFAULT_HISTORICAL_PORT,
            Duration.ofSeconds(3),
            1,
            Duration.ofSeconds(5),
            Duration.ofMillis(150),
            Duration.ofSeconds(30),
            Duration.ofSeconds(10),
            true,
            false,
            SimulationSettings.defaults()
        );
    }

    public static ClientConfig fromEnv() {
        ClientConfig d = defaults();
        return new ClientConfig(
            Env.get("DARWIN_HOST", d.host()),
            Env.getInt("DARWIN_TRADING_PORT", d.tradingPort()),
            Env.getInt("DARWIN_HISTORICAL_PORT", d.historicalPort()),
            Env.getMillis("DARWIN_CONNECT_TIMEOUT_MS", d.connectTimeout()),
            Env.getInt("DARWIN_CONNECT_ATTEMPTS", d.connectAttempts()),
            Env.getMillis("DARWIN_REQUEST_TIMEOUT_MS", d.requestTimeout()),
            Env.getMillis("DARWIN_LIST_SETTLE_MS", d.listSettle()),
            Env.getMillis("DARWIN_HEARTBEAT_INTERVAL_MS", d.heartbeatInterval()),
            Env.getMillis("DARWIN_HEARTBEAT_TIMEOUT_MS", d.heartbeatTimeout()),
            Env.getBool("DARWIN_AUTO_CONFIRM", d.autoConfirmOrders()),
            Env.getBool("DARWIN_SIMULATION", d.simulation()),
            SimulationSettingsLoader.load()
        );
    }

    public ClientConfig withSimulation(boolean simulation) {
        return new ClientConfig(host, tradingPort, historicalPort, connectTimeout, connectAttempts, requestTimeout,
            listSettle, heartbeatInterval, heartbeatTimeout, autoConfirmOrders, simulation, simulationSettings);
    }

    public ClientConfig withEndpoint(String host, int tradingPort, int historicalPort) {
        return new ClientConfig(host, tradingPort, historicalPort, connectTimeout, connectAttempts, requestTimeout,
            listSettle, heartbeatInterval, heartbeatTimeout, autoConfirmOrders, simulation, simulationSettings);
    }

    public ClientConfig withTimeouts(Duration connectTimeout, Duration requestTimeout, Duration listSettle) {
        return new ClientConfig(host, tradingPort, historicalPort, connectTimeout, connectAttempts, requestTimeout,
            listSettle, heartbeatInterval, heartbeatTimeout, autoConfirmOrders, simulation, simulationSettings);
    }

    public ClientConfig withConnectAttempts(int connectAttempts) {
        return new ClientConfig(host, tradingPort, historicalPort, connectTimeout, connectAttempts, requestTimeout,
            listSettle, heartbeatInterval, heartbeatTimeout, autoConfirmOrders, simulation, simulationSettings);
    }

    public ClientConfig withHeartbeat(Duration interval, Duration timeout) {
        return new ClientConfig(host, tradingPort, historicalPort, connectTimeout, connectAttempts, requestTimeout,
            listSettle, interval, timeout, autoConfirmOrders, simulation, simulationSettings);
    }

    public ClientConfig withAutoConfirmOrders(boolean autoConfirmOrders) {
        return new ClientConfig(host, tradingPort, historicalPort, connectTimeout, connectAttempts, requestTimeout,
            listSettle, heartbeatInterval, heartbeatTimeout, autoConfirmOrders, simulation, simulationSettings);
    }

    public ClientConfig withSimulationSettings(SimulationSettings settings) {
        return new ClientConfig(host, tradingPort, historicalPort, connectTimeout, connectAttempts, requestTimeout,
            listSettle, heartbeatInterval, heartbeatTimeout, autoConfirmOrders, simulation, settings);
    }
}
