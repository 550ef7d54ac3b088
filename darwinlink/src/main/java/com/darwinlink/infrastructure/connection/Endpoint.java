package com.darwinlink.infrastructure.connection;

/**
 * One daemon socket: trading or historical.
 */
public record Endpoint(String name, String host, int port) {

    public static final String TRADING = "trading";
    public static final String HISTORICAL = "historical";

    public Endpoint {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
    }

    public static Endpoint trading(String host, int port) {
        return new Endpoint(TRADING, host, port);
    }

    public static Endpoint historical(String host, int port) {
        return new Endpoint(HISTORICAL, host, port);
    }

    public boolean isTrading() {
        return TRADING.equals(name);
    }

    @Override
    public String toString() {
        return name + "@" + host + ":" + port;
    }
}
