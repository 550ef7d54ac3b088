package com.darwinlink.infrastructure.connection;

/**
 * Thrown when a daemon socket cannot be opened or is lost.
 */
public class DarwinConnectionException extends RuntimeException {

    private final String endpoint;

    public DarwinConnectionException(Endpoint endpoint, String message) {
        super(String.format("[%s] %s", endpoint, message));
        this.endpoint = endpoint.name();
    }

    public DarwinConnectionException(Endpoint endpoint, String message, Throwable cause) {
        super(String.format("[%s] %s", endpoint, message), cause);
        this.endpoint = endpoint.name();
    }

    public String getEndpoint() {
        return endpoint;
    }
}
