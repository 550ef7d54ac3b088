package com.darwinlink.domain.session;

/**
 * Darwin platform status (DARWIN_STATUS line).
 *
 * connectionStatus is the platform's own link to the market:
 * CONN_OK, CONN_UNAVAILABLE, CONN_ERROR.
 */
public record PlatformStatus(
    String connectionStatus,
    boolean tradingEnabled,
    String release,
    boolean simulation
) {
    public static final String CONN_OK = "CONN_OK";

    public boolean isConnectionOk() {
        return CONN_OK.equals(connectionStatus);
    }
}
