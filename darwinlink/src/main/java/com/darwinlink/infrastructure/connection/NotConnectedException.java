package com.darwinlink.infrastructure.connection;

import com.darwinlink.domain.session.LivenessState;

/**
 * Operation attempted while the session is not CONNECTED or DEGRADED.
 */
public class NotConnectedException extends RuntimeException {

    private final LivenessState state;

    public NotConnectedException(String endpoint, LivenessState state) {
        super(String.format("[%s] Not connected (state=%s)", endpoint, state));
        this.state = state;
    }

    public LivenessState getState() {
        return state;
    }
}
