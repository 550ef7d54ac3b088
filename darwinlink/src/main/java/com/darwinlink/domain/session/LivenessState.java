package com.darwinlink.domain.session;

/**
 * Session liveness.
 *
 * DISCONNECTED -> CONNECTING -> CONNECTED -> DISCONNECTED, plus
 * CONNECTED <-> DEGRADED while heartbeats are overdue.
 */
public enum LivenessState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    DEGRADED;   // Writes still attempted, reads continue, callers get a warning

    public boolean isUsable() {
        return this == CONNECTED || this == DEGRADED;
    }
}
