package com.darwinlink.domain.session;

import java.time.Instant;

/**
 * Snapshot of one client's connection lifecycle.
 */
public record Session(
    String endpoint,        // "trading" or "historical"
    String host,
    int port,
    SessionMode mode,
    LivenessState state,
    Instant lastHeartbeat   // Null until the first status reply
) {}
