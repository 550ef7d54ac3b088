package com.darwinlink.infrastructure.connection;

import com.darwinlink.infrastructure.protocol.WireRecord;

/**
 * Receives what the read loop produces.
 */
public interface RecordSink {

    /**
     * Called on the read-loop thread for every decoded line, in arrival order.
     */
    void onRecord(WireRecord record);

    /**
     * Called once per session end, explicit or not. Anything waiting on
     * this connection must be released.
     */
    void onDisconnect(RuntimeException cause);
}
