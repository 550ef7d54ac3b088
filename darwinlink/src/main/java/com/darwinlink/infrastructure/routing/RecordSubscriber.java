package com.darwinlink.infrastructure.routing;

import com.darwinlink.infrastructure.protocol.WireRecord;

/**
 * Receives pushed records of the kinds it subscribed to.
 *
 * Invoked on the read-loop thread (or the thread driving the simulation);
 * a slow subscriber delays every other subscriber.
 */
@FunctionalInterface
public interface RecordSubscriber {

    void onRecord(WireRecord record);
}
