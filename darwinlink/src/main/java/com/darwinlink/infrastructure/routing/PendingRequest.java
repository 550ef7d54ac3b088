package com.darwinlink.infrastructure.routing;

import com.darwinlink.infrastructure.protocol.CollectionMode;
import com.darwinlink.infrastructure.protocol.Command;
import com.darwinlink.infrastructure.protocol.RecordKind;
import com.darwinlink.infrastructure.protocol.ResponseSpec;
import com.darwinlink.infrastructure.protocol.WireRecord;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One caller waiting for its response.
 *
 * The router offers records under its lock; the caller thread drains the
 * inbox. Once the terminal record has been claimed the request accepts
 * nothing more, so a later line of the same kind goes to the next waiter.
 * ERR is only taken as the first record of a response.
 */
final class PendingRequest {

    private final Command command;
    private final ResponseSpec spec;
    private final BlockingQueue<Object> inbox = new LinkedBlockingQueue<>();
    private boolean closed;   // Guarded by the router lock
    private boolean started;  // At least one record claimed; guarded by the router lock

    PendingRequest(Command command) {
        this.command = command;
        this.spec = command.response();
    }

    Command command() {
        return command;
    }

    ResponseSpec spec() {
        return spec;
    }

    String verb() {
        return command.kind().verb();
    }

    /**
     * Offer a record. Caller holds the router lock.
     *
     * @return true if this request took it
     */
    boolean claim(WireRecord record) {
        if (closed || !spec.matches(record, command)) {
            return false;
        }
        // An ERR cannot end a response that is already streaming
        if (record.kind() == RecordKind.ERR && started) {
            return false;
        }
        started = true;
        if (record.kind() == RecordKind.ERR
            || spec.mode() == CollectionMode.SINGLE
            || (spec.mode() == CollectionMode.FRAMED && record.kind() == RecordKind.END_DATA)) {
            closed = true;
        }
        inbox.add(record);
        return true;
    }

    /**
     * Release the waiter with a failure. Caller holds the router lock.
     */
    void cancel(RuntimeException cause) {
        if (closed) {
            return;
        }
        closed = true;
        inbox.add(new Cancellation(cause));
    }

    /**
     * @return next record, null on timeout
     * @throws RequestCancelledException if the request was cancelled
     */
    WireRecord poll(long timeoutNanos) throws InterruptedException {
        Object item = inbox.poll(Math.max(0, timeoutNanos), TimeUnit.NANOSECONDS);
        if (item instanceof Cancellation) {
            throw new RequestCancelledException(verb(), ((Cancellation) item).cause);
        }
        return (WireRecord) item;
    }

    private static final class Cancellation {
        private final RuntimeException cause;

        private Cancellation(RuntimeException cause) {
            this.cause = cause;
        }
    }
}
