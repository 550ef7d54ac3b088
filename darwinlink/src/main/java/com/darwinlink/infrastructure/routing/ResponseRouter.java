package com.darwinlink.infrastructure.routing;

import com.darwinlink.infrastructure.connection.RecordSink;
import com.darwinlink.infrastructure.metrics.ConnectionMetrics;
import com.darwinlink.infrastructure.protocol.Command;
import com.darwinlink.infrastructure.protocol.RecordKind;
import com.darwinlink.infrastructure.protocol.ResponseSpec;
import com.darwinlink.infrastructure.protocol.WireCodec;
import com.darwinlink.infrastructure.protocol.WireRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Demultiplexes one inbound stream into request responses and pushed events.
 *
 * The daemon does not echo request ids. A response is recognised by record
 * kind, plus order id or symbol where the command has one, and at most one
 * request per correlation key is outstanding at a time: a second caller
 * queues behind the first (fair) instead of racing it for the same lines.
 * ERR lines carry no subject and go to the oldest waiting request.
 *
 * Records whose kind is delivered as an event are additionally fanned out to
 * subscribers of that kind, in arrival order, outside the lock.
 */
public class ResponseRouter implements RecordSink {

    private static final Logger log = LoggerFactory.getLogger(ResponseRouter.class);

    private final String endpoint;
    private final ConnectionMetrics metrics;
    private final Duration listSettle;

    // Pending table and subscriber registry share this lock
    private final Object lock = new Object();
    private final Deque<PendingRequest> pending = new ArrayDeque<>();
    private final Map<RecordKind, List<RecordSubscriber>> subscribers = new EnumMap<>(RecordKind.class);

    private final Map<String, Semaphore> inFlight = new ConcurrentHashMap<>();

    public ResponseRouter(String endpoint, ConnectionMetrics metrics, Duration listSettle) {
        this.endpoint = endpoint;
        this.metrics = metrics;
        this.listSettle = listSettle;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // REQUEST / RESPONSE
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Send a command and block until its response is complete.
     *
     * @param transmit writes the encoded line (normally ConnectionManager::send)
     * @return records of the response; a lone ERR record when the daemon
     *         answered with an error; data records only for framed responses
     * @throws RequestTimeoutException if the deadline passes, including time
     *         spent queued behind another request with the same key
     * @throws RequestCancelledException if the session ends first
     */
    public List<WireRecord> request(Command command, Consumer<String> transmit, Duration timeout) {
        ResponseSpec spec = command.response();
        String verb = command.kind().verb();
        long startNanos = System.nanoTime();
        long deadline = startNanos + timeout.toNanos();
        Semaphore gate = inFlight.computeIfAbsent(spec.correlationKey(), k -> new Semaphore(1, true));

        String outcome = "OK";
        try {
            if (!gate.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                outcome = "TIMEOUT";
                throw new RequestTimeoutException(verb, timeout);
            }
            try {
                PendingRequest request = new PendingRequest(command);
                synchronized (lock) {
                    pending.addLast(request);
                }
                try {
                    transmit.accept(WireCodec.encode(command));
                    List<WireRecord> records = collect(request, deadline, timeout);
                    if (records.size() == 1 && records.get(0).kind() == RecordKind.ERR) {
                        outcome = "ERROR";
                    }
                    return records;
                } finally {
                    synchronized (lock) {
                        pending.remove(request);
                    }
                }
            } finally {
                gate.release();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = "CANCELLED";
            throw new RequestCancelledException(verb, new IllegalStateException("Interrupted"));
        } catch (RequestTimeoutException e) {
            outcome = "TIMEOUT";
            throw e;
        } catch (RequestCancelledException e) {
            outcome = "CANCELLED";
            throw e;
        } catch (RuntimeException e) {
            outcome = "FAILED";
            throw e;
        } finally {
            metrics.recordRequest(endpoint, spec.correlationKey(), outcome,
                Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    private List<WireRecord> collect(PendingRequest request, long deadline, Duration timeout)
            throws InterruptedException {
        String verb = request.verb();
        switch (request.spec().mode()) {
            case SINGLE -> {
                WireRecord record = request.poll(deadline - System.nanoTime());
                if (record == null) {
                    throw new RequestTimeoutException(verb, timeout);
                }
                return List.of(record);
            }
            case LIST -> {
                WireRecord first = request.poll(deadline - System.nanoTime());
                if (first == null) {
                    throw new RequestTimeoutException(verb, timeout);
                }
                if (first.kind() == RecordKind.ERR) {
                    return List.of(first);
                }
                List<WireRecord> records = new ArrayList<>();
                records.add(first);
                while (true) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        log.debug("[{}] {} still streaming at deadline, returning {} records",
                            endpoint, verb, records.size());
                        return records;
                    }
                    WireRecord next = request.poll(Math.min(listSettle.toNanos(), remaining));
                    if (next == null) {
                        return records;
                    }
                    records.add(next);
                }
            }
            case FRAMED -> {
                List<WireRecord> records = new ArrayList<>();
                while (true) {
                    WireRecord next = request.poll(deadline - System.nanoTime());
                    if (next == null) {
                        throw new RequestTimeoutException(verb, timeout);
                    }
                    switch (next.kind()) {
                        case ERR -> {
                            return List.of(next);
                        }
                        case END_DATA -> {
                            return records;
                        }
                        case BEGIN_DATA -> records.clear();
                        default -> records.add(next);
                    }
                }
            }
            default -> throw new IllegalStateException("Unhandled mode " + request.spec().mode());
        }
    }

    /**
     * Fail every waiting request with the given cause.
     */
    public void cancelAll(RuntimeException cause) {
        synchronized (lock) {
            if (!pending.isEmpty()) {
                log.info("[{}] Cancelling {} pending request(s): {}", endpoint, pending.size(), cause.getMessage());
            }
            for (PendingRequest request : pending) {
                request.cancel(cause);
            }
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INBOUND
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void onRecord(WireRecord record) {
        boolean claimed = false;
        List<RecordSubscriber> targets = List.of();
        synchronized (lock) {
            for (PendingRequest request : pending) {
                if (request.claim(record)) {
                    claimed = true;
                    break;
                }
            }
            if (record.kind().delivery().isEvent()) {
                targets = subscribers.getOrDefault(record.kind(), List.of());
            }
        }

        if (!claimed && !record.kind().delivery().isEvent()) {
            log.debug("[{}] Unsolicited {} dropped", endpoint, record.kind().tag());
            return;
        }
        fanOut(record, targets);
    }

    @Override
    public void onDisconnect(RuntimeException cause) {
        cancelAll(cause);
    }

    /**
     * Fan a record out to subscribers without touching the pending table.
     */
    public void publish(WireRecord record) {
        List<RecordSubscriber> targets;
        synchronized (lock) {
            targets = subscribers.getOrDefault(record.kind(), List.of());
        }
        fanOut(record, targets);
    }

    private void fanOut(WireRecord record, List<RecordSubscriber> targets) {
        for (RecordSubscriber subscriber : targets) {
            try {
                subscriber.onRecord(record);
            } catch (RuntimeException e) {
                log.error("[{}] Subscriber failed on {}", endpoint, record.kind().tag(), e);
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SUBSCRIPTIONS
    // ═══════════════════════════════════════════════════════════════════════

    public Subscription subscribe(RecordKind kind, RecordSubscriber subscriber) {
        synchronized (lock) {
            subscribers.computeIfAbsent(kind, k -> new CopyOnWriteArrayList<>()).add(subscriber);
        }
        return () -> {
            synchronized (lock) {
                List<RecordSubscriber> list = subscribers.get(kind);
                if (list != null) {
                    list.remove(subscriber);
                }
            }
        };
    }

    public int subscriberCount(RecordKind kind) {
        synchronized (lock) {
            List<RecordSubscriber> list = subscribers.get(kind);
            return list != null ? list.size() : 0;
        }
    }
}
