package com.darwinlink.infrastructure.connection;

import com.darwinlink.domain.session.LivenessState;
import com.darwinlink.domain.session.Session;
import com.darwinlink.domain.session.SessionMode;
import com.darwinlink.infrastructure.metrics.ConnectionMetrics;
import com.darwinlink.infrastructure.protocol.Command;
import com.darwinlink.infrastructure.protocol.RecordKind;
import com.darwinlink.infrastructure.protocol.UnknownRecordKindException;
import com.darwinlink.infrastructure.protocol.WireCodec;
import com.darwinlink.infrastructure.protocol.WireFormatException;
import com.darwinlink.infrastructure.protocol.WireRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns one socket to one daemon endpoint.
 *
 * Lifecycle:
 * - connect(): DISCONNECTED -> CONNECTING -> CONNECTED (or back to DISCONNECTED)
 * - heartbeat: CONNECTED <-> DEGRADED (trading endpoint only)
 * - disconnect() / EOF / read error: -> DISCONNECTED, sink released
 *
 * A daemon thread reads lines for the lifetime of each socket, decodes them
 * and hands records to the {@link RecordSink} in arrival order. Lines that
 * do not decode are logged and skipped.
 *
 * Not shared between sessions: the daemon protocol has no multiplexing.
 */
public class ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    static final String SKIP_MALFORMED = "MALFORMED";
    static final String SKIP_UNKNOWN_KIND = "UNKNOWN_KIND";

    private final Endpoint endpoint;
    private final RecordSink sink;
    private final ConnectionMetrics metrics;
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lifecycleLock = new Object();
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile Duration heartbeatInterval;
    private volatile Duration heartbeatTimeout;
    private volatile Duration retryInitialDelay = Duration.ofMillis(200);
    private volatile Duration retryMaxDelay = Duration.ofSeconds(5);

    private volatile LivenessState state = LivenessState.DISCONNECTED;
    private volatile Instant lastHeartbeat;
    private volatile HeartbeatManager heartbeat;

    // Guarded by lifecycleLock
    private Socket socket;
    private BufferedWriter writer;

    public ConnectionManager(Endpoint endpoint, RecordSink sink, ConnectionMetrics metrics) {
        this.endpoint = endpoint;
        this.sink = sink;
        this.metrics = metrics;
    }

    /**
     * Probe liveness with DARWINSTATUS. Only honoured on the trading
     * endpoint; the historical port does not answer status queries.
     */
    public void enableHeartbeat(Duration interval, Duration timeout) {
        this.heartbeatInterval = interval;
        this.heartbeatTimeout = timeout;
    }

    public void setRetryBackoff(Duration initialDelay, Duration maxDelay) {
        this.retryInitialDelay = initialDelay;
        this.retryMaxDelay = maxDelay;
    }

    public void addStateListener(ConnectionStateListener listener) {
        listeners.add(listener);
    }

    public void removeStateListener(ConnectionStateListener listener) {
        listeners.remove(listener);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CONNECT / DISCONNECT
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Open the socket. No-op when already connected.
     *
     * @throws DarwinConnectionException on refusal or timeout
     */
    public void connect(Duration timeout) {
        synchronized (lifecycleLock) {
            if (state.isUsable()) {
                log.debug("[{}] Already connected", endpoint.name());
                return;
            }

            transition(LivenessState.CONNECTING);
            metrics.recordConnectAttempt(endpoint.name());
            long startNanos = System.nanoTime();

            Socket s = new Socket();
            BufferedReader reader;
            try {
                s.connect(new InetSocketAddress(endpoint.host(), endpoint.port()), (int) timeout.toMillis());
                s.setTcpNoDelay(true);
                reader = new BufferedReader(new InputStreamReader(s.getInputStream(), StandardCharsets.UTF_8));
                writer = new BufferedWriter(new OutputStreamWriter(s.getOutputStream(), StandardCharsets.UTF_8));
            } catch (IOException e) {
                closeSocket(s);
                writer = null;
                metrics.recordConnectResult(endpoint.name(), false, Duration.ofNanos(System.nanoTime() - startNanos));
                transition(LivenessState.DISCONNECTED);
                throw new DarwinConnectionException(endpoint, "Connection failed: " + e.getMessage(), e);
            }

            socket = s;
            lastHeartbeat = null;
            metrics.recordConnectResult(endpoint.name(), true, Duration.ofNanos(System.nanoTime() - startNanos));
            transition(LivenessState.CONNECTED);
            log.info("[{}] ✅ Connected to {}:{}", endpoint.name(), endpoint.host(), endpoint.port());

            Thread readThread = new Thread(() -> readLoop(s, reader), "darwin-read-" + endpoint.name());
            readThread.setDaemon(true);
            readThread.start();

            startHeartbeat();
        }
    }

    /**
     * Open the socket, retrying with exponential backoff.
     *
     * @param attempts total attempts, at least 1
     * @throws DarwinConnectionException when every attempt failed
     */
    public void connect(Duration timeout, int attempts) {
        if (attempts <= 1) {
            connect(timeout);
            return;
        }

        ConnectRetryPolicy policy = ConnectRetryPolicy.builder()
            .initialDelay(retryInitialDelay)
            .maxDelay(retryMaxDelay)
            .maxAttempts(attempts)
            .build();

        DarwinConnectionException lastFailure = null;
        while (policy.shouldRetry()) {
            try {
                connect(timeout);
                policy.recordSuccess();
                return;
            } catch (DarwinConnectionException e) {
                lastFailure = e;
                policy.recordFailure();
                log.warn("[{}] Connect attempt {}/{} failed: {}",
                    endpoint.name(), policy.getFailedAttempts(), attempts, e.getMessage());
                if (policy.shouldRetry()) {
                    sleep(policy.getNextDelay());
                }
            }
        }
        throw new DarwinConnectionException(endpoint, "Giving up after " + attempts + " attempts", lastFailure);
    }

    /**
     * Close the socket and release every waiting request. Safe to call in
     * any state, any number of times.
     */
    public void disconnect() {
        HeartbeatManager stoppedHeartbeat;
        boolean wasOpen;
        synchronized (lifecycleLock) {
            wasOpen = socket != null;
            stoppedHeartbeat = heartbeat;
            heartbeat = null;
            closeSocket(socket);
            socket = null;
            writer = null;
            if (state != LivenessState.DISCONNECTED) {
                transition(LivenessState.DISCONNECTED);
            }
        }
        if (stoppedHeartbeat != null) {
            stoppedHeartbeat.stop();
        }
        if (wasOpen) {
            log.info("[{}] Disconnected", endpoint.name());
            sink.onDisconnect(new DarwinConnectionException(endpoint, "Disconnected by client"));
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // WRITE
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Write one command line. Concurrent callers never interleave.
     *
     * @throws NotConnectedException unless CONNECTED or DEGRADED
     * @throws DarwinConnectionException if the write fails
     */
    public void send(String line) {
        if (line.indexOf('\n') >= 0 || line.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Command line must not contain line breaks");
        }
        LivenessState current = state;
        if (!current.isUsable()) {
            throw new NotConnectedException(endpoint.name(), current);
        }

        writeLock.lock();
        try {
            BufferedWriter w = writer;
            if (w == null) {
                throw new NotConnectedException(endpoint.name(), state);
            }
            log.debug("[{}] >> {}", endpoint.name(), line);
            w.write(line);
            w.write('\n');
            w.flush();
        } catch (IOException e) {
            throw new DarwinConnectionException(endpoint, "Write failed: " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // STATE
    // ═══════════════════════════════════════════════════════════════════════

    public LivenessState state() {
        return state;
    }

    public boolean isConnected() {
        return state.isUsable();
    }

    public Endpoint endpoint() {
        return endpoint;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public Session session(SessionMode mode) {
        return new Session(endpoint.name(), endpoint.host(), endpoint.port(), mode, state, lastHeartbeat);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // READ LOOP
    // ═══════════════════════════════════════════════════════════════════════

    private void readLoop(Socket s, BufferedReader reader) {
        IOException failure = null;
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                handleLine(line);
            }
        } catch (IOException e) {
            failure = e;
        }
        onReadLoopExit(s, failure);
    }

    void handleLine(String line) {
        if (line.isBlank()) {
            return;
        }
        log.trace("[{}] << {}", endpoint.name(), line);

        WireRecord record;
        try {
            record = WireCodec.decode(line);
        } catch (UnknownRecordKindException e) {
            log.debug("[{}] Skipping line with unknown tag '{}'", endpoint.name(), e.getTag());
            metrics.recordSkippedLine(endpoint.name(), SKIP_UNKNOWN_KIND);
            return;
        } catch (WireFormatException e) {
            log.warn("[{}] ⚠️ Skipping malformed line: {}", endpoint.name(), e.getMessage());
            metrics.recordSkippedLine(endpoint.name(), SKIP_MALFORMED);
            return;
        }

        metrics.recordDecodedLine(endpoint.name(), record.kind());
        if (record.kind() == RecordKind.DARWIN_STATUS) {
            lastHeartbeat = Instant.now();
            metrics.recordStatusCheck(endpoint.name());
            HeartbeatManager hb = heartbeat;
            if (hb != null) {
                hb.recordPong();
            }
        }

        try {
            sink.onRecord(record);
        } catch (RuntimeException e) {
            log.error("[{}] Record sink failed on {}", endpoint.name(), record.kind(), e);
        }
    }

    private void onReadLoopExit(Socket s, IOException failure) {
        HeartbeatManager stoppedHeartbeat;
        synchronized (lifecycleLock) {
            if (socket != s) {
                // Closed by disconnect(); already handled there
                return;
            }
            if (failure != null) {
                log.warn("[{}] Connection lost: {}", endpoint.name(), failure.getMessage());
            } else {
                log.warn("[{}] Daemon closed the connection", endpoint.name());
            }
            stoppedHeartbeat = heartbeat;
            heartbeat = null;
            closeSocket(socket);
            socket = null;
            writer = null;
            transition(LivenessState.DISCONNECTED);
        }
        if (stoppedHeartbeat != null) {
            stoppedHeartbeat.stop();
        }
        sink.onDisconnect(failure != null
            ? new DarwinConnectionException(endpoint, "Connection lost", failure)
            : new DarwinConnectionException(endpoint, "Connection closed by daemon"));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HEARTBEAT
    // ═══════════════════════════════════════════════════════════════════════

    private void startHeartbeat() {
        Duration interval = heartbeatInterval;
        Duration timeout = heartbeatTimeout;
        if (!endpoint.isTrading() || interval == null || timeout == null || interval.isZero()) {
            return;
        }
        String statusLine = WireCodec.encode(Command.status());
        HeartbeatManager hb = new HeartbeatManager(endpoint.name(), interval, timeout,
            () -> send(statusLine), this::onHealthChange);
        heartbeat = hb;
        hb.start();
    }

    private void onHealthChange(boolean healthy) {
        synchronized (lifecycleLock) {
            if (!healthy && state == LivenessState.CONNECTED) {
                log.warn("[{}] ⚠️ Heartbeat overdue, session degraded", endpoint.name());
                transition(LivenessState.DEGRADED);
            } else if (healthy && state == LivenessState.DEGRADED) {
                log.info("[{}] Heartbeat restored", endpoint.name());
                transition(LivenessState.CONNECTED);
            }
        }
    }

    // Caller holds lifecycleLock
    private void transition(LivenessState next) {
        LivenessState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        metrics.recordStateChange(endpoint.name(), previous, next);
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChange(endpoint, previous, next);
            } catch (RuntimeException e) {
                log.error("[{}] State listener threw exception", endpoint.name(), e);
            }
        }
    }

    private void closeSocket(Socket s) {
        if (s == null) {
            return;
        }
        try {
            s.close();
        } catch (IOException e) {
            log.debug("[{}] Error closing socket: {}", endpoint.name(), e.getMessage());
        }
    }

    private void sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DarwinConnectionException(endpoint, "Interrupted while waiting to reconnect", e);
        }
    }
}
