package com.darwinlink.infrastructure.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Periodic status probe for a daemon session.
 *
 * Every interval the ping function is run (a DARWINSTATUS command); if no
 * reply is recorded within the timeout the session is reported unhealthy.
 * The next reply reports it healthy again. An unhealthy session is still
 * used; this only drives CONNECTED / DEGRADED.
 *
 * One instance per session: {@link #stop()} shuts the scheduler down.
 */
public class HeartbeatManager {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatManager.class);

    private final String name;
    private final Duration interval;
    private final Duration timeout;
    private final Runnable pingFunction;
    private final Consumer<Boolean> healthCallback;

    private final ScheduledExecutorService scheduler;
    private final Object healthLock = new Object();
    private volatile ScheduledFuture<?> pingTask;
    private volatile ScheduledFuture<?> timeoutTask;
    private volatile Instant lastPingTime;
    private volatile Instant lastPongTime;
    private volatile boolean running = false;
    private volatile boolean healthy = true;

    public HeartbeatManager(String name, Duration interval, Duration timeout,
                            Runnable pingFunction, Consumer<Boolean> healthCallback) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Heartbeat interval must be positive");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Heartbeat timeout must be positive");
        }
        this.name = name;
        this.interval = interval;
        this.timeout = timeout;
        this.pingFunction = pingFunction;
        this.healthCallback = healthCallback;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "darwin-heartbeat-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("[{}] Heartbeat already running", name);
            return;
        }

        log.info("[{}] Starting heartbeat (interval: {}ms, timeout: {}ms)",
            name, interval.toMillis(), timeout.toMillis());

        running = true;
        healthy = true;
        pingTask = scheduler.scheduleAtFixedRate(this::sendPing,
            interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("[{}] Stopping heartbeat", name);
        running = false;

        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
            timeoutTask = null;
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Record a status reply. Clears a pending timeout and restores health.
     */
    public void recordPong() {
        lastPongTime = Instant.now();

        ScheduledFuture<?> pending = timeoutTask;
        if (pending != null) {
            pending.cancel(false);
        }

        if (!healthy) {
            log.info("[{}] Status reply received, session healthy again", name);
            notifyHealth(true);
        }
    }

    public boolean isHealthy() {
        return healthy;
    }

    public boolean isRunning() {
        return running;
    }

    public Instant getLastPingTime() {
        return lastPingTime;
    }

    /**
     * @return time of the last status reply, or null if none yet
     */
    public Instant getLastPongTime() {
        return lastPongTime;
    }

    private void sendPing() {
        if (!running) {
            return;
        }

        Instant sentAt = Instant.now();
        lastPingTime = sentAt;
        log.debug("[{}] Sending status probe", name);

        try {
            pingFunction.run();
        } catch (RuntimeException e) {
            log.error("[{}] Status probe could not be sent", name, e);
            notifyHealth(false);
            return;
        }

        timeoutTask = scheduler.schedule(() -> checkReply(sentAt), timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void checkReply(Instant sentAt) {
        Instant lastPong = lastPongTime;
        if (lastPong != null && !lastPong.isBefore(sentAt)) {
            return;
        }
        log.warn("[{}] No status reply within {}ms", name, timeout.toMillis());
        notifyHealth(false);
    }

    private void notifyHealth(boolean nowHealthy) {
        synchronized (healthLock) {
            if (healthy == nowHealthy) {
                return;
            }
            healthy = nowHealthy;
            if (healthCallback != null) {
                try {
                    healthCallback.accept(nowHealthy);
                } catch (RuntimeException e) {
                    log.error("[{}] Health callback threw exception", name, e);
                }
            }
        }
    }
}
