package com.darwinlink.infrastructure.routing;

import java.time.Duration;

/**
 * No complete response arrived within the caller's deadline.
 */
public class RequestTimeoutException extends RuntimeException {

    private final String verb;
    private final Duration timeout;

    public RequestTimeoutException(String verb, Duration timeout) {
        super(String.format("%s: no response within %dms", verb, timeout.toMillis()));
        this.verb = verb;
        this.timeout = timeout;
    }

    public String getVerb() {
        return verb;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
