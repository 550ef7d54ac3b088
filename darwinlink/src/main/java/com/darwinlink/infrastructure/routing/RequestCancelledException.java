package com.darwinlink.infrastructure.routing;

/**
 * A request was still waiting when its session ended.
 */
public class RequestCancelledException extends RuntimeException {

    private final String verb;

    public RequestCancelledException(String verb, Throwable cause) {
        super(verb + ": cancelled, " + (cause != null ? cause.getMessage() : "session closed"), cause);
        this.verb = verb;
    }

    public String getVerb() {
        return verb;
    }
}
