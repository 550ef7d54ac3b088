package com.darwinlink.infrastructure.protocol;

/**
 * How the router treats a decoded record.
 */
public enum Delivery {
    RESPONSE,               // Only ever answers a pending request
    EVENT,                  // Unsolicited push, fanned out to subscribers
    RESPONSE_AND_EVENT;     // Answers a request and is also pushed to subscribers

    public boolean isResponse() {
        return this != EVENT;
    }

    public boolean isEvent() {
        return this != RESPONSE;
    }
}
