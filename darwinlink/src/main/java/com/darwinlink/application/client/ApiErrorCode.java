package com.darwinlink.application.client;

/**
 * Why a facade call failed.
 *
 * Transport and protocol kinds may be retried by the caller; the library
 * never retries on its own.
 */
public enum ApiErrorCode {
    CONNECTION,         // Socket could not be opened or was lost
    NOT_CONNECTED,      // connect() not called, or session ended
    TIMEOUT,            // No complete response before the deadline
    CANCELLED,          // Session ended while waiting
    PROTOCOL,           // Response did not have the expected shape
    DAEMON_ERROR,       // Daemon answered ERR
    ORDER_NOT_FOUND,
    INVALID_STATE,      // Order transition not allowed
    VALIDATION,         // Bad parameters, nothing was sent
    NOT_SUPPORTED,      // Operation not available in this mode
    INTERNAL
}
