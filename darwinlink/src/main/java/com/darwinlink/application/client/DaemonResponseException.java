package com.darwinlink.application.client;

/**
 * Response arrived but cannot be turned into the requested result:
 * the daemon answered ERR, or with an unexpected record kind.
 */
class DaemonResponseException extends RuntimeException {

    private final ApiErrorCode errorCode;

    DaemonResponseException(ApiErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    ApiErrorCode getErrorCode() {
        return errorCode;
    }
}
