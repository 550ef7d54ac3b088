package com.darwinlink.application.client;

/**
 * Uniform result of every facade operation.
 *
 * success=false means the call itself failed (transport, protocol,
 * validation). A business rejection by the daemon is a successful call whose
 * data says REJECTED. warning is set when the call went through a degraded
 * session.
 */
public record ApiResult<T>(
    boolean success,
    T data,
    String error,
    ApiErrorCode errorCode,
    String warning
) {
    public static <T> ApiResult<T> ofSuccess(T data) {
        return new ApiResult<>(true, data, null, null, null);
    }

    public static <T> ApiResult<T> ofSuccess(T data, String warning) {
        return new ApiResult<>(true, data, null, null, warning);
    }

    public static <T> ApiResult<T> ofFailure(String error, ApiErrorCode errorCode) {
        return new ApiResult<>(false, null, error, errorCode, null);
    }

    public boolean hasWarning() {
        return warning != null;
    }
}
