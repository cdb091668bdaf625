package com.instorm.scorecard.exception;

/**
 * Raised for any Scorecard API failure that is not an authorization problem:
 * transport faults, non-2xx statuses and response bodies that do not match the
 * expected shape.
 */
public class ApiException extends RuntimeException {

    private final Integer status;

    public ApiException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ApiException(String message, Integer status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * HTTP status reported by the API, or {@code null} when the call never got a response.
     */
    public Integer getStatus() {
        return status;
    }
}
