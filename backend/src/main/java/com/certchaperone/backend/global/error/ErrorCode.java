package com.certchaperone.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Stable machine-readable error codes returned in the {@code errorCode} field of the error envelope.
 */
public enum ErrorCode {

    AUTH_MISSING(HttpStatus.UNAUTHORIZED),
    AUTH_INVALID(HttpStatus.UNAUTHORIZED),
    CONFIG_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    ROLE_CHECK_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    INVALID_JSON(HttpStatus.BAD_REQUEST),
    INVALID_ACTION(HttpStatus.BAD_REQUEST),
    UNKNOWN_ACTION(HttpStatus.BAD_REQUEST),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    ALREADY_SUSPENDED(HttpStatus.BAD_REQUEST),
    SELF_SUSPENSION(HttpStatus.BAD_REQUEST),
    SUSPEND_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    UNSUSPEND_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    UPDATE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_TRANSITION(HttpStatus.CONFLICT),
    DEADLINE_EXCEEDED(HttpStatus.GATEWAY_TIMEOUT),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
