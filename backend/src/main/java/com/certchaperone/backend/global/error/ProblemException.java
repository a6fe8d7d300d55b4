package com.certchaperone.backend.global.error;

import java.util.Map;

import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private final ErrorCode errorCode;
    private final String message;
    private final Map<String, Object> details;

    public ProblemException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public ProblemException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    public ProblemException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(errorCode.getStatus(), message, cause);
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("ProblemException message must not be blank");
        }
        this.errorCode = errorCode;
        this.message = message;
        this.details = (details == null || details.isEmpty()) ? null : Map.copyOf(details);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
