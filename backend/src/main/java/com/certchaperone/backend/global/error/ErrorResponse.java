package com.certchaperone.backend.global.error;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(boolean success, String error, String errorCode, Map<String, Object> details) {

    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return of(errorCode, message, null);
    }

    public static ErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details) {
        String safeMessage = (message != null && !message.isBlank())
                ? message
                : errorCode.getStatus().getReasonPhrase();
        return new ErrorResponse(false, safeMessage, errorCode.name(), details);
    }
}
