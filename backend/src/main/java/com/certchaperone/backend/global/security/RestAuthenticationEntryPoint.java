package com.certchaperone.backend.global.security;

import java.io.IOException;

import com.certchaperone.backend.global.error.ErrorCode;
import com.certchaperone.backend.global.error.ErrorResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        Object failure = request.getAttribute(JwtAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE);
        ErrorCode code = failure instanceof ErrorCode errorCode ? errorCode : ErrorCode.AUTH_MISSING;
        ErrorResponse body = ErrorResponse.of(code, messageFor(code));

        response.setStatus(code.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }

    private String messageFor(ErrorCode code) {
        return switch (code) {
            case AUTH_INVALID -> "Invalid token";
            case CONFIG_ERROR -> "Server configuration error";
            default -> "Unauthorized";
        };
    }
}
