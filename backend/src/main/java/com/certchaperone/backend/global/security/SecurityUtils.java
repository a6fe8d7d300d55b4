package com.certchaperone.backend.global.security;

import com.certchaperone.backend.global.error.ErrorCode;
import com.certchaperone.backend.global.error.ProblemException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * @throws ProblemException {@link ErrorCode#AUTH_MISSING} when the filter chain did not authenticate a bearer token
     */
    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            return principal;
        }
        throw new ProblemException(ErrorCode.AUTH_MISSING, "Unauthorized");
    }
}
