package com.certchaperone.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.certchaperone.backend.global.error.ErrorCode;
import com.certchaperone.backend.modules.auth.application.JwtTokenService;
import com.certchaperone.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.certchaperone.backend.modules.auth.application.JwtTokenService.ParsedToken;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Verifies the bearer token and populates the security context.
 *
 * <p>The filter never writes a response itself. When the credential is missing or unusable it records
 * the failure under {@link #AUTH_FAILURE_ATTRIBUTE} and lets the authorization rules reject the request,
 * so {@link RestAuthenticationEntryPoint} renders the envelope with the matching error code.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTH_FAILURE_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".FAILURE";

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService jwtTokenService;

    public JwtAuthenticationFilter(JwtTokenService jwtTokenService) {
        this.jwtTokenService = jwtTokenService;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            log.info("Missing or invalid auth header");
            request.setAttribute(AUTH_FAILURE_ATTRIBUTE, ErrorCode.AUTH_MISSING);
            filterChain.doFilter(request, response);
            return;
        }

        if (!jwtTokenService.isConfigured()) {
            log.error("Token signing secret is not configured");
            request.setAttribute(AUTH_FAILURE_ATTRIBUTE, ErrorCode.CONFIG_ERROR);
            filterChain.doFilter(request, response);
            return;
        }

        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        try {
            ParsedToken parsed = jwtTokenService.parseAccessToken(token);
            JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(parsed.userId(), parsed.email());

            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(principal, token, List.of());
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        } catch (InvalidTokenException ex) {
            log.info("Invalid token: {}", ex.getMessage());
            SecurityContextHolder.clearContext();
            request.setAttribute(AUTH_FAILURE_ATTRIBUTE, ErrorCode.AUTH_INVALID);
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = request.getServletPath();
        return path.startsWith("/health")
                || path.startsWith("/readyz")
                || path.startsWith("/actuator")
                || path.startsWith("/v3/api-docs")
                || path.startsWith("/swagger-ui");
    }
}
