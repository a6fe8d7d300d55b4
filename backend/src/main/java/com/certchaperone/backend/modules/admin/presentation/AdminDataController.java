package com.certchaperone.backend.modules.admin.presentation;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import com.certchaperone.backend.global.security.JwtAuthenticationPrincipal;
import com.certchaperone.backend.global.security.SecurityUtils;
import com.certchaperone.backend.global.web.RequestIdFilter;
import com.certchaperone.backend.modules.admin.application.AdminRequestContext;
import com.certchaperone.backend.modules.admin.application.action.AdminActionDispatcher;
import com.certchaperone.backend.modules.admin.application.action.AdminActionDispatcher.DispatchResult;
import com.certchaperone.backend.modules.auth.application.RoleAuthority;
import com.certchaperone.backend.modules.auth.domain.AppRole;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Admin data", description = "Aggregated admin reads and moderation actions")
public class AdminDataController {

    private final RoleAuthority roleAuthority;
    private final AdminActionDispatcher dispatcher;
    private final Clock clock;
    private final Duration requestTimeout;

    public AdminDataController(
            RoleAuthority roleAuthority,
            AdminActionDispatcher dispatcher,
            Clock clock,
            @Value("${app.admin.request-timeout:PT10S}") Duration requestTimeout
    ) {
        this.roleAuthority = roleAuthority;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.requestTimeout = requestTimeout;
    }

    /**
     * The body is read as text so that the role check runs before any JSON parsing.
     */
    @Operation(summary = "Run one admin action", description = "Body: {\"type\": <action>, ...action fields}")
    @PostMapping(path = "/functions/v1/admin-data", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> handle(@RequestBody(required = false) String body,
                                                      HttpServletRequest request) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        roleAuthority.requireRole(principal.userId(), AppRole.SUPER_ADMIN);

        AdminRequestContext context = AdminRequestContext.start(
                RequestIdFilter.currentRequestId(request),
                principal.userId(),
                principal.email(),
                clock,
                requestTimeout);
        DispatchResult result = dispatcher.dispatch(body, context);

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("success", true);
        envelope.putAll(result.payload());
        return ResponseEntity.ok(envelope);
    }
}
