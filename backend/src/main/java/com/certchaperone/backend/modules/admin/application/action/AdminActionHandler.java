package com.certchaperone.backend.modules.admin.application.action;

import java.util.Map;

import com.certchaperone.backend.modules.admin.application.AdminRequestContext;

/**
 * Executes one admin action against an already validated request.
 *
 * @param <R> request type the dispatcher binds and validates before calling the handler
 */
@FunctionalInterface
public interface AdminActionHandler<R> {

    /**
     * @return payload keys merged into the success envelope, in rendering order
     */
    Map<String, Object> handle(R request, AdminRequestContext context);
}
