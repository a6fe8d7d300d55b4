package com.certchaperone.backend.modules.admin.application.action;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.certchaperone.backend.modules.admin.domain.AdminActionType;

/**
 * Maps each action type to its request type and handler.
 */
public class AdminActionRegistry {

    private final Map<AdminActionType, RegisteredAction<?>> actions = new EnumMap<>(AdminActionType.class);

    public <R> AdminActionRegistry register(AdminActionType type, Class<R> requestType, AdminActionHandler<R> handler) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(requestType, "requestType");
        Objects.requireNonNull(handler, "handler");
        if (actions.putIfAbsent(type, new RegisteredAction<>(type, requestType, handler)) != null) {
            throw new IllegalStateException("Duplicate handler for action " + type.getWireName());
        }
        return this;
    }

    public Optional<RegisteredAction<?>> find(AdminActionType type) {
        return Optional.ofNullable(actions.get(type));
    }

    public Map<AdminActionType, RegisteredAction<?>> registeredActions() {
        return Collections.unmodifiableMap(actions);
    }

    public record RegisteredAction<R>(AdminActionType type, Class<R> requestType, AdminActionHandler<R> handler) {
    }
}
