package com.certchaperone.backend.modules.admin.application.action;

import java.time.Clock;
import java.util.Map;

import com.certchaperone.backend.global.error.ErrorCode;
import com.certchaperone.backend.global.error.ProblemException;
import com.certchaperone.backend.modules.admin.application.AdminRequestContext;
import com.certchaperone.backend.modules.admin.application.action.AdminActionRegistry.RegisteredAction;
import com.certchaperone.backend.modules.admin.domain.AdminActionType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Parses the request body, resolves the action type against the whitelist, binds and validates
 * the action's request and hands it to the registered handler.
 */
@Service
public class AdminActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AdminActionDispatcher.class);

    private final AdminActionRegistry registry;
    private final AdminActionValidator validator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AdminActionDispatcher(AdminActionRegistry registry,
                                 AdminActionValidator validator,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.registry = registry;
        this.validator = validator;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public DispatchResult dispatch(String rawBody, AdminRequestContext context) {
        ObjectNode body = parseBody(rawBody);
        AdminActionType type = resolveType(body);
        RegisteredAction<?> action = registry.find(type)
                .orElseThrow(() -> new ProblemException(ErrorCode.UNKNOWN_ACTION,
                        "Unknown action type: " + type.getWireName()));
        try {
            Map<String, Object> payload = invoke(action, body, context);
            if (type.isMutating()) {
                log.info("{} applied in {}ms by {}", type.getWireName(), context.elapsedMillis(clock),
                        context.actorEmail());
            } else {
                log.debug("{} completed in {}ms for {}", type.getWireName(), context.elapsedMillis(clock),
                        context.actorEmail());
            }
            return new DispatchResult(type, payload);
        } catch (ProblemException ex) {
            if (ex.getErrorCode().getStatus().is5xxServerError()) {
                log.error("{} failed with {} after {}ms", type.getWireName(), ex.getErrorCode(),
                        context.elapsedMillis(clock));
            } else {
                log.info("{} rejected with {} after {}ms", type.getWireName(), ex.getErrorCode(),
                        context.elapsedMillis(clock));
            }
            throw ex;
        } catch (RuntimeException ex) {
            log.error("{} failed after {}ms", type.getWireName(), context.elapsedMillis(clock), ex);
            throw ex;
        }
    }

    private <R> Map<String, Object> invoke(RegisteredAction<R> action, ObjectNode body, AdminRequestContext context) {
        R request = validator.bindAndValidate(body, action.requestType());
        if (context.isExpired(clock)) {
            throw new ProblemException(ErrorCode.DEADLINE_EXCEEDED, "Request deadline exceeded");
        }
        return action.handler().handle(request, context);
    }

    private ObjectNode parseBody(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw new ProblemException(ErrorCode.INVALID_JSON, "Invalid JSON body");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException ex) {
            throw new ProblemException(ErrorCode.INVALID_JSON, "Invalid JSON body", null, ex);
        }
        if (node == null || !node.isObject()) {
            throw new ProblemException(ErrorCode.INVALID_JSON, "Invalid JSON body");
        }
        return (ObjectNode) node;
    }

    private AdminActionType resolveType(ObjectNode body) {
        JsonNode typeNode = body.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new ProblemException(ErrorCode.INVALID_ACTION, "Invalid action type: " + describe(typeNode));
        }
        String wireName = typeNode.asText();
        return AdminActionType.fromWire(wireName)
                .orElseThrow(() -> new ProblemException(ErrorCode.INVALID_ACTION, "Invalid action type: " + wireName));
    }

    private static String describe(JsonNode typeNode) {
        return typeNode == null ? "missing" : typeNode.toString();
    }

    public record DispatchResult(AdminActionType type, Map<String, Object> payload) {
    }
}
