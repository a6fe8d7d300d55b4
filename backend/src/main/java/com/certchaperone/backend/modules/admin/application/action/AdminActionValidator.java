package com.certchaperone.backend.modules.admin.application.action;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.certchaperone.backend.global.error.ErrorCode;
import com.certchaperone.backend.global.error.ProblemException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.type.LogicalType;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import org.springframework.stereotype.Component;

/**
 * Binds an action body to its request record and applies the record's Bean Validation
 * constraints. The first failing field, in declaration order, decides the error message.
 *
 * <p>Scalars bind only from their own JSON type: {@code "true"} or {@code 1} is not a boolean and
 * a number is not a string.
 */
@Component
public class AdminActionValidator {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public AdminActionValidator(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = strictScalars(objectMapper);
        this.validator = validator;
    }

    public <R> R bindAndValidate(ObjectNode body, Class<R> requestType) {
        R request = bind(body, requestType);
        Set<ConstraintViolation<R>> violations = validator.validate(request);
        if (violations.isEmpty()) {
            return request;
        }
        List<String> order = declarationOrder(requestType);
        ConstraintViolation<R> first = violations.stream()
                .min(Comparator.<ConstraintViolation<R>>comparingInt(v -> indexOf(order, fieldOf(v)))
                        .thenComparing(ConstraintViolation::getMessage))
                .orElseThrow();
        throw validationError(fieldOf(first), first.getMessage());
    }

    private <R> R bind(ObjectNode body, Class<R> requestType) {
        try {
            return objectMapper.treeToValue(body, requestType);
        } catch (JsonMappingException ex) {
            String field = ex.getPath().isEmpty() ? null : ex.getPath().get(ex.getPath().size() - 1).getFieldName();
            String message = field == null ? "Invalid input" : "Invalid value for " + field;
            throw validationError(field, message);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "Invalid input", null, ex);
        }
    }

    private static ObjectMapper strictScalars(ObjectMapper source) {
        ObjectMapper strict = source.copy();
        strict.coercionConfigFor(LogicalType.Boolean)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail);
        strict.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return strict;
    }

    private static ProblemException validationError(String field, String message) {
        Map<String, Object> details = field == null ? null : Map.of("field", field);
        return new ProblemException(ErrorCode.VALIDATION_ERROR, message, details);
    }

    private static String fieldOf(ConstraintViolation<?> violation) {
        return violation.getPropertyPath().toString();
    }

    private List<String> declarationOrder(Class<?> requestType) {
        return objectMapper.getDeserializationConfig()
                .introspect(objectMapper.constructType(requestType))
                .findProperties()
                .stream()
                .map(BeanPropertyDefinition::getInternalName)
                .toList();
    }

    private static int indexOf(List<String> order, String field) {
        int index = order.indexOf(field);
        return index < 0 ? Integer.MAX_VALUE : index;
    }
}
