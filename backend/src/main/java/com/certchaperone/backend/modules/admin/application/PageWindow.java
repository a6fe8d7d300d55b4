package com.certchaperone.backend.modules.admin.application;

import com.certchaperone.backend.modules.admin.presentation.dto.Pagination;
import com.fasterxml.jackson.databind.JsonNode;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

/**
 * Normalised page coordinates. {@code page} is 1-based.
 *
 * <p>Missing, zero or non-numeric inputs fall back to the defaults; negative page sizes and pages
 * clamp to 1; page sizes above the maximum clamp to the maximum. Fractions are truncated.
 */
public record PageWindow(int page, int pageSize) {

    public static final int DEFAULT_PAGE = 1;

    public PageWindow {
        if (page < 1 || pageSize < 1) {
            throw new IllegalArgumentException("page and pageSize must be positive");
        }
    }

    public static PageWindow resolve(JsonNode page, JsonNode pageSize, int defaultPageSize, int maxPageSize) {
        int resolvedPage = Math.max(1, numericOrDefault(page, DEFAULT_PAGE));
        int resolvedSize = Math.min(maxPageSize, Math.max(1, numericOrDefault(pageSize, defaultPageSize)));
        return new PageWindow(resolvedPage, resolvedSize);
    }

    public long offset() {
        return (long) (page - 1) * pageSize;
    }

    public PageRequest toPageRequest() {
        return PageRequest.of(page - 1, pageSize);
    }

    public PageRequest toPageRequest(Sort sort) {
        return PageRequest.of(page - 1, pageSize, sort);
    }

    public Pagination paginationFor(long totalCount) {
        long totalPages = (totalCount + pageSize - 1) / pageSize;
        return new Pagination(page, pageSize, totalCount, totalPages);
    }

    private static int numericOrDefault(JsonNode node, int fallback) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return fallback;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException ex) {
                return fallback;
            }
        } else {
            return fallback;
        }
        if (Double.isNaN(value) || value == 0) {
            return fallback;
        }
        if (value >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (value <= Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) value;
    }
}
