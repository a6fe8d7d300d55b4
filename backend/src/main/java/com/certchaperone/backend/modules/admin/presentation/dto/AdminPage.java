package com.certchaperone.backend.modules.admin.presentation.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One page of rows plus its pagination block. Rendered as {@code {"<collection>": [...], "pagination": {...}}}.
 */
public record AdminPage<T>(List<T> rows, Pagination pagination) {

    public Map<String, Object> toPayload(String collectionName) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(collectionName, rows);
        payload.put("pagination", pagination);
        return payload;
    }
}
