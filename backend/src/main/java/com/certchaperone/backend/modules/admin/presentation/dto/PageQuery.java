package com.certchaperone.backend.modules.admin.presentation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw paging inputs. Kept as JSON nodes so that strings and garbage can fall back to defaults
 * instead of failing the request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PageQuery(JsonNode page, JsonNode pageSize) {
}
