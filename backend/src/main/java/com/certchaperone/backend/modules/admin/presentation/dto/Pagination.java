package com.certchaperone.backend.modules.admin.presentation.dto;

public record Pagination(int page, int pageSize, long totalCount, long totalPages) {
}
