package com.certchaperone.backend.modules.admin.presentation.dto;

final class RequestPatterns {

    static final String UUID = "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$";

    private RequestPatterns() {
    }
}
