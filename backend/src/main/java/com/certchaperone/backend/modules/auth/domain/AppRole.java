package com.certchaperone.backend.modules.auth.domain;

import java.util.Arrays;

public enum AppRole {
    SUPER_ADMIN("super_admin"),
    USER("user");

    private final String code;

    AppRole(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static AppRole fromCode(String code) {
        return Arrays.stream(values())
                .filter(role -> role.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + code));
    }
}
