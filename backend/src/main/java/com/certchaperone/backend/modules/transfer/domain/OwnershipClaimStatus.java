package com.certchaperone.backend.modules.transfer.domain;

import java.util.Arrays;

public enum OwnershipClaimStatus {
    PENDING("pending"),
    RESOLVED("resolved"),
    REJECTED("rejected"),
    EXPIRED("expired");

    private final String code;

    OwnershipClaimStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public static OwnershipClaimStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(status -> status.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown claim status: " + code));
    }
}
