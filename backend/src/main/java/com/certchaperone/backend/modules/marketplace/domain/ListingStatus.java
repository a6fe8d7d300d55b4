package com.certchaperone.backend.modules.marketplace.domain;

import java.util.Arrays;

public enum ListingStatus {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected"),
    ON_HOLD("on_hold"),
    CANCELLED("cancelled");

    private final String code;

    ListingStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Only listings still awaiting a decision may be reviewed, and the decision must change the status.
     */
    public boolean canBeReviewedAs(ListingStatus decision) {
        return (this == PENDING || this == ON_HOLD) && decision != this;
    }

    public static ListingStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(status -> status.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown listing status: " + code));
    }
}
