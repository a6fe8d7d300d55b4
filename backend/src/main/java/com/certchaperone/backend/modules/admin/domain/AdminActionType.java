package com.certchaperone.backend.modules.admin.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of actions accepted by the admin endpoint, keyed by their wire name.
 */
public enum AdminActionType {
    OVERVIEW("overview", false),
    USERS("users", false),
    ACTIVITY("activity", false),
    VEHICLES("vehicles", false),
    TRANSFERS("transfers", false),
    CLAIMS("claims", false),
    LISTINGS("listings", false),
    SUSPEND_USER("suspend_user", true),
    UNSUSPEND_USER("unsuspend_user", true),
    SET_VEHICLE_VERIFICATION("set_vehicle_verification", true),
    GET_VEHICLE_FOR_CLAIM("get_vehicle_for_claim", false),
    UPDATE_CLAIM_STATUS("update_claim_status", true),
    UPDATE_LISTING_STATUS("update_listing_status", true);

    private final String wireName;
    private final boolean mutating;

    AdminActionType(String wireName, boolean mutating) {
        this.wireName = wireName;
        this.mutating = mutating;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isMutating() {
        return mutating;
    }

    public static Optional<AdminActionType> fromWire(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }
}
