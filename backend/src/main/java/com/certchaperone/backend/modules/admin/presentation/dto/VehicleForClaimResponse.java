package com.certchaperone.backend.modules.admin.presentation.dto;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public record VehicleForClaimResponse(boolean found, UUID vehicleId, UUID ownerId, String makerModel) {

    public static VehicleForClaimResponse notFound() {
        return new VehicleForClaimResponse(false, null, null, null);
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("found", found);
        if (found) {
            payload.put("vehicleId", vehicleId);
            payload.put("ownerId", ownerId);
            payload.put("makerModel", makerModel);
        }
        return payload;
    }
}
