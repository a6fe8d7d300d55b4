package com.certchaperone.backend.modules.admin.presentation.dto;

import java.util.LinkedHashMap;
import java.util.Map;

public record AdminOverviewResponse(
        long totalUsers,
        long totalVehicles,
        long verifiedVehicles,
        long totalDocuments,
        long expiringThisMonth,
        long suspendedUsers
) {

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("totalUsers", totalUsers);
        payload.put("totalVehicles", totalVehicles);
        payload.put("verifiedVehicles", verifiedVehicles);
        payload.put("totalDocuments", totalDocuments);
        payload.put("expiringThisMonth", expiringThisMonth);
        payload.put("suspendedUsers", suspendedUsers);
        return payload;
    }
}
