package com.certchaperone.backend.modules.admin.application.action;

import java.util.Map;

import com.certchaperone.backend.modules.admin.application.AdminModerationService;
import com.certchaperone.backend.modules.admin.application.AdminReadService;
import com.certchaperone.backend.modules.admin.domain.AdminActionType;
import com.certchaperone.backend.modules.admin.presentation.dto.NoArguments;
import com.certchaperone.backend.modules.admin.presentation.dto.PageQuery;
import com.certchaperone.backend.modules.admin.presentation.dto.SetVehicleVerificationRequest;
import com.certchaperone.backend.modules.admin.presentation.dto.SuspendUserRequest;
import com.certchaperone.backend.modules.admin.presentation.dto.UnsuspendUserRequest;
import com.certchaperone.backend.modules.admin.presentation.dto.UpdateClaimStatusRequest;
import com.certchaperone.backend.modules.admin.presentation.dto.UpdateListingStatusRequest;
import com.certchaperone.backend.modules.admin.presentation.dto.VehicleForClaimRequest;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AdminActionConfig {

    @Bean
    public AdminActionRegistry adminActionRegistry(AdminReadService readService,
                                                   AdminModerationService moderationService) {
        return new AdminActionRegistry()
                .register(AdminActionType.OVERVIEW, NoArguments.class,
                        (request, context) -> readService.getOverview(context).toPayload())
                .register(AdminActionType.USERS, PageQuery.class,
                        (request, context) -> readService.listUsers(request, context).toPayload("users"))
                .register(AdminActionType.ACTIVITY, PageQuery.class,
                        (request, context) -> readService.listActivity(request, context).toPayload("activity"))
                .register(AdminActionType.VEHICLES, PageQuery.class,
                        (request, context) -> readService.listVehicles(request, context).toPayload("vehicles"))
                .register(AdminActionType.TRANSFERS, PageQuery.class,
                        (request, context) -> readService.listTransfers(request, context).toPayload("transfers"))
                .register(AdminActionType.CLAIMS, PageQuery.class,
                        (request, context) -> readService.listClaims(request, context).toPayload("claims"))
                .register(AdminActionType.LISTINGS, PageQuery.class,
                        (request, context) -> readService.listListings(request, context).toPayload("listings"))
                .register(AdminActionType.GET_VEHICLE_FOR_CLAIM, VehicleForClaimRequest.class,
                        (request, context) -> readService.findVehicleForClaim(request).toPayload())
                .register(AdminActionType.SUSPEND_USER, SuspendUserRequest.class,
                        (request, context) -> message(moderationService.suspendUser(request, context)))
                .register(AdminActionType.UNSUSPEND_USER, UnsuspendUserRequest.class,
                        (request, context) -> message(moderationService.unsuspendUser(request, context)))
                .register(AdminActionType.SET_VEHICLE_VERIFICATION, SetVehicleVerificationRequest.class,
                        (request, context) -> message(moderationService.setVehicleVerification(request, context)))
                .register(AdminActionType.UPDATE_CLAIM_STATUS, UpdateClaimStatusRequest.class,
                        (request, context) -> message(moderationService.updateClaimStatus(request, context)))
                .register(AdminActionType.UPDATE_LISTING_STATUS, UpdateListingStatusRequest.class,
                        (request, context) -> message(moderationService.updateListingStatus(request, context)));
    }

    private static Map<String, Object> message(String message) {
        return Map.of("message", message);
    }
}
