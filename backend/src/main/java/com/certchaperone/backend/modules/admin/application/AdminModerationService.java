package com.certchaperone.backend.modules.admin.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.certchaperone.backend.global.error.ErrorCode;
import com.certchaperone.backend.global.error.ProblemException;
import com.certchaperone.backend.modules.admin.presentation.dto.SetVehicleVerificationRequest;
import com.certchaperone.backend.modules.admin.presentation.dto.SuspendUserRequest;
import com.certchaperone.backend.modules.admin.presentation.dto.UnsuspendUserRequest;
import com.certchaperone.backend.modules.admin.presentation.dto.UpdateClaimStatusRequest;
import com.certchaperone.backend.modules.admin.presentation.dto.UpdateListingStatusRequest;
import com.certchaperone.backend.modules.audit.application.ModerationAuditTrail;
import com.certchaperone.backend.modules.audit.application.ModerationAuditTrail.AdminActionCommand;
import com.certchaperone.backend.modules.audit.application.ModerationAuditTrail.VehicleEventCommand;
import com.certchaperone.backend.modules.auth.infrastructure.persistence.UserSuspensionRepository;
import com.certchaperone.backend.modules.marketplace.domain.ListingStatus;
import com.certchaperone.backend.modules.marketplace.domain.VehicleListing;
import com.certchaperone.backend.modules.marketplace.infrastructure.persistence.VehicleListingRepository;
import com.certchaperone.backend.modules.transfer.domain.OwnershipClaim;
import com.certchaperone.backend.modules.transfer.domain.OwnershipClaimStatus;
import com.certchaperone.backend.modules.transfer.infrastructure.persistence.OwnershipClaimRepository;
import com.certchaperone.backend.modules.vehicle.domain.Vehicle;
import com.certchaperone.backend.modules.vehicle.infrastructure.persistence.VehicleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Admin mutations. Each call checks existence and state, applies one change and appends one
 * audit event inside a single transaction.
 */
@Service
public class AdminModerationService {

    private static final Logger log = LoggerFactory.getLogger(AdminModerationService.class);

    static final String USER_SUSPENDED = "USER_SUSPENDED";
    static final String USER_UNSUSPENDED = "USER_UNSUSPENDED";
    static final String ADMIN_VERIFIED = "ADMIN_VERIFIED";
    static final String ADMIN_UNVERIFIED = "ADMIN_UNVERIFIED";

    private final UserSuspensionRepository userSuspensionRepository;
    private final VehicleRepository vehicleRepository;
    private final OwnershipClaimRepository ownershipClaimRepository;
    private final VehicleListingRepository vehicleListingRepository;
    private final ModerationAuditTrail auditTrail;
    private final Clock clock;

    public AdminModerationService(
            UserSuspensionRepository userSuspensionRepository,
            VehicleRepository vehicleRepository,
            OwnershipClaimRepository ownershipClaimRepository,
            VehicleListingRepository vehicleListingRepository,
            ModerationAuditTrail auditTrail,
            Clock clock
    ) {
        this.userSuspensionRepository = userSuspensionRepository;
        this.vehicleRepository = vehicleRepository;
        this.ownershipClaimRepository = ownershipClaimRepository;
        this.vehicleListingRepository = vehicleListingRepository;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    @Transactional
    public String suspendUser(SuspendUserRequest request, AdminRequestContext context) {
        UUID targetUserId = UUID.fromString(request.userId());
        if (targetUserId.equals(context.actorId())) {
            throw new ProblemException(ErrorCode.SELF_SUSPENSION, "Cannot suspend yourself");
        }
        try {
            int inserted = userSuspensionRepository.insertIfAbsent(
                    UUID.randomUUID(), targetUserId, context.actorId(), request.reason(), OffsetDateTime.now(clock));
            if (inserted == 0) {
                throw alreadySuspended();
            }
            Map<String, Object> detail = new HashMap<>();
            detail.put("reason", request.reason());
            detail.put("admin_email", context.actorEmail());
            auditTrail.recordAdminAction(new AdminActionCommand(
                    USER_SUSPENDED, "USER", targetUserId.toString(),
                    context.actorId(), context.requestId(), detail));
        } catch (DataIntegrityViolationException ex) {
            throw alreadySuspended();
        } catch (DataAccessException ex) {
            log.error("Suspend error for user {}", targetUserId, ex);
            throw new ProblemException(ErrorCode.SUSPEND_FAILED, "Failed to suspend user", null, ex);
        }
        log.info("User {} suspended by {}", targetUserId, context.actorId());
        return "User suspended";
    }

    /**
     * Lifts a suspension. Unsuspending a user who is not suspended succeeds without an audit event.
     */
    @Transactional
    public String unsuspendUser(UnsuspendUserRequest request, AdminRequestContext context) {
        UUID targetUserId = UUID.fromString(request.userId());
        try {
            int deleted = userSuspensionRepository.deleteByUserId(targetUserId);
            if (deleted > 0) {
                Map<String, Object> detail = new HashMap<>();
                detail.put("admin_email", context.actorEmail());
                auditTrail.recordAdminAction(new AdminActionCommand(
                        USER_UNSUSPENDED, "USER", targetUserId.toString(),
                        context.actorId(), context.requestId(), detail));
                log.info("User {} unsuspended by {}", targetUserId, context.actorId());
            }
        } catch (DataAccessException ex) {
            log.error("Unsuspend error for user {}", targetUserId, ex);
            throw new ProblemException(ErrorCode.UNSUSPEND_FAILED, "Failed to unsuspend user", null, ex);
        }
        return "User unsuspended";
    }

    @Transactional
    public String setVehicleVerification(SetVehicleVerificationRequest request, AdminRequestContext context) {
        UUID vehicleId = UUID.fromString(request.vehicleId());
        boolean verified = request.isVerified();
        String outcome = verified ? "verified" : "unverified";
        try {
            Vehicle vehicle = vehicleRepository.findById(vehicleId)
                    .orElseThrow(() -> new ProblemException(ErrorCode.NOT_FOUND, "Vehicle not found"));
            vehicle.applyVerification(verified, OffsetDateTime.now(clock));
            vehicleRepository.saveAndFlush(vehicle);

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("admin_email", context.actorEmail());
            metadata.put("admin_id", context.actorId().toString());
            auditTrail.recordVehicleEvent(new VehicleEventCommand(
                    vehicleId,
                    vehicle.getUserId(),
                    verified ? ADMIN_VERIFIED : ADMIN_UNVERIFIED,
                    "Vehicle " + outcome + " by admin",
                    metadata));
        } catch (DataAccessException ex) {
            log.error("Verification update error for vehicle {}", vehicleId, ex);
            throw new ProblemException(ErrorCode.UPDATE_FAILED, "Failed to update verification status", null, ex);
        }
        return "Vehicle " + outcome;
    }

    /**
     * Settles a pending ownership claim. The event goes to the claimed vehicle's history, or to the
     * admin audit log when the claim is not linked to a vehicle.
     */
    @Transactional
    public String updateClaimStatus(UpdateClaimStatusRequest request, AdminRequestContext context) {
        UUID claimId = UUID.fromString(request.claimId());
        OwnershipClaimStatus target = OwnershipClaimStatus.fromCode(request.status());
        try {
            OwnershipClaim claim = ownershipClaimRepository.findById(claimId)
                    .orElseThrow(() -> new ProblemException(ErrorCode.NOT_FOUND, "Claim not found"));
            OwnershipClaimStatus previous = claim.getStatus();
            if (previous.isTerminal()) {
                throw new ProblemException(ErrorCode.INVALID_TRANSITION,
                        "Claim is already " + previous.getCode(),
                        Map.of("currentStatus", previous.getCode()));
            }
            claim.setStatus(target);
            ownershipClaimRepository.saveAndFlush(claim);

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("admin_email", context.actorEmail());
            metadata.put("claim_id", claimId.toString());
            metadata.put("claimant_id", claim.getClaimantId().toString());
            metadata.put("previous_status", previous.getCode());
            String eventType = "claim_" + target.getCode();
            if (claim.getVehicleId() != null) {
                auditTrail.recordVehicleEvent(new VehicleEventCommand(
                        claim.getVehicleId(),
                        claim.getCurrentOwnerId(),
                        eventType,
                        "Ownership claim " + target.getCode() + " by admin",
                        metadata));
            } else {
                auditTrail.recordAdminAction(new AdminActionCommand(
                        eventType.toUpperCase(Locale.ROOT), "OWNERSHIP_CLAIM", claimId.toString(),
                        context.actorId(), context.requestId(), metadata));
            }
        } catch (DataAccessException ex) {
            log.error("Claim update error for claim {}", claimId, ex);
            throw new ProblemException(ErrorCode.UPDATE_FAILED, "Failed to update claim status", null, ex);
        }
        return "Claim marked as " + target.getCode();
    }

    @Transactional
    public String updateListingStatus(UpdateListingStatusRequest request, AdminRequestContext context) {
        UUID listingId = UUID.fromString(request.listingId());
        ListingStatus decision = ListingStatus.fromCode(request.status());
        try {
            VehicleListing listing = vehicleListingRepository.findById(listingId)
                    .orElseThrow(() -> new ProblemException(ErrorCode.NOT_FOUND, "Listing not found"));
            if (!listing.getStatus().canBeReviewedAs(decision)) {
                throw new ProblemException(ErrorCode.INVALID_TRANSITION,
                        "Listing is already " + listing.getStatus().getCode(),
                        Map.of("currentStatus", listing.getStatus().getCode()));
            }
            listing.review(decision, request.adminNotes(), context.actorId(), OffsetDateTime.now(clock));
            vehicleListingRepository.saveAndFlush(listing);

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("admin_email", context.actorEmail());
            metadata.put("admin_notes", request.adminNotes());
            metadata.put("expected_price", listing.getExpectedPrice());
            auditTrail.recordVehicleEvent(new VehicleEventCommand(
                    listing.getVehicleId(),
                    listing.getUserId(),
                    "listing_" + decision.getCode(),
                    "Listing " + decision.getCode() + " by admin",
                    metadata));
        } catch (DataAccessException ex) {
            log.error("Listing update error for listing {}", listingId, ex);
            throw new ProblemException(ErrorCode.UPDATE_FAILED, "Failed to update listing status", null, ex);
        }
        return "Listing marked as " + decision.getCode();
    }

    private static ProblemException alreadySuspended() {
        return new ProblemException(ErrorCode.ALREADY_SUSPENDED, "User is already suspended");
    }
}
