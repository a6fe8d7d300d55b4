package com.certchaperone.backend.modules.admin.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.certchaperone.backend.modules.admin.application.enrichment.PrincipalEmailResolver;
import com.certchaperone.backend.modules.admin.presentation.dto.AdminActivityRow;
import com.certchaperone.backend.modules.admin.presentation.dto.AdminClaimRow;
import com.certchaperone.backend.modules.admin.presentation.dto.AdminListingRow;
import com.certchaperone.backend.modules.admin.presentation.dto.AdminOverviewResponse;
import com.certchaperone.backend.modules.admin.presentation.dto.AdminPage;
import com.certchaperone.backend.modules.admin.presentation.dto.AdminTransferRow;
import com.certchaperone.backend.modules.admin.presentation.dto.AdminUserRow;
import com.certchaperone.backend.modules.admin.presentation.dto.AdminVehicleRow;
import com.certchaperone.backend.modules.admin.presentation.dto.PageQuery;
import com.certchaperone.backend.modules.admin.presentation.dto.VehicleForClaimRequest;
import com.certchaperone.backend.modules.admin.presentation.dto.VehicleForClaimResponse;
import com.certchaperone.backend.modules.audit.domain.VehicleHistoryEvent;
import com.certchaperone.backend.modules.audit.infrastructure.persistence.VehicleHistoryRepository;
import com.certchaperone.backend.modules.auth.domain.UserSuspension;
import com.certchaperone.backend.modules.auth.infrastructure.persistence.UserSuspensionRepository;
import com.certchaperone.backend.modules.marketplace.domain.VehicleListing;
import com.certchaperone.backend.modules.marketplace.infrastructure.persistence.VehicleListingRepository;
import com.certchaperone.backend.modules.transfer.domain.OwnershipClaim;
import com.certchaperone.backend.modules.transfer.domain.VehicleTransfer;
import com.certchaperone.backend.modules.transfer.infrastructure.persistence.OwnershipClaimRepository;
import com.certchaperone.backend.modules.transfer.infrastructure.persistence.VehicleTransferRepository;
import com.certchaperone.backend.modules.vehicle.domain.Vehicle;
import com.certchaperone.backend.modules.vehicle.infrastructure.persistence.DocumentRepository;
import com.certchaperone.backend.modules.vehicle.infrastructure.persistence.DocumentRepository.UserDocumentCount;
import com.certchaperone.backend.modules.vehicle.infrastructure.persistence.VehicleRepository;
import com.certchaperone.backend.modules.vehicle.infrastructure.persistence.VehicleRepository.OwnerSummary;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Paged, enriched views over the admin collections plus the dashboard overview.
 *
 * <p>Every collection is ordered newest first by creation time. Ties are not broken, so a row
 * inserted between two page requests can shift page boundaries.
 */
@Service
public class AdminReadService {

    static final String DELETED_VEHICLE = "Deleted";

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final VehicleRepository vehicleRepository;
    private final DocumentRepository documentRepository;
    private final UserSuspensionRepository userSuspensionRepository;
    private final VehicleHistoryRepository vehicleHistoryRepository;
    private final VehicleTransferRepository vehicleTransferRepository;
    private final OwnershipClaimRepository ownershipClaimRepository;
    private final VehicleListingRepository vehicleListingRepository;
    private final PrincipalEmailResolver emailResolver;
    private final AdminQueryRunner queryRunner;
    private final Clock clock;
    private final int defaultPageSize;
    private final int maxPageSize;

    public AdminReadService(
            VehicleRepository vehicleRepository,
            DocumentRepository documentRepository,
            UserSuspensionRepository userSuspensionRepository,
            VehicleHistoryRepository vehicleHistoryRepository,
            VehicleTransferRepository vehicleTransferRepository,
            OwnershipClaimRepository ownershipClaimRepository,
            VehicleListingRepository vehicleListingRepository,
            PrincipalEmailResolver emailResolver,
            AdminQueryRunner queryRunner,
            Clock clock,
            @Value("${app.admin.pagination.default-size:50}") int defaultPageSize,
            @Value("${app.admin.pagination.max-size:100}") int maxPageSize
    ) {
        this.vehicleRepository = vehicleRepository;
        this.documentRepository = documentRepository;
        this.userSuspensionRepository = userSuspensionRepository;
        this.vehicleHistoryRepository = vehicleHistoryRepository;
        this.vehicleTransferRepository = vehicleTransferRepository;
        this.ownershipClaimRepository = ownershipClaimRepository;
        this.vehicleListingRepository = vehicleListingRepository;
        this.emailResolver = emailResolver;
        this.queryRunner = queryRunner;
        this.clock = clock;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    public AdminOverviewResponse getOverview(AdminRequestContext context) {
        LocalDate today = LocalDate.now(clock);
        LocalDate monthStart = today.withDayOfMonth(1);
        LocalDate monthEnd = today.with(TemporalAdjusters.lastDayOfMonth());

        Future<Long> owners = queryRunner.submit(vehicleRepository::countDistinctOwners);
        Future<Long> vehicles = queryRunner.submit(vehicleRepository::count);
        Future<Long> verified = queryRunner.submit(vehicleRepository::countByVerifiedTrue);
        Future<Long> documents = queryRunner.submit(documentRepository::count);
        Future<Long> suspended = queryRunner.submit(userSuspensionRepository::count);
        Future<Long> expiring = queryRunner.submit(
                () -> vehicleRepository.countExpiryDatesBetween(monthStart, monthEnd));

        queryRunner.awaitAll(List.of(owners, vehicles, verified, documents, suspended, expiring), context);

        return new AdminOverviewResponse(
                queryRunner.join(owners),
                queryRunner.join(vehicles),
                queryRunner.join(verified),
                queryRunner.join(documents),
                queryRunner.join(expiring),
                queryRunner.join(suspended)
        );
    }

    /**
     * Vehicle owners, newest first by the date of their first vehicle.
     */
    public AdminPage<AdminUserRow> listUsers(PageQuery query, AdminRequestContext context) {
        PageWindow window = window(query);
        Page<OwnerSummary> owners = vehicleRepository.findOwnerSummaries(window.toPageRequest());
        List<UUID> ownerIds = owners.getContent().stream().map(OwnerSummary::getUserId).toList();

        Map<UUID, Long> documentCounts = ownerIds.isEmpty() ? Map.of()
                : documentRepository.countByUserIds(ownerIds).stream()
                        .collect(Collectors.toMap(UserDocumentCount::getUserId, UserDocumentCount::getDocumentCount));
        Map<UUID, UserSuspension> suspensions = ownerIds.isEmpty() ? Map.of()
                : userSuspensionRepository.findByUserIdIn(ownerIds).stream()
                        .collect(Collectors.toMap(UserSuspension::getUserId, Function.identity()));
        Map<UUID, String> emails = emailResolver.resolveEmails(ownerIds, context);

        List<AdminUserRow> rows = owners.getContent().stream()
                .map(owner -> {
                    UserSuspension suspension = suspensions.get(owner.getUserId());
                    return new AdminUserRow(
                            owner.getUserId(),
                            emails.getOrDefault(owner.getUserId(), PrincipalEmailResolver.UNKNOWN_EMAIL),
                            owner.getVehicleCount(),
                            documentCounts.getOrDefault(owner.getUserId(), 0L),
                            owner.getFirstVehicleAt(),
                            suspension != null,
                            suspension != null ? suspension.getSuspendedAt() : null,
                            suspension != null ? suspension.getReason() : null
                    );
                })
                .toList();
        return new AdminPage<>(rows, window.paginationFor(owners.getTotalElements()));
    }

    public AdminPage<AdminVehicleRow> listVehicles(PageQuery query, AdminRequestContext context) {
        PageWindow window = window(query);
        Page<Vehicle> page = vehicleRepository.findAll(window.toPageRequest(NEWEST_FIRST));
        Map<UUID, String> emails = emailResolver.resolveEmails(
                page.getContent().stream().map(Vehicle::getUserId).toList(), context);

        List<AdminVehicleRow> rows = page.getContent().stream()
                .map(vehicle -> AdminVehicleRow.from(vehicle,
                        emails.getOrDefault(vehicle.getUserId(), PrincipalEmailResolver.UNKNOWN_EMAIL)))
                .toList();
        return new AdminPage<>(rows, window.paginationFor(page.getTotalElements()));
    }

    public AdminPage<AdminActivityRow> listActivity(PageQuery query, AdminRequestContext context) {
        PageWindow window = window(query);
        Page<VehicleHistoryEvent> page = vehicleHistoryRepository.findAll(window.toPageRequest(NEWEST_FIRST));
        List<VehicleHistoryEvent> events = page.getContent();
        Map<UUID, String> emails = emailResolver.resolveEmails(
                events.stream().map(VehicleHistoryEvent::getUserId).toList(), context);
        Map<UUID, Vehicle> vehicles = vehiclesById(events.stream().map(VehicleHistoryEvent::getVehicleId).toList());

        List<AdminActivityRow> rows = events.stream()
                .map(event -> {
                    Vehicle vehicle = vehicles.get(event.getVehicleId());
                    return AdminActivityRow.from(event,
                            emails.getOrDefault(event.getUserId(), PrincipalEmailResolver.UNKNOWN_EMAIL),
                            vehicle != null ? vehicle.getRegistrationNumber() : DELETED_VEHICLE);
                })
                .toList();
        return new AdminPage<>(rows, window.paginationFor(page.getTotalElements()));
    }

    public AdminPage<AdminTransferRow> listTransfers(PageQuery query, AdminRequestContext context) {
        PageWindow window = window(query);
        Page<VehicleTransfer> page = vehicleTransferRepository.findAll(window.toPageRequest(NEWEST_FIRST));
        List<VehicleTransfer> transfers = page.getContent();
        Map<UUID, String> emails = emailResolver.resolveEmails(
                transfers.stream().map(VehicleTransfer::getSenderId).toList(), context);
        Map<UUID, Vehicle> vehicles = vehiclesById(transfers.stream().map(VehicleTransfer::getVehicleId).toList());

        List<AdminTransferRow> rows = transfers.stream()
                .map(transfer -> {
                    Vehicle vehicle = vehicles.get(transfer.getVehicleId());
                    return AdminTransferRow.from(transfer,
                            emails.getOrDefault(transfer.getSenderId(), PrincipalEmailResolver.UNKNOWN_EMAIL),
                            vehicle != null ? vehicle.getRegistrationNumber() : DELETED_VEHICLE,
                            vehicle != null ? vehicle.getMakerModel() : null);
                })
                .toList();
        return new AdminPage<>(rows, window.paginationFor(page.getTotalElements()));
    }

    /**
     * Claims with both parties' e-mails. An unresolved claimant falls back to the e-mail stored on the claim.
     */
    public AdminPage<AdminClaimRow> listClaims(PageQuery query, AdminRequestContext context) {
        PageWindow window = window(query);
        Page<OwnershipClaim> page = ownershipClaimRepository.findAll(window.toPageRequest(NEWEST_FIRST));
        List<OwnershipClaim> claims = page.getContent();

        Set<UUID> principals = new HashSet<>();
        claims.forEach(claim -> {
            principals.add(claim.getClaimantId());
            principals.add(claim.getCurrentOwnerId());
        });
        Map<UUID, String> emails = emailResolver.resolveEmails(principals, context);
        Map<UUID, Vehicle> vehicles = vehiclesById(claims.stream().map(OwnershipClaim::getVehicleId).toList());

        List<AdminClaimRow> rows = claims.stream()
                .map(claim -> {
                    Vehicle vehicle = claim.getVehicleId() != null ? vehicles.get(claim.getVehicleId()) : null;
                    String claimantEmail = emails.containsKey(claim.getClaimantId())
                            ? emails.get(claim.getClaimantId())
                            : claim.getClaimantEmail();
                    return AdminClaimRow.from(claim,
                            claimantEmail,
                            emails.getOrDefault(claim.getCurrentOwnerId(), PrincipalEmailResolver.UNKNOWN_EMAIL),
                            vehicle != null ? vehicle.getMakerModel() : null);
                })
                .toList();
        return new AdminPage<>(rows, window.paginationFor(page.getTotalElements()));
    }

    public AdminPage<AdminListingRow> listListings(PageQuery query, AdminRequestContext context) {
        PageWindow window = window(query);
        Page<VehicleListing> page = vehicleListingRepository.findAll(window.toPageRequest(NEWEST_FIRST));
        List<VehicleListing> listings = page.getContent();
        Map<UUID, String> emails = emailResolver.resolveEmails(
                listings.stream().map(VehicleListing::getUserId).toList(), context);
        Map<UUID, Vehicle> vehicles = vehiclesById(listings.stream().map(VehicleListing::getVehicleId).toList());

        List<AdminListingRow> rows = listings.stream()
                .map(listing -> {
                    Vehicle vehicle = vehicles.get(listing.getVehicleId());
                    return AdminListingRow.from(listing,
                            emails.getOrDefault(listing.getUserId(), PrincipalEmailResolver.UNKNOWN_EMAIL),
                            vehicle != null ? vehicle.getRegistrationNumber() : DELETED_VEHICLE,
                            vehicle != null ? vehicle.getMakerModel() : null,
                            vehicle != null ? vehicle.getManufacturer() : null);
                })
                .toList();
        return new AdminPage<>(rows, window.paginationFor(page.getTotalElements()));
    }

    @Transactional(readOnly = true)
    public VehicleForClaimResponse findVehicleForClaim(VehicleForClaimRequest request) {
        return vehicleRepository.findFirstByRegistrationNumberOrderByCreatedAtDesc(request.normalizedRegistrationNumber())
                .map(vehicle -> new VehicleForClaimResponse(true, vehicle.getId(), vehicle.getUserId(),
                        vehicle.getMakerModel()))
                .orElseGet(VehicleForClaimResponse::notFound);
    }

    private PageWindow window(PageQuery query) {
        return PageWindow.resolve(query.page(), query.pageSize(), defaultPageSize, maxPageSize);
    }

    private Map<UUID, Vehicle> vehiclesById(Collection<UUID> vehicleIds) {
        Set<UUID> ids = vehicleIds.stream().filter(Objects::nonNull).collect(Collectors.toSet());
        if (ids.isEmpty()) {
            return Map.of();
        }
        return vehicleRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Vehicle::getId, Function.identity()));
    }
}
