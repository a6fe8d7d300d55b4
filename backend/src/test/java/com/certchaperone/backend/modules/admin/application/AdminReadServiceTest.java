package com.certchaperone.backend.modules.admin.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.certchaperone.backend.modules.admin.application.enrichment.BatchEnricher;
import com.certchaperone.backend.modules.admin.application.enrichment.PrincipalEmailResolver;
import com.certchaperone.backend.modules.admin.presentation.dto.AdminActivityRow;
import com.certchaperone.backend.modules.admin.presentation.dto.AdminClaimRow;
import com.certchaperone.backend.modules.admin.presentation.dto.AdminOverviewResponse;
import com.certchaperone.backend.modules.admin.presentation.dto.AdminPage;
import com.certchaperone.backend.modules.admin.presentation.dto.AdminUserRow;
import com.certchaperone.backend.modules.admin.presentation.dto.PageQuery;
import com.certchaperone.backend.modules.admin.presentation.dto.VehicleForClaimRequest;
import com.certchaperone.backend.modules.admin.presentation.dto.VehicleForClaimResponse;
import com.certchaperone.backend.modules.audit.domain.VehicleHistoryEvent;
import com.certchaperone.backend.modules.audit.infrastructure.persistence.VehicleHistoryRepository;
import com.certchaperone.backend.modules.auth.domain.UserSuspension;
import com.certchaperone.backend.modules.auth.infrastructure.persistence.UserSuspensionRepository;
import com.certchaperone.backend.modules.identity.application.IdentityLookupException;
import com.certchaperone.backend.modules.identity.application.IdentityProfile;
import com.certchaperone.backend.modules.identity.application.IdentityProvider;
import com.certchaperone.backend.modules.marketplace.infrastructure.persistence.VehicleListingRepository;
import com.certchaperone.backend.modules.transfer.domain.OwnershipClaim;
import com.certchaperone.backend.modules.transfer.domain.OwnershipClaimStatus;
import com.certchaperone.backend.modules.transfer.infrastructure.persistence.OwnershipClaimRepository;
import com.certchaperone.backend.modules.transfer.infrastructure.persistence.VehicleTransferRepository;
import com.certchaperone.backend.modules.vehicle.domain.Vehicle;
import com.certchaperone.backend.modules.vehicle.infrastructure.persistence.DocumentRepository;
import com.certchaperone.backend.modules.vehicle.infrastructure.persistence.DocumentRepository.UserDocumentCount;
import com.certchaperone.backend.modules.vehicle.infrastructure.persistence.VehicleRepository;
import com.certchaperone.backend.modules.vehicle.infrastructure.persistence.VehicleRepository.OwnerSummary;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class AdminReadServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-04-15T10:00:00Z");
    private static final UUID ADMIN_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    private static final UUID OWNER_ID = UUID.fromString("00000000-0000-0000-0000-00000000b002");
    private static final UUID CLAIMANT_ID = UUID.fromString("00000000-0000-0000-0000-00000000c003");

    @Mock
    private VehicleRepository vehicleRepository;

    @Mock
    private DocumentRepository documentRepository;

    @Mock
    private UserSuspensionRepository userSuspensionRepository;

    @Mock
    private VehicleHistoryRepository vehicleHistoryRepository;

    @Mock
    private VehicleTransferRepository vehicleTransferRepository;

    @Mock
    private OwnershipClaimRepository ownershipClaimRepository;

    @Mock
    private VehicleListingRepository vehicleListingRepository;

    @Mock
    private IdentityProvider identityProvider;

    private AdminReadService service;
    private AdminRequestContext context;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        AdminQueryRunner queryRunner = new AdminQueryRunner(new SyncTaskExecutor(), clock);
        PrincipalEmailResolver emailResolver =
                new PrincipalEmailResolver(identityProvider, new BatchEnricher(queryRunner, 10));
        service = new AdminReadService(vehicleRepository, documentRepository, userSuspensionRepository,
                vehicleHistoryRepository, vehicleTransferRepository, ownershipClaimRepository,
                vehicleListingRepository, emailResolver, queryRunner, clock, 50, 100);
        context = AdminRequestContext.start(UUID.randomUUID(), ADMIN_ID, "admin@example.com", clock,
                Duration.ofSeconds(10));
    }

    @Test
    void overviewCountsExpiriesWithinCurrentMonth() {
        when(vehicleRepository.countDistinctOwners()).thenReturn(4L);
        when(vehicleRepository.count()).thenReturn(9L);
        when(vehicleRepository.countByVerifiedTrue()).thenReturn(5L);
        when(documentRepository.count()).thenReturn(21L);
        when(userSuspensionRepository.count()).thenReturn(1L);
        when(vehicleRepository.countExpiryDatesBetween(LocalDate.of(2025, 4, 1), LocalDate.of(2025, 4, 30)))
                .thenReturn(3L);

        AdminOverviewResponse overview = service.getOverview(context);

        assertThat(overview.totalUsers()).isEqualTo(4L);
        assertThat(overview.totalVehicles()).isEqualTo(9L);
        assertThat(overview.verifiedVehicles()).isEqualTo(5L);
        assertThat(overview.totalDocuments()).isEqualTo(21L);
        assertThat(overview.expiringThisMonth()).isEqualTo(3L);
        assertThat(overview.suspendedUsers()).isEqualTo(1L);
    }

    @Test
    void usersPageCarriesCountsSuspensionAndPagination() {
        OffsetDateTime joined = NOW.minusDays(30);
        when(vehicleRepository.findOwnerSummaries(any()))
                .thenReturn(new PageImpl<>(List.of(new Owner(OWNER_ID, 2L, joined)), PageRequest.of(1, 1), 3));
        when(documentRepository.countByUserIds(List.of(OWNER_ID)))
                .thenReturn(List.of(new DocumentCount(OWNER_ID, 7L)));
        UserSuspension suspension = new UserSuspension();
        suspension.setUserId(OWNER_ID);
        suspension.setSuspendedAt(NOW.minusDays(1));
        suspension.setReason("fraud");
        when(userSuspensionRepository.findByUserIdIn(List.of(OWNER_ID))).thenReturn(List.of(suspension));
        when(identityProvider.findById(OWNER_ID))
                .thenReturn(Optional.of(new IdentityProfile(OWNER_ID, "owner@example.com", null)));

        AdminPage<AdminUserRow> page = service.listUsers(query(2, 1), context);

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(vehicleRepository).findOwnerSummaries(pageable.capture());
        assertThat(pageable.getValue().getPageNumber()).isEqualTo(1);
        assertThat(pageable.getValue().getPageSize()).isEqualTo(1);

        assertThat(page.rows()).singleElement().satisfies(row -> {
            assertThat(row.email()).isEqualTo("owner@example.com");
            assertThat(row.vehicleCount()).isEqualTo(2L);
            assertThat(row.documentCount()).isEqualTo(7L);
            assertThat(row.joinDate()).isEqualTo(joined);
            assertThat(row.isSuspended()).isTrue();
            assertThat(row.suspensionReason()).isEqualTo("fraud");
        });
        assertThat(page.pagination().page()).isEqualTo(2);
        assertThat(page.pagination().pageSize()).isEqualTo(1);
        assertThat(page.pagination().totalCount()).isEqualTo(3L);
        assertThat(page.pagination().totalPages()).isEqualTo(3L);
    }

    @Test
    void emptyUsersPageSkipsBatchLookups() {
        when(vehicleRepository.findOwnerSummaries(any()))
                .thenReturn(new PageImpl<>(List.of(), PageRequest.of(0, 50), 0));

        AdminPage<AdminUserRow> page = service.listUsers(new PageQuery(null, null), context);

        assertThat(page.rows()).isEmpty();
        assertThat(page.pagination().totalPages()).isZero();
        verify(documentRepository, never()).countByUserIds(any());
        verify(userSuspensionRepository, never()).findByUserIdIn(any());
    }

    @Test
    void activityFallsBackForUnresolvedPrincipalAndDeletedVehicle() {
        VehicleHistoryEvent event = new VehicleHistoryEvent();
        event.setVehicleId(UUID.randomUUID());
        event.setUserId(OWNER_ID);
        event.setEventType("ADMIN_VERIFIED");
        event.setMetadata(Map.of("admin_email", "admin@example.com"));
        event.setCreatedAt(NOW);
        when(vehicleHistoryRepository.findAll(any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(event), PageRequest.of(0, 50), 1));
        when(identityProvider.findById(OWNER_ID)).thenThrow(new IdentityLookupException("identity service down", null));
        when(vehicleRepository.findAllById(any())).thenReturn(List.of());

        AdminPage<AdminActivityRow> page = service.listActivity(new PageQuery(null, null), context);

        assertThat(page.rows()).singleElement().satisfies(row -> {
            assertThat(row.userEmail()).isEqualTo(PrincipalEmailResolver.UNKNOWN_EMAIL);
            assertThat(row.registrationNumber()).isEqualTo(AdminReadService.DELETED_VEHICLE);
        });
    }

    @Test
    void unresolvedClaimantFallsBackToStoredEmail() {
        OwnershipClaim claim = new OwnershipClaim();
        ReflectionTestUtils.setField(claim, "id", UUID.randomUUID());
        claim.setClaimantId(CLAIMANT_ID);
        claim.setClaimantEmail("claimant@stored.example");
        claim.setCurrentOwnerId(OWNER_ID);
        claim.setRegistrationNumber("KA01XY9999");
        claim.setStatus(OwnershipClaimStatus.PENDING);
        when(ownershipClaimRepository.findAll(any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(claim), PageRequest.of(0, 50), 1));
        when(identityProvider.findById(CLAIMANT_ID)).thenReturn(Optional.empty());
        when(identityProvider.findById(OWNER_ID))
                .thenReturn(Optional.of(new IdentityProfile(OWNER_ID, "owner@example.com", null)));

        AdminPage<AdminClaimRow> page = service.listClaims(new PageQuery(null, null), context);

        assertThat(page.rows()).singleElement().satisfies(row -> {
            assertThat(row.claimantEmail()).isEqualTo("claimant@stored.example");
            assertThat(row.ownerEmail()).isEqualTo("owner@example.com");
            assertThat(row.makerModel()).isNull();
            assertThat(row.status()).isEqualTo("pending");
        });
        verify(vehicleRepository, never()).findAllById(any());
    }

    @Test
    void vehicleForClaimNormalizesRegistrationNumber() {
        Vehicle vehicle = new Vehicle();
        UUID vehicleId = UUID.randomUUID();
        ReflectionTestUtils.setField(vehicle, "id", vehicleId);
        vehicle.setUserId(OWNER_ID);
        vehicle.setMakerModel("SWIFT VXI");
        when(vehicleRepository.findFirstByRegistrationNumberOrderByCreatedAtDesc("MH12AB1234"))
                .thenReturn(Optional.of(vehicle));

        VehicleForClaimResponse response = service.findVehicleForClaim(new VehicleForClaimRequest(" mh12ab1234 "));

        assertThat(response.found()).isTrue();
        assertThat(response.vehicleId()).isEqualTo(vehicleId);
        assertThat(response.ownerId()).isEqualTo(OWNER_ID);
        assertThat(response.makerModel()).isEqualTo("SWIFT VXI");
    }

    @Test
    void unknownRegistrationIsReportedAsNotFound() {
        when(vehicleRepository.findFirstByRegistrationNumberOrderByCreatedAtDesc(any())).thenReturn(Optional.empty());

        assertThat(service.findVehicleForClaim(new VehicleForClaimRequest("XX00")).found()).isFalse();
    }

    private static PageQuery query(int page, int pageSize) {
        return new PageQuery(JsonNodeFactory.instance.numberNode(page), JsonNodeFactory.instance.numberNode(pageSize));
    }

    private record Owner(UUID getUserId, Long getVehicleCount, OffsetDateTime getFirstVehicleAt)
            implements OwnerSummary {
    }

    private record DocumentCount(UUID getUserId, Long getDocumentCount) implements UserDocumentCount {
    }
}
