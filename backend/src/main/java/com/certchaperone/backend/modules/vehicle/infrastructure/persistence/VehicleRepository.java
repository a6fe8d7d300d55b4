package com.certchaperone.backend.modules.vehicle.infrastructure.persistence;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.certchaperone.backend.modules.vehicle.domain.Vehicle;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VehicleRepository extends JpaRepository<Vehicle, UUID> {

    long countByVerifiedTrue();

    @Query("select count(distinct v.userId) from Vehicle v")
    long countDistinctOwners();

    /**
     * Counts insurance, PUCC, fitness and road-tax dates falling inside {@code [from, to]}.
     * A vehicle with two dates in range counts twice.
     */
    @Query(value = """
            SELECT
                COUNT(*) FILTER (WHERE insurance_expiry BETWEEN :fromDate AND :toDate)
              + COUNT(*) FILTER (WHERE pucc_valid_upto BETWEEN :fromDate AND :toDate)
              + COUNT(*) FILTER (WHERE fitness_valid_upto BETWEEN :fromDate AND :toDate)
              + COUNT(*) FILTER (WHERE road_tax_valid_upto BETWEEN :fromDate AND :toDate)
            FROM vehicles
            """, nativeQuery = true)
    long countExpiryDatesBetween(@Param("fromDate") LocalDate fromDate, @Param("toDate") LocalDate toDate);

    @Query(value = """
            select v.userId as userId, count(v) as vehicleCount, min(v.createdAt) as firstVehicleAt
            from Vehicle v
            group by v.userId
            order by min(v.createdAt) desc
            """,
            countQuery = "select count(distinct v.userId) from Vehicle v")
    Page<OwnerSummary> findOwnerSummaries(Pageable pageable);

    Optional<Vehicle> findFirstByRegistrationNumberOrderByCreatedAtDesc(String registrationNumber);

    interface OwnerSummary {
        UUID getUserId();

        Long getVehicleCount();

        OffsetDateTime getFirstVehicleAt();
    }
}
