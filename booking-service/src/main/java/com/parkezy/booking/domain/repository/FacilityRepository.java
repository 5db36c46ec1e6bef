package com.parkezy.booking.domain.repository;

import com.parkezy.booking.domain.model.Facility;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Facility, including the capacity counters.
 * Provides both a guarded atomic update and a pessimistic row lock (see {@link FacilityLockingRepository}).
 */
public interface FacilityRepository extends JpaRepository<Facility, Long>, FacilityLockingRepository {

    /**
     * Takes one unit of capacity in a single guarded UPDATE.
     *
     * The guard (available > 0) is evaluated under the row lock the UPDATE itself takes,
     * so concurrent callers racing for the last unit cannot both succeed.
     *
     * @return 1 if a unit was taken, 0 if the facility is full or missing
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Facility f
            SET f.capacity.available = f.capacity.available - 1
            WHERE f.id = :facilityId
              AND f.capacity.available > 0
            """)
    int decrementAvailableIfPositive(@Param("facilityId") Long facilityId);

    /**
     * Returns one unit of capacity, never exceeding the total.
     *
     * @return 1 if a unit was returned, 0 if already at total or missing
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Facility f
            SET f.capacity.available = f.capacity.available + 1
            WHERE f.id = :facilityId
              AND f.capacity.available < f.capacity.total
            """)
    int incrementAvailableBelowTotal(@Param("facilityId") Long facilityId);

    /** Scalar read that leaves the entity out of the persistence context. */
    @Query("SELECT f.ownerId FROM Facility f WHERE f.id = :facilityId")
    Optional<String> findOwnerIdById(@Param("facilityId") Long facilityId);

    List<Facility> findByDeletedFalse();
}
