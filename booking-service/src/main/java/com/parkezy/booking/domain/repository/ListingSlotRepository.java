package com.parkezy.booking.domain.repository;

import com.parkezy.booking.domain.model.ListingSlot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ListingSlotRepository extends JpaRepository<ListingSlot, Long> {

    /**
     * Writes the slot state only if the slot is free or already held by the same booking.
     * Zero rows means another booking holds it (or the slot does not exist).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ListingSlot s
            SET s.bookingId = :bookingId, s.occupied = :occupied, s.expectedEndTime = :endTime
            WHERE s.id = :slotId
              AND s.listingId = :listingId
              AND (s.bookingId IS NULL OR s.bookingId = :bookingId)
            """)
    int claim(@Param("listingId") Long listingId,
              @Param("slotId") Long slotId,
              @Param("bookingId") Long bookingId,
              @Param("occupied") boolean occupied,
              @Param("endTime") Instant endTime);

    /**
     * Frees the slot only if it is currently held by the given booking.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ListingSlot s
            SET s.bookingId = NULL, s.occupied = false, s.expectedEndTime = NULL
            WHERE s.id = :slotId
              AND s.listingId = :listingId
              AND s.bookingId = :bookingId
            """)
    int releaseIfHeldBy(@Param("listingId") Long listingId,
                        @Param("slotId") Long slotId,
                        @Param("bookingId") Long bookingId);

    /** Unconditional clear, used by the host's manual slot override. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ListingSlot s
            SET s.bookingId = NULL, s.occupied = false, s.expectedEndTime = NULL
            WHERE s.id = :slotId
            """)
    int clear(@Param("slotId") Long slotId);

    boolean existsByListingIdAndBookingIdIsNotNull(Long listingId);

    Optional<ListingSlot> findByIdAndListingId(Long id, Long listingId);

    List<ListingSlot> findByListingIdOrderByIdAsc(Long listingId);

    List<ListingSlot> findByBookingIdIsNotNull();
}
