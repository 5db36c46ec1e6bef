package com.parkezy.booking.domain.repository;

import com.parkezy.booking.domain.model.PrivateListing;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface PrivateListingRepository extends JpaRepository<PrivateListing, Long> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PrivateListing l SET l.hasActiveBooking = :hasActive WHERE l.id = :listingId")
    int updateActiveBookingFlag(@Param("listingId") Long listingId, @Param("hasActive") boolean hasActive);

    List<PrivateListing> findByHostIdAndActiveTrue(String hostId);
}
