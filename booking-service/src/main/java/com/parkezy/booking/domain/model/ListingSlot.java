package com.parkezy.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * One physical space within a private listing.
 * bookingId is non-null iff the slot is reserved or occupied for that booking.
 */
@Entity
@Table(name = "listing_slots", indexes = {
        @Index(name = "idx_slots_listing", columnList = "listing_id"),
        @Index(name = "idx_slots_booking", columnList = "booking_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListingSlot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "listing_id", nullable = false, updatable = false)
    private Long listingId;

    @Column(name = "label", nullable = false, length = 50)
    private String label;

    @Builder.Default
    @Column(name = "occupied", nullable = false)
    private boolean occupied = false;

    @Column(name = "booking_id")
    private Long bookingId;

    @Column(name = "expected_end_time")
    private Instant expectedEndTime;

    public boolean isClaimed() {
        return bookingId != null;
    }
}
