package com.parkezy.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A private host's driveway offering. Slots are tracked individually in {@link ListingSlot}.
 */
@Entity
@Table(name = "private_listings", indexes = {
        @Index(name = "idx_listings_host", columnList = "host_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrivateListing {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "host_id", nullable = false, length = 128)
    private String hostId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "address", nullable = false, length = 500)
    private String address;

    @Column(name = "hourly_rate", nullable = false, precision = 10, scale = 2)
    private BigDecimal hourlyRate;

    @Column(name = "auto_accept_bookings", nullable = false)
    private boolean autoAcceptBookings;

    /** Denormalized "any slot claimed" hint, recomputed whenever slot state changes. */
    @Builder.Default
    @Column(name = "has_active_booking", nullable = false)
    private boolean hasActiveBooking = false;

    @Builder.Default
    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
