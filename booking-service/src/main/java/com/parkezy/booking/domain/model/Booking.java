package com.parkezy.booking.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Authoritative booking record. Never deleted: the lifecycle ends in a terminal status.
 *
 * Exactly one resource reference is set, matching {@link #type}: (listingId, slotId) for
 * private bookings, facilityId for commercial ones.
 */
@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bookings_driver", columnList = "driver_id,requested_at"),
        @Index(name = "idx_bookings_host_status", columnList = "host_id,status"),
        @Index(name = "idx_bookings_facility_status", columnList = "facility_id,status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Convert(converter = BookingTypeConverter.class)
    @Column(name = "booking_type", nullable = false, updatable = false, length = 16)
    private BookingType type;

    @Column(name = "driver_id", nullable = false, updatable = false, length = 128)
    private String driverId;

    @Column(name = "host_id", nullable = false, updatable = false, length = 128)
    private String hostId;

    @Column(name = "listing_id", updatable = false)
    private Long listingId;

    @Column(name = "slot_id", updatable = false)
    private Long slotId;

    @Column(name = "facility_id", updatable = false)
    private Long facilityId;

    @Embedded
    private BookingTiming timing;

    @Embedded
    private BookingPricing pricing;

    @Embedded
    private BookingMessages messages;

    @Column(name = "vehicle_number", length = 32)
    private String vehicleNumber;

    @Column(name = "vehicle_type", length = 32)
    private String vehicleType;

    @Convert(converter = BookingStatusConverter.class)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Setter(AccessLevel.NONE)
    @Column(name = "access_code", nullable = false, updatable = false, length = 6)
    private String accessCode;

    @Column(name = "approval_time")
    private Instant approvalTime;

    @Column(name = "rejection_reason", length = 500)
    private String rejectionReason;

    @Builder.Default
    @Column(name = "schema_version", nullable = false)
    private Integer schemaVersion = CURRENT_SCHEMA_VERSION;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }

    public boolean isPrivate() {
        return type == BookingType.PRIVATE;
    }

    public boolean isCommercial() {
        return type == BookingType.COMMERCIAL;
    }

    /**
     * True when the resource reference matches the booking type and nothing else is set.
     */
    public boolean hasConsistentResourceReference() {
        if (type == null) {
            return false;
        }
        return switch (type) {
            case PRIVATE -> listingId != null && slotId != null && facilityId == null;
            case COMMERCIAL -> facilityId != null && listingId == null && slotId == null;
        };
    }
}
