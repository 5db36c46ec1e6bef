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
 * User profile keyed by the identity provider's user id. One user may drive and host.
 * Stats are mutated only through atomic increments.
 */
@Entity
@Table(name = "user_profiles")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile {

    @Id
    @Column(name = "id", length = 128)
    private String id;

    @Column(name = "email", nullable = false, length = 200)
    private String email;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "phone_number", length = 32)
    private String phoneNumber;

    @Builder.Default
    @Column(name = "can_drive", nullable = false)
    private boolean canDrive = true;

    @Builder.Default
    @Column(name = "can_host_private", nullable = false)
    private boolean canHostPrivate = false;

    @Builder.Default
    @Column(name = "can_host_commercial", nullable = false)
    private boolean canHostCommercial = false;

    @Builder.Default
    @Column(name = "total_bookings_as_driver", nullable = false)
    private Integer totalBookingsAsDriver = 0;

    @Column(name = "host_rating")
    private Double hostRating;

    @Builder.Default
    @Column(name = "total_earnings", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalEarnings = BigDecimal.ZERO;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean has(UserCapability capability) {
        return switch (capability) {
            case CAN_DRIVE -> canDrive;
            case CAN_HOST_PRIVATE -> canHostPrivate;
            case CAN_HOST_COMMERCIAL -> canHostCommercial;
        };
    }

    public void enable(UserCapability capability) {
        switch (capability) {
            case CAN_DRIVE -> canDrive = true;
            case CAN_HOST_PRIVATE -> canHostPrivate = true;
            case CAN_HOST_COMMERCIAL -> canHostCommercial = true;
        }
    }
}
