package com.parkezy.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Published on every committed booking creation or status change.
 * previousStatus is null for a newly created booking.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingStatusChangedEvent {
    private Long bookingId;
    private String bookingType;
    private String driverId;
    private String hostId;
    private String previousStatus;
    private String newStatus;
    private Instant timestamp;
}
