package com.parkezy.booking.ledger;

import com.parkezy.booking.domain.model.BookingStatus;
import com.parkezy.booking.domain.model.BookingType;

import java.time.Instant;

/**
 * In-process notification that a booking was created or changed status.
 * Listeners act after the surrounding transaction commits.
 *
 * @param previousStatus null when the booking was just created
 */
public record BookingChangedEvent(
        Long bookingId,
        BookingType type,
        String driverId,
        String hostId,
        BookingStatus previousStatus,
        BookingStatus newStatus,
        Instant occurredAt
) {
}
