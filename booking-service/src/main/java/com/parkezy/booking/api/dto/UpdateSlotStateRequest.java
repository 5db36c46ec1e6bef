package com.parkezy.booking.api.dto;

import java.time.Instant;

/**
 * A null bookingId frees the slot; occupied requires a bookingId.
 */
public record UpdateSlotStateRequest(
        boolean occupied,
        Long bookingId,
        Instant endTime
) {
}
