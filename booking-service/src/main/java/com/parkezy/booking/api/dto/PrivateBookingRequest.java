package com.parkezy.booking.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

public record PrivateBookingRequest(
        @NotNull(message = "Listing ID cannot be null")
        Long listingId,

        @NotNull(message = "Slot ID cannot be null")
        Long slotId,

        @NotNull(message = "Scheduled start cannot be null")
        Instant scheduledStart,

        @NotNull(message = "Scheduled end cannot be null")
        Instant scheduledEnd,

        @Size(max = 1000, message = "Message must be at most 1000 characters")
        String driverMessage,

        @Size(max = 200, message = "Idempotency key must be at most 200 characters")
        String idempotencyKey
) {
}
