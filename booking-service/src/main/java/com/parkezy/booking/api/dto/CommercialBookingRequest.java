package com.parkezy.booking.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

public record CommercialBookingRequest(
        @NotNull(message = "Facility ID cannot be null")
        Long facilityId,

        @NotNull(message = "Scheduled start cannot be null")
        Instant scheduledStart,

        @NotNull(message = "Scheduled end cannot be null")
        Instant scheduledEnd,

        @Size(max = 32)
        String vehicleNumber,

        @Size(max = 32)
        String vehicleType,

        @Size(max = 200, message = "Idempotency key must be at most 200 characters")
        String idempotencyKey
) {
}
