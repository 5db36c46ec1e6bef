package com.parkezy.booking.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.List;

public record CreateListingRequest(
        @NotBlank(message = "Title cannot be blank")
        String title,

        @NotBlank(message = "Address cannot be blank")
        String address,

        @NotNull
        @DecimalMin(value = "0.00", message = "Hourly rate cannot be negative")
        BigDecimal hourlyRate,

        boolean autoAcceptBookings,

        @NotEmpty(message = "A listing needs at least one slot")
        List<@NotBlank String> slotLabels
) {
}
