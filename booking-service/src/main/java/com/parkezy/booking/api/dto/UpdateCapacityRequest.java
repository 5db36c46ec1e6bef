package com.parkezy.booking.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record UpdateCapacityRequest(
        @NotNull
        @PositiveOrZero(message = "Total capacity cannot be negative")
        Integer totalCapacity
) {
}
