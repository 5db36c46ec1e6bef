package com.parkezy.booking.api.dto;

import com.parkezy.booking.domain.model.FacilityType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record CreateFacilityRequest(
        @NotBlank(message = "Name cannot be blank")
        String name,

        @NotBlank(message = "Address cannot be blank")
        String address,

        @NotNull
        Double latitude,

        @NotNull
        Double longitude,

        @NotNull(message = "Facility type cannot be null")
        FacilityType facilityType,

        @NotNull
        @DecimalMin(value = "0.00", message = "Hourly rate cannot be negative")
        BigDecimal defaultHourlyRate,

        @NotNull
        @PositiveOrZero(message = "Total capacity cannot be negative")
        Integer totalCapacity
) {
}
