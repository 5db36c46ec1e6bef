package com.parkezy.booking.api.dto;

import com.parkezy.booking.domain.model.Facility;
import com.parkezy.booking.domain.model.FacilityType;

import java.math.BigDecimal;

public record FacilityResponse(
        Long id,
        String ownerId,
        String name,
        String address,
        FacilityType facilityType,
        BigDecimal defaultHourlyRate,
        int totalCapacity,
        int availableCapacity,
        boolean active
) {
    public static FacilityResponse from(Facility facility) {
        return new FacilityResponse(
                facility.getId(),
                facility.getOwnerId(),
                facility.getName(),
                facility.getAddress(),
                facility.getFacilityType(),
                facility.getDefaultHourlyRate(),
                facility.getCapacity().getTotal(),
                facility.getCapacity().getAvailable(),
                facility.isActive()
        );
    }
}
