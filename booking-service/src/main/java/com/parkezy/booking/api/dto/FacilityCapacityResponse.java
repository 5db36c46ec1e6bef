package com.parkezy.booking.api.dto;

import com.parkezy.booking.domain.model.FacilityCapacity;

public record FacilityCapacityResponse(
        Long facilityId,
        int total,
        int available,
        int occupied
) {
    public static FacilityCapacityResponse from(Long facilityId, FacilityCapacity capacity) {
        return new FacilityCapacityResponse(facilityId, capacity.getTotal(), capacity.getAvailable(),
                capacity.occupied());
    }
}
