package com.parkezy.booking.api.dto;

import com.parkezy.booking.domain.model.ListingSlot;

import java.time.Instant;

public record ListingSlotResponse(
        Long id,
        Long listingId,
        String label,
        boolean occupied,
        Long bookingId,
        Instant expectedEndTime
) {
    public static ListingSlotResponse from(ListingSlot slot) {
        return new ListingSlotResponse(
                slot.getId(),
                slot.getListingId(),
                slot.getLabel(),
                slot.isOccupied(),
                slot.getBookingId(),
                slot.getExpectedEndTime()
        );
    }
}
