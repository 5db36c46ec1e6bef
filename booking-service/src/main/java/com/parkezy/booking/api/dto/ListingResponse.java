package com.parkezy.booking.api.dto;

import com.parkezy.booking.domain.model.ListingSlot;
import com.parkezy.booking.domain.model.PrivateListing;

import java.math.BigDecimal;
import java.util.List;

public record ListingResponse(
        Long id,
        String hostId,
        String title,
        String address,
        BigDecimal hourlyRate,
        boolean autoAcceptBookings,
        boolean hasActiveBooking,
        List<ListingSlotResponse> slots
) {
    public static ListingResponse from(PrivateListing listing, List<ListingSlot> slots) {
        return new ListingResponse(
                listing.getId(),
                listing.getHostId(),
                listing.getTitle(),
                listing.getAddress(),
                listing.getHourlyRate(),
                listing.isAutoAcceptBookings(),
                listing.isHasActiveBooking(),
                slots.stream().map(ListingSlotResponse::from).toList()
        );
    }
}
