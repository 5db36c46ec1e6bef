package com.parkezy.booking.api.dto;

import com.parkezy.booking.domain.model.Booking;
import com.parkezy.booking.domain.model.BookingMessages;
import com.parkezy.booking.domain.model.BookingStatus;
import com.parkezy.booking.domain.model.BookingType;

import java.math.BigDecimal;
import java.time.Instant;

public record BookingResponse(
        Long id,
        BookingType type,
        String driverId,
        String hostId,
        Long listingId,
        Long slotId,
        Long facilityId,
        Instant requestedAt,
        Instant scheduledStart,
        Instant scheduledEnd,
        Instant actualStart,
        Instant actualEnd,
        BigDecimal agreedRate,
        BigDecimal estimatedDuration,
        BigDecimal estimatedCost,
        BigDecimal actualCost,
        BigDecimal taxAmount,
        BookingStatus status,
        String accessCode,
        String vehicleNumber,
        String vehicleType,
        Instant approvalTime,
        String rejectionReason,
        String driverMessage,
        String hostMessage
) {
    public static BookingResponse from(Booking booking) {
        BookingMessages messages = booking.getMessages();
        return new BookingResponse(
                booking.getId(),
                booking.getType(),
                booking.getDriverId(),
                booking.getHostId(),
                booking.getListingId(),
                booking.getSlotId(),
                booking.getFacilityId(),
                booking.getTiming().getRequestedAt(),
                booking.getTiming().getScheduledStart(),
                booking.getTiming().getScheduledEnd(),
                booking.getTiming().getActualStart(),
                booking.getTiming().getActualEnd(),
                booking.getPricing().getAgreedRate(),
                booking.getPricing().getEstimatedDuration(),
                booking.getPricing().getEstimatedCost(),
                booking.getPricing().getActualCost(),
                booking.getPricing().getTaxAmount(),
                booking.getStatus(),
                booking.getAccessCode(),
                booking.getVehicleNumber(),
                booking.getVehicleType(),
                booking.getApprovalTime(),
                booking.getRejectionReason(),
                messages == null ? null : messages.getDriverMessage(),
                messages == null ? null : messages.getHostMessage()
        );
    }
}
