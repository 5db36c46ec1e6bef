package com.parkezy.booking.ledger;

import com.parkezy.booking.domain.model.BookingStatus;
import com.parkezy.booking.domain.model.BookingType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Everything needed to persist a new booking except the id and the requested-at stamp,
 * which the ledger assigns.
 */
@Builder
public record BookingDraft(
        BookingType type,
        String driverId,
        String hostId,
        Long listingId,
        Long slotId,
        Long facilityId,
        Instant scheduledStart,
        Instant scheduledEnd,
        BigDecimal agreedRate,
        BigDecimal estimatedDuration,
        BigDecimal estimatedCost,
        BigDecimal taxAmount,
        String driverMessage,
        String vehicleNumber,
        String vehicleType,
        BookingStatus status,
        String accessCode,
        Instant approvalTime
) {
}
