package com.parkezy.booking.ledger;

import com.parkezy.booking.domain.model.Booking;
import com.parkezy.booking.domain.model.BookingMessages;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Typed partial update merged into a booking alongside a status change.
 * Null fields are left untouched.
 */
@Builder
public record StatusUpdate(
        Instant approvalTime,
        String rejectionReason,
        Instant actualStart,
        Instant actualEnd,
        BigDecimal actualCost,
        String hostMessage
) {

    public static final StatusUpdate NONE = StatusUpdate.builder().build();

    void applyTo(Booking booking) {
        if (approvalTime != null) {
            booking.setApprovalTime(approvalTime);
        }
        if (rejectionReason != null) {
            booking.setRejectionReason(rejectionReason);
        }
        if (actualStart != null) {
            booking.getTiming().setActualStart(actualStart);
        }
        if (actualEnd != null) {
            booking.getTiming().setActualEnd(actualEnd);
        }
        if (actualCost != null) {
            booking.getPricing().setActualCost(actualCost);
        }
        if (hostMessage != null) {
            if (booking.getMessages() == null) {
                booking.setMessages(new BookingMessages());
            }
            booking.getMessages().setHostMessage(hostMessage);
        }
    }
}
