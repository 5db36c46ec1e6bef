package com.parkezy.booking.exception;

import com.parkezy.booking.domain.model.BookingStatus;
import com.parkezy.common.exception.BusinessException;
import com.parkezy.common.exception.ErrorCode;
import lombok.Getter;

import java.util.Set;

/**
 * Raised when a transition is not an edge of the lifecycle, or when the booking's status
 * changed underneath the caller (stale compare-and-swap).
 */
@Getter
public class IllegalTransitionException extends BusinessException {

    private final Long bookingId;
    private final BookingStatus currentStatus;

    public IllegalTransitionException(Long bookingId, BookingStatus currentStatus, Set<BookingStatus> expected) {
        super(ErrorCode.ILLEGAL_TRANSITION,
                String.format("Booking %d is %s, expected one of %s",
                        bookingId, currentStatus.getWireValue(), expected));
        this.bookingId = bookingId;
        this.currentStatus = currentStatus;
    }

    public IllegalTransitionException(Long bookingId, BookingStatus currentStatus, BookingStatus target) {
        super(ErrorCode.ILLEGAL_TRANSITION,
                String.format("Booking %d cannot move from %s to %s",
                        bookingId, currentStatus.getWireValue(), target.getWireValue()));
        this.bookingId = bookingId;
        this.currentStatus = currentStatus;
    }
}
