package com.parkezy.booking.exception;

import com.parkezy.common.exception.BusinessException;
import com.parkezy.common.exception.ErrorCode;
import lombok.Getter;

/**
 * Facility is fully booked. Never retried automatically: capacity may genuinely be exhausted.
 */
@Getter
public class NoCapacityException extends BusinessException {

    private final Long facilityId;

    public NoCapacityException(Long facilityId) {
        super(ErrorCode.NO_CAPACITY, "Facility " + facilityId + " is fully booked");
        this.facilityId = facilityId;
    }
}
