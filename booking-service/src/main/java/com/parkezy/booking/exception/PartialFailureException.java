package com.parkezy.booking.exception;

import com.parkezy.common.exception.BusinessException;
import com.parkezy.common.exception.ErrorCode;

/**
 * Booking state and capacity or slot state disagree and need reconciliation.
 */
public class PartialFailureException extends BusinessException {

    public PartialFailureException(String message) {
        super(ErrorCode.PARTIAL_FAILURE, message);
    }
}
