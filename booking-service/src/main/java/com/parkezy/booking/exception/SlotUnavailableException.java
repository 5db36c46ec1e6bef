package com.parkezy.booking.exception;

import com.parkezy.common.exception.BusinessException;
import com.parkezy.common.exception.ErrorCode;

public class SlotUnavailableException extends BusinessException {

    public SlotUnavailableException(Long listingId, Long slotId) {
        super(ErrorCode.SLOT_UNAVAILABLE,
                String.format("Slot %d of listing %d is held by another booking", slotId, listingId));
    }
}
