package com.parkezy.booking.api.dto;

import jakarta.validation.constraints.Size;

/** Optional body of an approval; the message is shown to the driver. */
public record ApproveBookingRequest(
        @Size(max = 500)
        String hostMessage
) {
}
