package com.parkezy.booking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RejectBookingRequest(
        @NotBlank(message = "Rejection reason cannot be blank")
        @Size(max = 500)
        String reason
) {
}
