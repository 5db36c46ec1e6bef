package com.parkezy.booking.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record RegisterUserRequest(
        @NotBlank
        @Email(message = "Email must be valid")
        String email,

        @NotBlank(message = "Name cannot be blank")
        String name,

        String phoneNumber
) {
}
