package com.parkezy.booking.api.dto;

import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * @param actualCost overrides the estimated cost as the final charge; null keeps the estimate
 */
public record EndSessionRequest(
        @PositiveOrZero(message = "Actual cost cannot be negative")
        BigDecimal actualCost
) {
}
