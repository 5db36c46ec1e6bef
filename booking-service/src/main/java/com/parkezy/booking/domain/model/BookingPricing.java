package com.parkezy.booking.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Plain decimal currency amounts (not cents-scaled).
 */
@Embeddable
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingPricing {

    @Column(name = "agreed_rate", nullable = false, precision = 10, scale = 2)
    private BigDecimal agreedRate;

    /** Hours; commercial bookings only. */
    @Column(name = "estimated_duration", precision = 6, scale = 2)
    private BigDecimal estimatedDuration;

    @Column(name = "estimated_cost", nullable = false, precision = 10, scale = 2)
    private BigDecimal estimatedCost;

    /** Set only when the booking completes. */
    @Column(name = "actual_cost", precision = 10, scale = 2)
    private BigDecimal actualCost;

    /** Private bookings only. */
    @Column(name = "tax_amount", precision = 10, scale = 2)
    private BigDecimal taxAmount;
}
