package com.parkezy.booking.orchestration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class PricingPolicyTest {

    private final PricingPolicy pricingPolicy = new PricingPolicy(new BigDecimal("0.85"), new BigDecimal("0.18"));

    @Test
    @DisplayName("host payout on 1000 is exactly 850.00")
    void hostPayout_is85Percent() {
        assertThat(pricingPolicy.hostPayout(new BigDecimal("1000"))).isEqualByComparingTo("850.00");
        assertThat(pricingPolicy.hostPayout(new BigDecimal("500"))).isEqualTo(new BigDecimal("425.00"));
    }

    @Test
    @DisplayName("tax is 18% rounded half-up to cents")
    void taxFor() {
        assertThat(pricingPolicy.taxFor(new BigDecimal("500"))).isEqualTo(new BigDecimal("90.00"));
        assertThat(pricingPolicy.taxFor(new BigDecimal("0.25"))).isEqualTo(new BigDecimal("0.05"));
    }

    @Test
    @DisplayName("estimate is rate times scheduled hours")
    void estimateCost() {
        Instant start = Instant.parse("2026-03-01T10:00:00Z");
        assertThat(pricingPolicy.estimateCost(new BigDecimal("100"), start, start.plusSeconds(5 * 3600)))
                .isEqualTo(new BigDecimal("500.00"));
        assertThat(pricingPolicy.durationHours(start, start.plusSeconds(90 * 60))).isEqualTo(new BigDecimal("1.50"));
    }

    @Test
    @DisplayName("short bookings are priced from minutes and rounded once: 10 minutes at 100/h is 16.67")
    void estimateCost_roundsOnlyTheResult() {
        Instant start = Instant.parse("2026-03-01T10:00:00Z");

        BigDecimal cost = pricingPolicy.estimateCost(new BigDecimal("100"), start, start.plusSeconds(10 * 60));

        assertThat(cost).isEqualTo(new BigDecimal("16.67"));
        assertThat(pricingPolicy.durationHours(start, start.plusSeconds(10 * 60))).isEqualTo(new BigDecimal("0.17"));
    }
}
