package com.parkezy.booking.orchestration;

import com.parkezy.common.util.Constants;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-point money rules. All amounts are plain decimals rounded HALF_UP to 2 places.
 */
@Component
public class PricingPolicy {

    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

    private final BigDecimal hostPayoutRatio;
    private final BigDecimal taxRate;

    public PricingPolicy(@Value("${parking.pricing.host-payout-ratio:0.85}") BigDecimal hostPayoutRatio,
                         @Value("${parking.pricing.tax-rate:0.18}") BigDecimal taxRate) {
        this.hostPayoutRatio = hostPayoutRatio;
        this.taxRate = taxRate;
    }

    /** Scheduled length in hours, to the minute. Display value only, never priced. */
    public BigDecimal durationHours(Instant start, Instant end) {
        return BigDecimal.valueOf(minutesBetween(start, end))
                .divide(MINUTES_PER_HOUR, Constants.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /** Rate times scheduled minutes over 60, rounded once at the end. */
    public BigDecimal estimateCost(BigDecimal hourlyRate, Instant start, Instant end) {
        return hourlyRate.multiply(BigDecimal.valueOf(minutesBetween(start, end)))
                .divide(MINUTES_PER_HOUR, Constants.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /** Tax on private bookings. */
    public BigDecimal taxFor(BigDecimal estimatedCost) {
        return money(estimatedCost.multiply(taxRate));
    }

    /** Host's share of a completed private booking; the platform keeps the rest. */
    public BigDecimal hostPayout(BigDecimal estimatedCost) {
        return money(estimatedCost.multiply(hostPayoutRatio));
    }

    private static long minutesBetween(Instant start, Instant end) {
        return Duration.between(start, end).toMinutes();
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(Constants.MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
