package com.parkezy.booking.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Aggregate capacity of a commercial facility. Invariant: 0 <= available <= total.
 */
@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class FacilityCapacity {

    @Column(name = "capacity_total", nullable = false)
    private Integer total;

    @Column(name = "capacity_available", nullable = false)
    private Integer available;

    public static FacilityCapacity of(int total) {
        return new FacilityCapacity(total, total);
    }

    public int occupied() {
        return total - available;
    }

    public boolean hasRoom() {
        return available > 0;
    }

    public void take() {
        if (available <= 0) {
            throw new IllegalStateException("No capacity available");
        }
        available--;
    }

    /**
     * Keeps the occupied count and recomputes availability against the new total.
     */
    public void resize(int newTotal) {
        int occupied = occupied();
        this.total = newTotal;
        this.available = Math.max(0, newTotal - occupied);
    }

    /** Used by reconciliation to overwrite drifted availability. */
    public void resetAvailable(int available) {
        this.available = Math.max(0, Math.min(total, available));
    }
}
