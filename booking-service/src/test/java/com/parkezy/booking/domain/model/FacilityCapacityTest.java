package com.parkezy.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FacilityCapacityTest {

    @Test
    @DisplayName("resize keeps the occupied count")
    void resize_keepsOccupied() {
        FacilityCapacity capacity = new FacilityCapacity(10, 4); // 6 occupied

        capacity.resize(20);

        assertThat(capacity.getTotal()).isEqualTo(20);
        assertThat(capacity.getAvailable()).isEqualTo(14);
        assertThat(capacity.occupied()).isEqualTo(6);
    }

    @Test
    @DisplayName("shrinking below the occupied count leaves zero available")
    void resize_belowOccupied_clampsToZero() {
        FacilityCapacity capacity = new FacilityCapacity(10, 4);

        capacity.resize(3);

        assertThat(capacity.getTotal()).isEqualTo(3);
        assertThat(capacity.getAvailable()).isZero();
    }
}
