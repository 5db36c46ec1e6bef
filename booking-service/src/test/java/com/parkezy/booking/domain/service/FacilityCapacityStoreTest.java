package com.parkezy.booking.domain.service;

import com.parkezy.booking.domain.model.Facility;
import com.parkezy.booking.domain.model.FacilityCapacity;
import com.parkezy.booking.domain.repository.FacilityRepository;
import com.parkezy.booking.domain.strategy.CapacityReservationStrategy;
import com.parkezy.common.exception.BusinessException;
import com.parkezy.common.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FacilityCapacityStoreTest {

    @Mock
    private CapacityReservationStrategy atomic;
    @Mock
    private CapacityReservationStrategy pessimistic;
    @Mock
    private FacilityRepository facilityRepository;

    private FacilityCapacityStore store;

    @BeforeEach
    void setUp() {
        store = new FacilityCapacityStore(Map.of("atomic", atomic, "pessimistic", pessimistic), facilityRepository);
        ReflectionTestUtils.setField(store, "strategyType", "pessimistic");
    }

    @Test
    @DisplayName("reserve() delegates to the configured strategy")
    void reserve_usesConfiguredStrategy() {
        store.reserve(1L);

        verify(pessimistic).reserve(1L);
        verify(atomic, never()).reserve(any());
    }

    @Test
    @DisplayName("unknown strategy name falls back to atomic")
    void reserve_unknownStrategy_fallsBackToAtomic() {
        ReflectionTestUtils.setField(store, "strategyType", "optimistic");

        store.reserve(1L);

        verify(atomic).reserve(1L);
    }

    @Test
    @DisplayName("strategy name lookup is case-insensitive")
    void reserve_caseInsensitive() {
        ReflectionTestUtils.setField(store, "strategyType", "PESSIMISTIC");

        assertThat(store.getStrategy()).isSameAs(pessimistic);
    }

    @Test
    @DisplayName("release() at total is a no-op, not an error")
    void release_atTotal_isNoOp() {
        when(facilityRepository.incrementAvailableBelowTotal(1L)).thenReturn(0);
        when(facilityRepository.existsById(1L)).thenReturn(true);

        assertThatCode(() -> store.release(1L)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("release() of an unknown facility throws NotFound")
    void release_missing() {
        when(facilityRepository.incrementAvailableBelowTotal(1L)).thenReturn(0);
        when(facilityRepository.existsById(1L)).thenReturn(false);

        assertThatThrownBy(() -> store.release(1L)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("setTotal() keeps the occupied count: 10/4 resized to 8 leaves 2 available")
    void setTotal_recomputesAvailable() {
        Facility facility = Facility.builder().id(1L).capacity(new FacilityCapacity(10, 4)).build();
        when(facilityRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(facility));

        FacilityCapacity result = store.setTotal(1L, 8);

        assertThat(result.getTotal()).isEqualTo(8);
        assertThat(result.getAvailable()).isEqualTo(2);
        verify(facilityRepository).save(facility);
    }

    @Test
    @DisplayName("setTotal() rejects a negative total")
    void setTotal_negative() {
        assertThatThrownBy(() -> store.setTotal(1L, -1)).isInstanceOf(BusinessException.class);
        verify(facilityRepository, never()).findByIdForUpdate(any());
    }
}
