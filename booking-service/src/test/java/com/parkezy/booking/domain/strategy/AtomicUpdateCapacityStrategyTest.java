package com.parkezy.booking.domain.strategy;

import com.parkezy.booking.domain.repository.FacilityRepository;
import com.parkezy.booking.exception.NoCapacityException;
import com.parkezy.common.exception.ResourceNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AtomicUpdateCapacityStrategyTest {

    @Mock
    private FacilityRepository facilityRepository;

    @InjectMocks
    private AtomicUpdateCapacityStrategy strategy;

    @Test
    @DisplayName("reserve() succeeds when the guarded update affects 1 row")
    void reserve_success() {
        given(facilityRepository.decrementAvailableIfPositive(7L)).willReturn(1);

        assertThatCode(() -> strategy.reserve(7L)).doesNotThrowAnyException();
        verify(facilityRepository, never()).existsById(7L);
    }

    @Test
    @DisplayName("reserve() throws NoCapacity when 0 rows updated and facility exists")
    void reserve_full() {
        given(facilityRepository.decrementAvailableIfPositive(7L)).willReturn(0);
        given(facilityRepository.existsById(7L)).willReturn(true);

        assertThatThrownBy(() -> strategy.reserve(7L))
                .isInstanceOf(NoCapacityException.class)
                .hasMessageContaining("fully booked");
    }

    @Test
    @DisplayName("reserve() throws NotFound when the facility does not exist")
    void reserve_missing() {
        given(facilityRepository.decrementAvailableIfPositive(7L)).willReturn(0);
        given(facilityRepository.existsById(7L)).willReturn(false);

        assertThatThrownBy(() -> strategy.reserve(7L)).isInstanceOf(ResourceNotFoundException.class);
    }
}
