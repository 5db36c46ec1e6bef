package com.parkezy.booking.domain.strategy;

import com.parkezy.booking.domain.repository.FacilityRepository;
import com.parkezy.booking.exception.NoCapacityException;
import com.parkezy.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reserves with one guarded UPDATE:
 *
 *   UPDATE facilities SET capacity_available = capacity_available - 1
 *   WHERE id = :id AND capacity_available > 0;
 *
 * The check and the decrement happen in the same statement, so availability is never
 * derived from in-memory entity state. Zero rows affected means full or missing.
 */
@Slf4j
@Component("atomic")
@RequiredArgsConstructor
public class AtomicUpdateCapacityStrategy implements CapacityReservationStrategy {

    private final FacilityRepository facilityRepository;

    @Override
    @Transactional
    public void reserve(Long facilityId) {
        int updatedRows = facilityRepository.decrementAvailableIfPositive(facilityId);
        if (updatedRows == 0) {
            if (!facilityRepository.existsById(facilityId)) {
                throw new ResourceNotFoundException("Facility", facilityId);
            }
            throw new NoCapacityException(facilityId);
        }
        log.debug("Took one unit of facility {} with guarded update", facilityId);
    }

    @Override
    public String getStrategyType() {
        return "ATOMIC_UPDATE";
    }
}
