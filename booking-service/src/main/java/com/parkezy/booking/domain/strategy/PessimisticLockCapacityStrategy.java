package com.parkezy.booking.domain.strategy;

import com.parkezy.booking.domain.model.Facility;
import com.parkezy.booking.domain.repository.FacilityRepository;
import com.parkezy.booking.exception.NoCapacityException;
import com.parkezy.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reserves under a database row lock (SELECT ... FOR UPDATE).
 * The lock is held until the surrounding transaction commits, so the booking insert
 * that follows is also serialized against other reservations on the same facility.
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockCapacityStrategy implements CapacityReservationStrategy {

    private final FacilityRepository facilityRepository;

    @Override
    @Transactional
    public void reserve(Long facilityId) {
        Facility facility = facilityRepository.findByIdForUpdate(facilityId)
                .orElseThrow(() -> new ResourceNotFoundException("Facility", facilityId));

        if (!facility.getCapacity().hasRoom()) {
            throw new NoCapacityException(facilityId);
        }
        facility.getCapacity().take();
        facilityRepository.save(facility);
        log.debug("Took one unit of facility {} under row lock, {} left",
                facilityId, facility.getCapacity().getAvailable());
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}
