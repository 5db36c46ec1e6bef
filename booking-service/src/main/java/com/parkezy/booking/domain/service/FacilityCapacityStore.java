package com.parkezy.booking.domain.service;

import com.parkezy.booking.domain.model.Facility;
import com.parkezy.booking.domain.model.FacilityCapacity;
import com.parkezy.booking.domain.repository.FacilityRepository;
import com.parkezy.booking.domain.strategy.CapacityReservationStrategy;
import com.parkezy.common.exception.BusinessException;
import com.parkezy.common.exception.ErrorCode;
import com.parkezy.common.exception.ResourceNotFoundException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Owns the total/available counters of commercial facilities.
 *
 * Reservation goes through a {@link CapacityReservationStrategy} picked from Spring's map
 * injection by bean name ({@code parking.capacity.strategy}). Release and resize do not
 * vary by strategy.
 *
 * None of these operations is safe to retry blindly after an unknown outcome; callers
 * rely on the transaction boundary instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FacilityCapacityStore {

    static final String DEFAULT_STRATEGY = "atomic";

    private final Map<String, CapacityReservationStrategy> reservationStrategies;
    private final FacilityRepository facilityRepository;

    @Value("${parking.capacity.strategy:atomic}")
    private String strategyType;

    @PostConstruct
    public void init() {
        log.info("Initialized FacilityCapacityStore with strategy: {}", getStrategy().getStrategyType());
    }

    /**
     * Atomically checks available > 0 and takes one unit.
     *
     * @throws com.parkezy.booking.exception.NoCapacityException if the facility is full
     */
    @Transactional
    public void reserve(Long facilityId) {
        CapacityReservationStrategy strategy = getStrategy();
        log.debug("Reserving capacity of facility {} using strategy: {}", facilityId, strategy.getStrategyType());
        strategy.reserve(facilityId);
    }

    /**
     * Returns one unit, capped at total. Releasing a facility already at total is a no-op.
     */
    @Transactional
    public void release(Long facilityId) {
        int updatedRows = facilityRepository.incrementAvailableBelowTotal(facilityId);
        if (updatedRows == 0) {
            if (!facilityRepository.existsById(facilityId)) {
                throw new ResourceNotFoundException("Facility", facilityId);
            }
            log.debug("Facility {} already at total capacity, release ignored", facilityId);
            return;
        }
        log.debug("Returned one unit to facility {}", facilityId);
    }

    /**
     * Changes the total while keeping the occupied count:
     * available = max(0, newTotal - (oldTotal - oldAvailable)).
     */
    @Transactional
    public FacilityCapacity setTotal(Long facilityId, int newTotal) {
        if (newTotal < 0) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "Total capacity must not be negative");
        }
        Facility facility = facilityRepository.findByIdForUpdate(facilityId)
                .orElseThrow(() -> new ResourceNotFoundException("Facility", facilityId));

        FacilityCapacity capacity = facility.getCapacity();
        int oldTotal = capacity.getTotal();
        int oldAvailable = capacity.getAvailable();
        capacity.resize(newTotal);
        facilityRepository.save(facility);

        log.info("Facility {} capacity resized from {}/{} to {}/{}",
                facilityId, oldAvailable, oldTotal, capacity.getAvailable(), capacity.getTotal());
        return new FacilityCapacity(capacity.getTotal(), capacity.getAvailable());
    }

    @Transactional(readOnly = true)
    public FacilityCapacity getCapacity(Long facilityId) {
        return facilityRepository.findById(facilityId)
                .map(Facility::getCapacity)
                .map(c -> new FacilityCapacity(c.getTotal(), c.getAvailable()))
                .orElseThrow(() -> new ResourceNotFoundException("Facility", facilityId));
    }

    /**
     * Direct lookup by bean name; falls back to "atomic" if the configured name is unknown.
     */
    CapacityReservationStrategy getStrategy() {
        String key = strategyType == null ? DEFAULT_STRATEGY : strategyType.toLowerCase();
        CapacityReservationStrategy strategy = reservationStrategies.get(key);
        if (strategy == null) {
            log.warn("Unknown capacity strategy: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, reservationStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = reservationStrategies.get(DEFAULT_STRATEGY);
            if (strategy == null) {
                throw new IllegalStateException(
                        DEFAULT_STRATEGY + " strategy not found. Available strategies: "
                                + reservationStrategies.keySet());
            }
        }
        return strategy;
    }
}
