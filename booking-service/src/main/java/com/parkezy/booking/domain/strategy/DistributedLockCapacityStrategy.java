package com.parkezy.booking.domain.strategy;

import com.parkezy.booking.domain.repository.FacilityRepository;
import com.parkezy.booking.exception.NoCapacityException;
import com.parkezy.common.exception.BusinessException;
import com.parkezy.common.exception.ErrorCode;
import com.parkezy.common.exception.ResourceNotFoundException;
import com.parkezy.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.concurrent.TimeUnit;

/**
 * Reserves under a Redisson lock keyed by facility, then applies the same guarded UPDATE
 * as {@link AtomicUpdateCapacityStrategy}.
 *
 * The lock coordinates instances across nodes; correctness still rests on the guard in the
 * UPDATE, so a lock that expires early cannot cause overbooking.
 */
@Slf4j
@Component("distributed")
@RequiredArgsConstructor
public class DistributedLockCapacityStrategy implements CapacityReservationStrategy {

    private static final long WAIT_SECONDS = 5;
    private static final long LEASE_SECONDS = 30;

    private final FacilityRepository facilityRepository;
    private final RedissonClient redissonClient;

    @Override
    @Transactional
    public void reserve(Long facilityId) {
        String lockKey = Constants.FACILITY_LOCK_PREFIX + facilityId;
        RLock lock = redissonClient.getLock(lockKey);

        try {
            boolean acquired = lock.tryLock(WAIT_SECONDS, LEASE_SECONDS, TimeUnit.SECONDS);
            if (!acquired) {
                throw new BusinessException(ErrorCode.LOCK_UNAVAILABLE,
                        "Unable to acquire capacity lock for facility " + facilityId + ". Please try again.");
            }
            log.debug("Acquired distributed lock: {}", lockKey);

            int updatedRows = facilityRepository.decrementAvailableIfPositive(facilityId);
            if (updatedRows == 0) {
                if (!facilityRepository.existsById(facilityId)) {
                    throw new ResourceNotFoundException("Facility", facilityId);
                }
                throw new NoCapacityException(facilityId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.LOCK_UNAVAILABLE, "Capacity reservation interrupted", e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }
}
