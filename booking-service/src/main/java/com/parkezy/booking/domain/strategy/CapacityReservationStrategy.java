package com.parkezy.booking.domain.strategy;

/**
 * Takes one unit of a facility's capacity under a specific concurrency-control mechanism.
 *
 * Implementations (bean names):
 * - atomic: guarded single-statement UPDATE
 * - pessimistic: SELECT FOR UPDATE, then check and decrement
 * - distributed: Redisson lock around the guarded UPDATE
 *
 * Every implementation must be linearizable per facility: with total capacity C at most C
 * reservations succeed, whatever the interleaving.
 */
public interface CapacityReservationStrategy {

    /**
     * Takes one unit or fails.
     *
     * @throws com.parkezy.booking.exception.NoCapacityException if available is 0
     * @throws com.parkezy.common.exception.ResourceNotFoundException if the facility does not exist
     */
    void reserve(Long facilityId);

    String getStrategyType();
}
