package com.parkezy.booking.domain.repository;

import com.parkezy.booking.domain.model.Facility;

import java.util.Optional;

public interface FacilityLockingRepository {

    /**
     * SELECT ... FOR UPDATE, reloading the capacity counters from the locked row.
     * Serializes capacity changes that must read before writing.
     */
    Optional<Facility> findByIdForUpdate(Long facilityId);
}
