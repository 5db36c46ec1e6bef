package com.parkezy.booking.domain.repository;

import com.parkezy.booking.domain.model.Facility;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceContext;

import java.util.Optional;

public class FacilityLockingRepositoryImpl implements FacilityLockingRepository {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Optional<Facility> findByIdForUpdate(Long facilityId) {
        Facility facility = entityManager.find(Facility.class, facilityId);
        if (facility == null) {
            return Optional.empty();
        }
        entityManager.refresh(facility, LockModeType.PESSIMISTIC_WRITE);
        return Optional.of(facility);
    }
}
