package com.parkezy.booking.domain.repository;

import com.parkezy.booking.domain.model.Booking;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceContext;

import java.util.Optional;

public class BookingLockingRepositoryImpl implements BookingLockingRepository {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Optional<Booking> findByIdForUpdate(Long id) {
        Booking booking = entityManager.find(Booking.class, id);
        if (booking == null) {
            return Optional.empty();
        }
        // A locking query would keep the stale managed state; refresh re-reads under the lock.
        entityManager.refresh(booking, LockModeType.PESSIMISTIC_WRITE);
        return Optional.of(booking);
    }
}
