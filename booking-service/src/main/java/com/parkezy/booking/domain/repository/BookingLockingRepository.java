package com.parkezy.booking.domain.repository;

import com.parkezy.booking.domain.model.Booking;

import java.util.Optional;

public interface BookingLockingRepository {

    /**
     * Takes a row lock (SELECT ... FOR UPDATE) and reloads the booking's state from the
     * locked row, even if the booking was already loaded earlier in the transaction.
     */
    Optional<Booking> findByIdForUpdate(Long id);
}
