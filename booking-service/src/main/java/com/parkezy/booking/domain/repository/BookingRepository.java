package com.parkezy.booking.domain.repository;

import com.parkezy.booking.domain.model.Booking;
import com.parkezy.booking.domain.model.BookingStatus;
import com.parkezy.booking.domain.model.BookingType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface BookingRepository extends JpaRepository<Booking, Long>, BookingLockingRepository {

    List<Booking> findByDriverIdOrderByTimingRequestedAtDesc(String driverId);

    List<Booking> findByDriverIdAndStatusInOrderByTimingRequestedAtDesc(
            String driverId, Collection<BookingStatus> statuses);

    List<Booking> findByHostIdOrderByTimingRequestedAtDesc(String hostId);

    List<Booking> findByHostIdAndStatusOrderByTimingRequestedAtDesc(String hostId, BookingStatus status);

    List<Booking> findByFacilityIdAndStatusIn(Long facilityId, Collection<BookingStatus> statuses);

    List<Booking> findByTypeAndStatusIn(BookingType type, Collection<BookingStatus> statuses);

    long countByFacilityIdAndStatusIn(Long facilityId, Collection<BookingStatus> statuses);
}
