package com.parkezy.booking.domain.repository;

import com.parkezy.booking.domain.model.BookingIdempotency;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BookingIdempotencyRepository extends JpaRepository<BookingIdempotency, String> {
}
