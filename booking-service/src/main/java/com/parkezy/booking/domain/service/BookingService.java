package com.parkezy.booking.domain.service;

import com.parkezy.booking.api.dto.BookingResponse;
import com.parkezy.booking.api.dto.CommercialBookingRequest;
import com.parkezy.booking.api.dto.PrivateBookingRequest;
import com.parkezy.booking.domain.model.Booking;
import com.parkezy.booking.identity.CurrentUserProvider;
import com.parkezy.booking.ledger.BookingLedger;
import com.parkezy.booking.orchestration.BookingOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point for the booking API. Lifecycle work is delegated to {@link BookingOrchestrator},
 * reads go straight to the ledger.
 *
 * Not transactional itself: when two requests race with the same idempotency key, the
 * loser's transaction fails on the key's primary key and the winner's booking is returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private final BookingOrchestrator orchestrator;
    private final BookingLedger ledger;
    private final BookingIdempotencyService idempotencyService;
    private final CurrentUserProvider currentUserProvider;

    public BookingResponse requestPrivateBooking(PrivateBookingRequest request) {
        log.info("Requesting private booking for listing {} slot {}", request.listingId(), request.slotId());
        return createIdempotently(request.idempotencyKey(), () -> orchestrator.requestPrivateBooking(request));
    }

    public BookingResponse bookCommercialSpot(CommercialBookingRequest request) {
        log.info("Booking commercial spot at facility {}", request.facilityId());
        return createIdempotently(request.idempotencyKey(), () -> orchestrator.bookCommercialSpot(request));
    }

    public BookingResponse approve(Long bookingId, String hostMessage) {
        return BookingResponse.from(orchestrator.approveBooking(bookingId, hostMessage));
    }

    public BookingResponse reject(Long bookingId, String reason) {
        return BookingResponse.from(orchestrator.rejectBooking(bookingId, reason));
    }

    public BookingResponse requestCancellation(Long bookingId) {
        return BookingResponse.from(orchestrator.requestCancellation(bookingId));
    }

    public BookingResponse confirmCancellation(Long bookingId) {
        return BookingResponse.from(orchestrator.confirmCancellation(bookingId));
    }

    public BookingResponse startSession(Long bookingId) {
        return BookingResponse.from(orchestrator.startSession(bookingId));
    }

    public BookingResponse endSession(Long bookingId, BigDecimal actualCost) {
        return BookingResponse.from(orchestrator.endSession(bookingId, actualCost));
    }

    public BookingResponse markNoShow(Long bookingId) {
        return BookingResponse.from(orchestrator.markNoShow(bookingId));
    }

    public BookingResponse getBooking(Long bookingId) {
        return BookingResponse.from(ledger.get(bookingId));
    }

    public List<BookingResponse> getDriverBookings(String driverId) {
        return toResponses(ledger.findByDriver(driverId));
    }

    public List<BookingResponse> getActiveDriverBookings(String driverId) {
        return toResponses(ledger.findActiveByDriver(driverId));
    }

    public List<BookingResponse> getHostBookings(String hostId) {
        return toResponses(ledger.findByHost(hostId));
    }

    public List<BookingResponse> getPendingApprovals(String hostId) {
        return toResponses(ledger.findPendingApprovals(hostId));
    }

    private BookingResponse createIdempotently(String idempotencyKey, Supplier<Booking> creation) {
        try {
            return BookingResponse.from(creation.get());
        } catch (DataIntegrityViolationException e) {
            if (!BookingIdempotencyService.hasKey(idempotencyKey)) {
                throw e;
            }
            String driverId = currentUserProvider.requireCurrentUserId();
            Long existingId = idempotencyService.findBookingId(driverId, idempotencyKey).orElseThrow(() -> e);
            log.info("Concurrent request with idempotency key {} resolved to booking {}", idempotencyKey, existingId);
            return BookingResponse.from(ledger.get(existingId));
        }
    }

    private static List<BookingResponse> toResponses(List<Booking> bookings) {
        return bookings.stream().map(BookingResponse::from).toList();
    }
}
