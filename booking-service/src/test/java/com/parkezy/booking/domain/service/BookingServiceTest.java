package com.parkezy.booking.domain.service;

import com.parkezy.booking.api.dto.BookingResponse;
import com.parkezy.booking.api.dto.CommercialBookingRequest;
import com.parkezy.booking.domain.model.Booking;
import com.parkezy.booking.domain.model.BookingPricing;
import com.parkezy.booking.domain.model.BookingStatus;
import com.parkezy.booking.domain.model.BookingTiming;
import com.parkezy.booking.domain.model.BookingType;
import com.parkezy.booking.identity.CurrentUserProvider;
import com.parkezy.booking.ledger.BookingLedger;
import com.parkezy.booking.orchestration.BookingOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookingServiceTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private BookingOrchestrator orchestrator;
    @Mock
    private BookingLedger ledger;
    @Mock
    private BookingIdempotencyService idempotencyService;
    @Mock
    private CurrentUserProvider currentUserProvider;

    @InjectMocks
    private BookingService bookingService;

    @Test
    @DisplayName("losing a same-key race returns the winner's booking")
    void bookCommercialSpot_concurrentDuplicateKey() {
        // given
        CommercialBookingRequest request = request("key-1");
        when(orchestrator.bookCommercialSpot(request))
                .thenThrow(new DataIntegrityViolationException("duplicate key booking_idempotency_pkey"));
        when(currentUserProvider.requireCurrentUserId()).thenReturn("driver-1");
        when(idempotencyService.findBookingId("driver-1", "key-1")).thenReturn(Optional.of(11L));
        when(ledger.get(11L)).thenReturn(booking(11L));

        // when
        BookingResponse response = bookingService.bookCommercialSpot(request);

        // then
        assertThat(response.id()).isEqualTo(11L);
        assertThat(response.status()).isEqualTo(BookingStatus.CONFIRMED);
    }

    @Test
    @DisplayName("integrity violations without a key are not swallowed")
    void bookCommercialSpot_violationWithoutKey() {
        CommercialBookingRequest request = request(null);
        DataIntegrityViolationException violation = new DataIntegrityViolationException("check constraint");
        when(orchestrator.bookCommercialSpot(request)).thenThrow(violation);

        assertThatThrownBy(() -> bookingService.bookCommercialSpot(request)).isSameAs(violation);
        verify(idempotencyService, never()).findBookingId(anyString(), anyString());
    }

    @Test
    @DisplayName("a violation with a key that was never recorded is rethrown")
    void bookCommercialSpot_violationKeyNotRecorded() {
        CommercialBookingRequest request = request("key-1");
        DataIntegrityViolationException violation = new DataIntegrityViolationException("check constraint");
        when(orchestrator.bookCommercialSpot(request)).thenThrow(violation);
        when(currentUserProvider.requireCurrentUserId()).thenReturn("driver-1");
        when(idempotencyService.findBookingId("driver-1", "key-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> bookingService.bookCommercialSpot(request)).isSameAs(violation);
    }

    @Test
    @DisplayName("pending approvals are mapped to responses")
    void getPendingApprovals() {
        Booking requested = booking(12L);
        requested.setStatus(BookingStatus.REQUESTED);
        when(ledger.findPendingApprovals("host-1")).thenReturn(List.of(requested));

        List<BookingResponse> responses = bookingService.getPendingApprovals("host-1");

        assertThat(responses).extracting(BookingResponse::id).containsExactly(12L);
    }

    private static CommercialBookingRequest request(String key) {
        return new CommercialBookingRequest(7L, START, START.plusSeconds(3600), null, null, key);
    }

    private static Booking booking(Long id) {
        return Booking.builder()
                .id(id)
                .type(BookingType.COMMERCIAL)
                .driverId("driver-1")
                .hostId("owner-1")
                .facilityId(7L)
                .timing(BookingTiming.builder()
                        .requestedAt(START.minusSeconds(60))
                        .scheduledStart(START)
                        .scheduledEnd(START.plusSeconds(3600))
                        .build())
                .pricing(BookingPricing.builder()
                        .agreedRate(new BigDecimal("50.00"))
                        .estimatedCost(new BigDecimal("50.00"))
                        .build())
                .status(BookingStatus.CONFIRMED)
                .accessCode("000042")
                .build();
    }
}
