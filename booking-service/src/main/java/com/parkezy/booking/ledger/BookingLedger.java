package com.parkezy.booking.ledger;

import com.parkezy.booking.domain.model.Booking;
import com.parkezy.booking.domain.model.BookingMessages;
import com.parkezy.booking.domain.model.BookingPricing;
import com.parkezy.booking.domain.model.BookingStatus;
import com.parkezy.booking.domain.model.BookingTiming;
import com.parkezy.booking.domain.repository.BookingRepository;
import com.parkezy.booking.exception.IllegalTransitionException;
import com.parkezy.common.exception.BusinessException;
import com.parkezy.common.exception.ErrorCode;
import com.parkezy.common.exception.InvalidDataException;
import com.parkezy.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Authoritative store of bookings.
 *
 * The ledger does not know the lifecycle rules. It does enforce a compare-and-swap on every
 * status write: the row is locked, the current status is checked against the caller's
 * expectation, and only then is the partial update merged. Every validated read goes
 * through {@link #validate(Booking)}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingLedger {

    private static final String RESOURCE = "Booking";

    private final BookingRepository bookingRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Persists a new booking stamped with the server time.
     *
     * @return the generated booking id
     */
    @Transactional
    public Long create(BookingDraft draft) {
        Instant now = clock.instant();
        Booking booking = Booking.builder()
                .type(draft.type())
                .driverId(draft.driverId())
                .hostId(draft.hostId())
                .listingId(draft.listingId())
                .slotId(draft.slotId())
                .facilityId(draft.facilityId())
                .timing(BookingTiming.builder()
                        .requestedAt(now)
                        .scheduledStart(draft.scheduledStart())
                        .scheduledEnd(draft.scheduledEnd())
                        .build())
                .pricing(BookingPricing.builder()
                        .agreedRate(draft.agreedRate())
                        .estimatedDuration(draft.estimatedDuration())
                        .estimatedCost(draft.estimatedCost())
                        .taxAmount(draft.taxAmount())
                        .build())
                .messages(BookingMessages.builder()
                        .driverMessage(draft.driverMessage())
                        .build())
                .vehicleNumber(draft.vehicleNumber())
                .vehicleType(draft.vehicleType())
                .status(draft.status())
                .accessCode(draft.accessCode())
                .approvalTime(draft.approvalTime())
                .schemaVersion(Booking.CURRENT_SCHEMA_VERSION)
                .build();

        if (!booking.hasConsistentResourceReference()) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST,
                    "Booking resource reference does not match type " + draft.type());
        }

        Booking saved = bookingRepository.saveAndFlush(booking);
        log.debug("Created {} booking {} in status {}", saved.getType(), saved.getId(), saved.getStatus());
        eventPublisher.publishEvent(new BookingChangedEvent(saved.getId(), saved.getType(),
                saved.getDriverId(), saved.getHostId(), null, saved.getStatus(), now));
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public Booking get(Long id) {
        Booking booking = bookingRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, id));
        return validate(booking);
    }

    /**
     * Moves a booking to {@code newStatus} if its current status is {@code expected},
     * merging {@code update} in the same write.
     *
     * @throws IllegalTransitionException if the current status is not the expected one
     */
    @Transactional
    public Booking updateStatus(Long id, BookingStatus expected, BookingStatus newStatus, StatusUpdate update) {
        return updateStatus(id, EnumSet.of(expected), newStatus, update);
    }

    @Transactional
    public Booking updateStatus(Long id, Set<BookingStatus> expected, BookingStatus newStatus, StatusUpdate update) {
        Booking booking = validate(bookingRepository.findByIdForUpdate(id)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, id)));

        BookingStatus current = booking.getStatus();
        if (!expected.contains(current)) {
            log.warn("Stale status update rejected for booking {}: is {}, expected {}", id, current, expected);
            throw new IllegalTransitionException(id, current, expected);
        }

        booking.setStatus(newStatus);
        (update == null ? StatusUpdate.NONE : update).applyTo(booking);
        Booking saved = bookingRepository.saveAndFlush(booking);

        log.info("Booking {} moved from {} to {}", id, current.getWireValue(), newStatus.getWireValue());
        eventPublisher.publishEvent(new BookingChangedEvent(saved.getId(), saved.getType(),
                saved.getDriverId(), saved.getHostId(), current, newStatus, clock.instant()));
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Booking> findByDriver(String driverId) {
        return validateAll(bookingRepository.findByDriverIdOrderByTimingRequestedAtDesc(driverId));
    }

    @Transactional(readOnly = true)
    public List<Booking> findActiveByDriver(String driverId) {
        return validateAll(bookingRepository.findByDriverIdAndStatusInOrderByTimingRequestedAtDesc(
                driverId, EnumSet.of(BookingStatus.ACTIVE)));
    }

    @Transactional(readOnly = true)
    public List<Booking> findByHost(String hostId) {
        return validateAll(bookingRepository.findByHostIdOrderByTimingRequestedAtDesc(hostId));
    }

    @Transactional(readOnly = true)
    public List<Booking> findByHostAndStatus(String hostId, BookingStatus status) {
        return validateAll(bookingRepository.findByHostIdAndStatusOrderByTimingRequestedAtDesc(hostId, status));
    }

    /** Pending approvals: the host's bookings still in {@code requested}. */
    @Transactional(readOnly = true)
    public List<Booking> findPendingApprovals(String hostId) {
        return findByHostAndStatus(hostId, BookingStatus.REQUESTED);
    }

    private List<Booking> validateAll(List<Booking> bookings) {
        bookings.forEach(this::validate);
        return bookings;
    }

    /**
     * Read-side schema check. A row that fails here is treated as corrupt.
     */
    Booking validate(Booking booking) {
        Long id = booking.getId();
        if (booking.getSchemaVersion() == null || booking.getSchemaVersion() != Booking.CURRENT_SCHEMA_VERSION) {
            throw new InvalidDataException(RESOURCE, id, "unsupported schema version " + booking.getSchemaVersion());
        }
        if (booking.getStatus() == null) {
            throw new InvalidDataException(RESOURCE, id, "missing status");
        }
        if (booking.getTiming() == null || booking.getTiming().getRequestedAt() == null) {
            throw new InvalidDataException(RESOURCE, id, "missing timing.requestedAt");
        }
        if (booking.getPricing() == null || booking.getPricing().getEstimatedCost() == null) {
            throw new InvalidDataException(RESOURCE, id, "missing pricing.estimatedCost");
        }
        if (booking.getAccessCode() == null) {
            throw new InvalidDataException(RESOURCE, id, "missing access code");
        }
        if (!booking.hasConsistentResourceReference()) {
            throw new InvalidDataException(RESOURCE, id, "resource reference does not match type " + booking.getType());
        }
        return booking;
    }
}
