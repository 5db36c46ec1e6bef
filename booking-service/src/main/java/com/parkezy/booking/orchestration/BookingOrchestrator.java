package com.parkezy.booking.orchestration;

import com.parkezy.booking.api.dto.CommercialBookingRequest;
import com.parkezy.booking.api.dto.PrivateBookingRequest;
import com.parkezy.booking.domain.model.Booking;
import com.parkezy.booking.domain.model.BookingStatus;
import com.parkezy.booking.domain.model.BookingType;
import com.parkezy.booking.domain.model.Facility;
import com.parkezy.booking.domain.model.PrivateListing;
import com.parkezy.booking.domain.model.UserCapability;
import com.parkezy.booking.domain.service.BookingIdempotencyService;
import com.parkezy.booking.domain.service.CatalogService;
import com.parkezy.booking.domain.service.FacilityCapacityStore;
import com.parkezy.booking.domain.service.SlotStateStore;
import com.parkezy.booking.domain.service.UserProfileStore;
import com.parkezy.booking.exception.IllegalTransitionException;
import com.parkezy.booking.identity.CurrentUserProvider;
import com.parkezy.booking.ledger.BookingDraft;
import com.parkezy.booking.ledger.BookingLedger;
import com.parkezy.booking.ledger.StatusUpdate;
import com.parkezy.common.exception.AccessDeniedException;
import com.parkezy.common.exception.BusinessException;
import com.parkezy.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Drives the booking lifecycle across the ledger, the capacity and slot stores and the
 * profile store.
 *
 * Private:    requested -> confirmed -> active -> completed, or requested -> rejected.
 *             Auto-accept listings start at confirmed. The slot is claimed on confirmation.
 * Commercial: confirmed -> active -> completed. Capacity is taken at creation; a cancel
 *             request waits in cancel_requested until the owner confirms it.
 *
 * Each public operation is one transaction: the status write and every resource change it
 * implies commit together or not at all, so no step can leave an orphaned reservation.
 * Every status write is a compare-and-swap against the status this class just read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingOrchestrator {

    private static final Set<BookingStatus> CANCELLABLE = EnumSet.of(BookingStatus.CONFIRMED, BookingStatus.ACTIVE);

    private final BookingLedger ledger;
    private final FacilityCapacityStore facilityCapacityStore;
    private final SlotStateStore slotStateStore;
    private final UserProfileStore userProfileStore;
    private final CatalogService catalogService;
    private final BookingIdempotencyService idempotencyService;
    private final CurrentUserProvider currentUserProvider;
    private final PricingPolicy pricingPolicy;
    private final AccessCodeGenerator accessCodeGenerator;
    private final Clock clock;

    /**
     * Requests a private booking. Confirms immediately and claims the slot when the listing
     * auto-accepts; otherwise the slot stays free until the host approves.
     */
    @Transactional
    public Booking requestPrivateBooking(PrivateBookingRequest request) {
        String driverId = currentUserProvider.requireCurrentUserId();
        Optional<Booking> replay = findReplay(driverId, request.idempotencyKey());
        if (replay.isPresent()) {
            return replay.get();
        }

        requireWindow(request.scheduledStart(), request.scheduledEnd());
        userProfileStore.requireCapability(driverId, UserCapability.CAN_DRIVE);
        PrivateListing listing = catalogService.getListing(request.listingId());
        if (!listing.isActive()) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "Listing " + listing.getId() + " is not accepting bookings");
        }
        if (listing.getHostId().equals(driverId)) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "Hosts cannot book their own listing");
        }
        slotStateStore.getSlot(listing.getId(), request.slotId());

        boolean autoAccept = listing.isAutoAcceptBookings();
        BigDecimal estimatedCost = pricingPolicy.estimateCost(listing.getHourlyRate(),
                request.scheduledStart(), request.scheduledEnd());

        Long bookingId = ledger.create(BookingDraft.builder()
                .type(BookingType.PRIVATE)
                .driverId(driverId)
                .hostId(listing.getHostId())
                .listingId(listing.getId())
                .slotId(request.slotId())
                .scheduledStart(request.scheduledStart())
                .scheduledEnd(request.scheduledEnd())
                .agreedRate(listing.getHourlyRate())
                .estimatedCost(estimatedCost)
                .taxAmount(pricingPolicy.taxFor(estimatedCost))
                .driverMessage(request.driverMessage())
                .status(autoAccept ? BookingStatus.CONFIRMED : BookingStatus.REQUESTED)
                .accessCode(accessCodeGenerator.next())
                .approvalTime(autoAccept ? clock.instant() : null)
                .build());

        if (autoAccept) {
            slotStateStore.claim(listing.getId(), request.slotId(), bookingId, false, request.scheduledEnd());
        }
        userProfileStore.incrementDriverBookingCount(driverId);
        recordKey(driverId, request.idempotencyKey(), bookingId);

        log.info("Private booking {} {} for listing {} slot {} by driver {}", bookingId,
                autoAccept ? "auto-confirmed" : "requested", listing.getId(), request.slotId(), driverId);
        return ledger.get(bookingId);
    }

    /**
     * Books a commercial spot. Taking the capacity unit and inserting the booking are one
     * indivisible unit: if capacity is exhausted nothing is written.
     *
     * @throws com.parkezy.booking.exception.NoCapacityException if the facility is full
     */
    @Transactional
    public Booking bookCommercialSpot(CommercialBookingRequest request) {
        String driverId = currentUserProvider.requireCurrentUserId();
        Optional<Booking> replay = findReplay(driverId, request.idempotencyKey());
        if (replay.isPresent()) {
            return replay.get();
        }

        requireWindow(request.scheduledStart(), request.scheduledEnd());
        userProfileStore.requireCapability(driverId, UserCapability.CAN_DRIVE);
        Facility facility = catalogService.getFacility(request.facilityId());
        if (!facility.isBookable()) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "Facility " + facility.getId() + " is not accepting bookings");
        }
        String ownerId = facility.getOwnerId();
        BigDecimal rate = facility.getDefaultHourlyRate();
        BigDecimal hours = pricingPolicy.durationHours(request.scheduledStart(), request.scheduledEnd());

        facilityCapacityStore.reserve(facility.getId());

        Long bookingId = ledger.create(BookingDraft.builder()
                .type(BookingType.COMMERCIAL)
                .driverId(driverId)
                .hostId(ownerId)
                .facilityId(request.facilityId())
                .scheduledStart(request.scheduledStart())
                .scheduledEnd(request.scheduledEnd())
                .agreedRate(rate)
                .estimatedDuration(hours)
                .estimatedCost(pricingPolicy.estimateCost(rate, request.scheduledStart(), request.scheduledEnd()))
                .vehicleNumber(request.vehicleNumber())
                .vehicleType(request.vehicleType())
                .status(BookingStatus.CONFIRMED)
                .accessCode(accessCodeGenerator.next())
                .build());

        userProfileStore.incrementDriverBookingCount(driverId);
        recordKey(driverId, request.idempotencyKey(), bookingId);

        log.info("Commercial booking {} confirmed at facility {} for driver {}", bookingId, request.facilityId(), driverId);
        return ledger.get(bookingId);
    }

    /**
     * Host approves a pending private booking and the slot is claimed for it.
     *
     * @param hostMessage optional note for the driver, may be null
     */
    @Transactional
    public Booking approveBooking(Long bookingId, String hostMessage) {
        Booking booking = ledger.get(bookingId);
        requireHost(booking);

        Booking confirmed = transition(booking, EnumSet.of(BookingStatus.REQUESTED), BookingStatus.CONFIRMED,
                StatusUpdate.builder().approvalTime(clock.instant()).hostMessage(hostMessage).build());
        slotStateStore.claim(booking.getListingId(), booking.getSlotId(), bookingId, false,
                booking.getTiming().getScheduledEnd());
        return confirmed;
    }

    /** Host rejects a pending private booking. Nothing was reserved, so nothing is released. */
    @Transactional
    public Booking rejectBooking(Long bookingId, String reason) {
        Booking booking = ledger.get(bookingId);
        requireHost(booking);
        return transition(booking, EnumSet.of(BookingStatus.REQUESTED), BookingStatus.REJECTED,
                StatusUpdate.builder().rejectionReason(reason).build());
    }

    /**
     * Driver cancels. Private bookings are cancelled immediately and free their slot.
     * Commercial bookings move to cancel_requested and keep their capacity unit until the
     * owner confirms.
     */
    @Transactional
    public Booking requestCancellation(Long bookingId) {
        Booking booking = ledger.get(bookingId);
        requireDriver(booking);

        if (booking.isPrivate()) {
            Booking cancelled = transition(booking, CANCELLABLE, BookingStatus.CANCELLED, StatusUpdate.NONE);
            slotStateStore.release(booking.getListingId(), booking.getSlotId(), bookingId);
            return cancelled;
        }
        return transition(booking, CANCELLABLE, BookingStatus.CANCEL_REQUESTED, StatusUpdate.NONE);
    }

    /** Owner confirms a commercial cancellation; the capacity unit goes back to the facility. */
    @Transactional
    public Booking confirmCancellation(Long bookingId) {
        Booking booking = ledger.get(bookingId);
        requireHost(booking);

        Booking cancelled = transition(booking, EnumSet.of(BookingStatus.CANCEL_REQUESTED), BookingStatus.CANCELLED,
                StatusUpdate.NONE);
        releaseHeldResource(booking);
        return cancelled;
    }

    /** Either party starts the session. A private slot becomes occupied until the scheduled end. */
    @Transactional
    public Booking startSession(Long bookingId) {
        Booking booking = ledger.get(bookingId);
        requireParticipant(booking);

        Booking active = transition(booking, EnumSet.of(BookingStatus.CONFIRMED), BookingStatus.ACTIVE,
                StatusUpdate.builder().actualStart(clock.instant()).build());
        if (booking.isPrivate()) {
            slotStateStore.claim(booking.getListingId(), booking.getSlotId(), bookingId, true,
                    booking.getTiming().getScheduledEnd());
        }
        return active;
    }

    /**
     * Either party ends the session. The final charge is the override if given, else the
     * estimate. Private: slot freed and the host credited its payout share of the estimate.
     * Commercial: the capacity unit goes back to the facility.
     */
    @Transactional
    public Booking endSession(Long bookingId, BigDecimal actualCostOverride) {
        Booking booking = ledger.get(bookingId);
        requireParticipant(booking);

        BigDecimal estimatedCost = booking.getPricing().getEstimatedCost();
        BigDecimal actualCost = actualCostOverride != null ? actualCostOverride : estimatedCost;
        Booking completed = transition(booking, EnumSet.of(BookingStatus.ACTIVE), BookingStatus.COMPLETED,
                StatusUpdate.builder().actualEnd(clock.instant()).actualCost(actualCost).build());

        releaseHeldResource(booking);
        if (booking.isPrivate()) {
            BigDecimal payout = pricingPolicy.hostPayout(estimatedCost);
            userProfileStore.creditHostEarnings(booking.getHostId(), payout);
            log.info("Credited host {} with {} for booking {}", booking.getHostId(), payout, bookingId);
        }
        return completed;
    }

    /** Host marks a confirmed booking whose driver never arrived; the held resource is freed. */
    @Transactional
    public Booking markNoShow(Long bookingId) {
        Booking booking = ledger.get(bookingId);
        requireHost(booking);

        Booking noShow = transition(booking, EnumSet.of(BookingStatus.CONFIRMED), BookingStatus.NO_SHOW,
                StatusUpdate.NONE);
        releaseHeldResource(booking);
        return noShow;
    }

    private Booking transition(Booking booking, Set<BookingStatus> from, BookingStatus to, StatusUpdate update) {
        BookingStatus current = booking.getStatus();
        if (!from.contains(current) || !current.canTransitionTo(to)) {
            log.warn("Rejected transition of booking {} from {} to {}", booking.getId(), current, to);
            throw new IllegalTransitionException(booking.getId(), current, to);
        }
        return ledger.updateStatus(booking.getId(), from, to, update);
    }

    private void releaseHeldResource(Booking booking) {
        if (booking.isPrivate()) {
            slotStateStore.release(booking.getListingId(), booking.getSlotId(), booking.getId());
        } else {
            facilityCapacityStore.release(booking.getFacilityId());
        }
    }

    private Optional<Booking> findReplay(String driverId, String idempotencyKey) {
        if (!BookingIdempotencyService.hasKey(idempotencyKey)) {
            return Optional.empty();
        }
        Optional<Booking> existing = idempotencyService.findBookingId(driverId, idempotencyKey).map(ledger::get);
        existing.ifPresent(b -> log.info("Replayed booking {} for idempotency key {}", b.getId(), idempotencyKey));
        return existing;
    }

    private void recordKey(String driverId, String idempotencyKey, Long bookingId) {
        if (BookingIdempotencyService.hasKey(idempotencyKey)) {
            idempotencyService.record(driverId, idempotencyKey, bookingId);
        }
    }

    private static void requireWindow(Instant start, Instant end) {
        if (!end.isAfter(start)) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "Scheduled end must be after scheduled start");
        }
    }

    private void requireHost(Booking booking) {
        String userId = currentUserProvider.requireCurrentUserId();
        if (!userId.equals(booking.getHostId())) {
            throw new AccessDeniedException("Only the host can perform this action on booking " + booking.getId());
        }
    }

    private void requireDriver(Booking booking) {
        String userId = currentUserProvider.requireCurrentUserId();
        if (!userId.equals(booking.getDriverId())) {
            throw new AccessDeniedException("Only the driver can perform this action on booking " + booking.getId());
        }
    }

    private void requireParticipant(Booking booking) {
        String userId = currentUserProvider.requireCurrentUserId();
        if (!userId.equals(booking.getDriverId()) && !userId.equals(booking.getHostId())) {
            throw new AccessDeniedException("User is not a participant of booking " + booking.getId());
        }
    }
}
