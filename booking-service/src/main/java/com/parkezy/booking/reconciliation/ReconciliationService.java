package com.parkezy.booking.reconciliation;

import com.parkezy.booking.domain.model.Booking;
import com.parkezy.booking.domain.model.BookingStatus;
import com.parkezy.booking.domain.model.BookingType;
import com.parkezy.booking.domain.model.Facility;
import com.parkezy.booking.domain.model.FacilityCapacity;
import com.parkezy.booking.domain.model.ListingSlot;
import com.parkezy.booking.domain.model.PrivateListing;
import com.parkezy.booking.domain.repository.BookingRepository;
import com.parkezy.booking.domain.repository.FacilityRepository;
import com.parkezy.booking.domain.repository.ListingSlotRepository;
import com.parkezy.booking.domain.repository.PrivateListingRepository;
import com.parkezy.booking.exception.PartialFailureException;
import com.parkezy.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds booking state that disagrees with capacity or slot state and optionally repairs it.
 *
 * Bookings are the source of truth. A facility's available count must equal total minus
 * its holding bookings, a slot must be claimed exactly by the holding private booking that
 * references it, and a listing's flag must match its slots.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationService {

    private final FacilityRepository facilityRepository;
    private final BookingRepository bookingRepository;
    private final ListingSlotRepository slotRepository;
    private final PrivateListingRepository listingRepository;
    private final Clock clock;

    @Transactional
    public ReconciliationReport reconcile(boolean repair) {
        List<Inconsistency> findings = new ArrayList<>();
        checkFacilities(repair, findings);
        checkSlotClaims(repair, findings);
        checkMissingClaims(repair, findings);
        checkListingFlags(repair, findings);

        findings.forEach(finding -> log.warn("PARTIAL_FAILURE {} on {}: {} (repaired={})",
                finding.kind(), finding.resource(), finding.detail(), finding.repaired()));
        return new ReconciliationReport(clock.instant(), findings);
    }

    /**
     * @throws PartialFailureException if the facility's available count has drifted
     */
    @Transactional(readOnly = true)
    public void assertFacilityConsistent(Long facilityId) {
        Facility facility = facilityRepository.findById(facilityId)
                .orElseThrow(() -> new ResourceNotFoundException("Facility", facilityId));
        long holding = bookingRepository.countByFacilityIdAndStatusIn(facilityId, BookingStatus.HOLDING);
        int expected = expectedAvailable(facility.getCapacity(), holding);
        if (facility.getCapacity().getAvailable() != expected) {
            throw new PartialFailureException(String.format(
                    "Facility %d has available=%d but %d of %d units are held",
                    facilityId, facility.getCapacity().getAvailable(), holding, facility.getCapacity().getTotal()));
        }
    }

    private void checkFacilities(boolean repair, List<Inconsistency> findings) {
        for (Facility listed : facilityRepository.findByDeletedFalse()) {
            Facility facility = facilityRepository.findByIdForUpdate(listed.getId()).orElse(null);
            if (facility == null) {
                continue;
            }
            FacilityCapacity capacity = facility.getCapacity();
            long holding = bookingRepository.countByFacilityIdAndStatusIn(facility.getId(), BookingStatus.HOLDING);
            int expected = expectedAvailable(capacity, holding);
            if (capacity.getAvailable() == expected && holding <= capacity.getTotal()) {
                continue;
            }
            String detail = String.format("available=%d, total=%d, holding bookings=%d",
                    capacity.getAvailable(), capacity.getTotal(), holding);
            if (repair && capacity.getAvailable() != expected) {
                capacity.resetAvailable(expected);
                facilityRepository.saveAndFlush(facility);
            }
            findings.add(new Inconsistency(InconsistencyKind.CAPACITY_DRIFT, "facility:" + facility.getId(), detail,
                    repair && capacity.getAvailable() == expected));
        }
    }

    private void checkSlotClaims(boolean repair, List<Inconsistency> findings) {
        for (ListingSlot slot : slotRepository.findByBookingIdIsNotNull()) {
            Optional<Booking> holder = bookingRepository.findById(slot.getBookingId());
            String problem = holder.isPresent()
                    ? describeMismatch(holder.get(), slot)
                    : "booking " + slot.getBookingId() + " does not exist";
            if (problem == null) {
                continue;
            }
            boolean repaired = false;
            if (repair) {
                if (holder.isPresent() && isLegitimateUnderLock(holder.get().getId(), slot)) {
                    log.info("Slot {} claim by booking {} became legitimate since it was read, skipped",
                            slot.getId(), slot.getBookingId());
                    continue;
                }
                repaired = releaseStaleClaim(slot);
            }
            findings.add(new Inconsistency(InconsistencyKind.ORPHANED_SLOT_CLAIM,
                    slotResource(slot.getListingId(), slot.getId()), problem, repaired));
        }
    }

    /** Re-reads the holder under its row lock so no lifecycle transition can interleave. */
    private boolean isLegitimateUnderLock(Long bookingId, ListingSlot slot) {
        return bookingRepository.findByIdForUpdate(bookingId)
                .map(locked -> describeMismatch(locked, slot) == null)
                .orElse(false);
    }

    /**
     * Frees the slot only while the stale booking still holds it. A claim that changed hands
     * after the slot was read belongs to a newer booking and is left alone.
     */
    private boolean releaseStaleClaim(ListingSlot slot) {
        int released = slotRepository.releaseIfHeldBy(slot.getListingId(), slot.getId(), slot.getBookingId());
        if (released == 0) {
            log.info("Slot {} is no longer held by booking {}, repair skipped", slot.getId(), slot.getBookingId());
            return false;
        }
        refreshListingFlag(slot.getListingId());
        return true;
    }

    private void refreshListingFlag(Long listingId) {
        listingRepository.updateActiveBookingFlag(listingId,
                slotRepository.existsByListingIdAndBookingIdIsNotNull(listingId));
    }

    private void checkMissingClaims(boolean repair, List<Inconsistency> findings) {
        for (Booking booking : bookingRepository.findByTypeAndStatusIn(BookingType.PRIVATE, BookingStatus.HOLDING)) {
            Optional<ListingSlot> slot = slotRepository.findByIdAndListingId(booking.getSlotId(), booking.getListingId());
            if (slot.isEmpty() || Objects.equals(slot.get().getBookingId(), booking.getId())) {
                continue;
            }
            boolean repaired = false;
            if (repair) {
                boolean occupied = booking.getStatus() == BookingStatus.ACTIVE;
                repaired = slotRepository.claim(booking.getListingId(), booking.getSlotId(), booking.getId(),
                        occupied, booking.getTiming().getScheduledEnd()) > 0;
                if (repaired) {
                    refreshListingFlag(booking.getListingId());
                }
            }
            findings.add(new Inconsistency(InconsistencyKind.MISSING_SLOT_CLAIM,
                    slotResource(booking.getListingId(), booking.getSlotId()),
                    "booking " + booking.getId() + " is " + booking.getStatus().getWireValue()
                            + " but slot holder is " + slot.get().getBookingId(),
                    repaired));
        }
    }

    private void checkListingFlags(boolean repair, List<Inconsistency> findings) {
        for (PrivateListing listing : listingRepository.findAll()) {
            boolean derived = slotRepository.existsByListingIdAndBookingIdIsNotNull(listing.getId());
            if (listing.isHasActiveBooking() == derived) {
                continue;
            }
            if (repair) {
                listingRepository.updateActiveBookingFlag(listing.getId(), derived);
            }
            findings.add(new Inconsistency(InconsistencyKind.STALE_LISTING_FLAG, "listing:" + listing.getId(),
                    "flag=" + listing.isHasActiveBooking() + " but slots say " + derived, repair));
        }
    }

    /** Null when the booking legitimately holds the slot. */
    private static String describeMismatch(Booking booking, ListingSlot slot) {
        if (booking.getType() != BookingType.PRIVATE
                || !Objects.equals(booking.getListingId(), slot.getListingId())
                || !Objects.equals(booking.getSlotId(), slot.getId())) {
            return "booking " + booking.getId() + " does not reference this slot";
        }
        if (!booking.getStatus().holdsResource()) {
            return "booking " + booking.getId() + " is " + booking.getStatus().getWireValue();
        }
        return null;
    }

    private static int expectedAvailable(FacilityCapacity capacity, long holding) {
        return (int) Math.max(0, capacity.getTotal() - holding);
    }

    private static String slotResource(Long listingId, Long slotId) {
        return "slot:" + listingId + "/" + slotId;
    }
}
