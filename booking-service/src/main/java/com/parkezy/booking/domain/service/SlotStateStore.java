package com.parkezy.booking.domain.service;

import com.parkezy.booking.domain.model.ListingSlot;
import com.parkezy.booking.domain.repository.ListingSlotRepository;
import com.parkezy.booking.domain.repository.PrivateListingRepository;
import com.parkezy.booking.exception.SlotUnavailableException;
import com.parkezy.common.exception.BusinessException;
import com.parkezy.common.exception.ErrorCode;
import com.parkezy.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Occupancy state of private-listing slots.
 *
 * Every write is a conditional single-statement UPDATE, so a slot is never held by two
 * bookings. After each write the listing's active-booking flag is recomputed from slot
 * state inside the same transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotStateStore {

    private final ListingSlotRepository slotRepository;
    private final PrivateListingRepository listingRepository;

    /**
     * Overwrites a slot's state. A non-null bookingId claims the slot (conditionally);
     * a null bookingId frees it. Writing the same state twice is a no-op.
     */
    @Transactional
    public void setState(Long listingId, Long slotId, boolean occupied, Long bookingId, Instant endTime) {
        if (bookingId != null) {
            claim(listingId, slotId, bookingId, occupied, endTime);
            return;
        }
        if (occupied) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST,
                    "An occupied slot must reference a booking");
        }
        requireSlot(listingId, slotId);
        slotRepository.clear(slotId);
        refreshActiveBookingFlag(listingId);
    }

    /**
     * Claims the slot for a booking. Succeeds if the slot is free or already held by the
     * same booking, in which case occupied and endTime are overwritten.
     *
     * @throws SlotUnavailableException if another booking holds the slot
     */
    @Transactional
    public void claim(Long listingId, Long slotId, Long bookingId, boolean occupied, Instant endTime) {
        int updatedRows = slotRepository.claim(listingId, slotId, bookingId, occupied, endTime);
        if (updatedRows == 0) {
            requireSlot(listingId, slotId);
            throw new SlotUnavailableException(listingId, slotId);
        }
        log.debug("Slot {} of listing {} claimed by booking {} (occupied={})", slotId, listingId, bookingId, occupied);
        refreshActiveBookingFlag(listingId);
    }

    /**
     * Frees the slot if the given booking holds it.
     *
     * @return true if the slot was released, false if it was not held by this booking
     */
    @Transactional
    public boolean release(Long listingId, Long slotId, Long bookingId) {
        int updatedRows = slotRepository.releaseIfHeldBy(listingId, slotId, bookingId);
        if (updatedRows == 0) {
            log.debug("Slot {} of listing {} not held by booking {}, release ignored", slotId, listingId, bookingId);
        } else {
            log.debug("Slot {} of listing {} released by booking {}", slotId, listingId, bookingId);
        }
        refreshActiveBookingFlag(listingId);
        return updatedRows > 0;
    }

    @Transactional
    public void setActiveBookingFlag(Long listingId, boolean hasActive) {
        int updatedRows = listingRepository.updateActiveBookingFlag(listingId, hasActive);
        if (updatedRows == 0) {
            throw new ResourceNotFoundException("Listing", listingId);
        }
    }

    /**
     * Derives the listing flag from slot state and writes it back.
     *
     * @return the derived flag
     */
    @Transactional
    public boolean refreshActiveBookingFlag(Long listingId) {
        boolean hasActive = slotRepository.existsByListingIdAndBookingIdIsNotNull(listingId);
        setActiveBookingFlag(listingId, hasActive);
        return hasActive;
    }

    @Transactional(readOnly = true)
    public ListingSlot getSlot(Long listingId, Long slotId) {
        return requireSlot(listingId, slotId);
    }

    @Transactional(readOnly = true)
    public List<ListingSlot> getSlots(Long listingId) {
        if (!listingRepository.existsById(listingId)) {
            throw new ResourceNotFoundException("Listing", listingId);
        }
        return slotRepository.findByListingIdOrderByIdAsc(listingId);
    }

    private ListingSlot requireSlot(Long listingId, Long slotId) {
        return slotRepository.findByIdAndListingId(slotId, listingId)
                .orElseThrow(() -> new ResourceNotFoundException("Slot", listingId + "/" + slotId));
    }
}
