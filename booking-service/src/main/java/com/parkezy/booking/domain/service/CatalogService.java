package com.parkezy.booking.domain.service;

import com.parkezy.booking.api.dto.CreateFacilityRequest;
import com.parkezy.booking.api.dto.CreateListingRequest;
import com.parkezy.booking.api.dto.UpdateSlotStateRequest;
import com.parkezy.booking.domain.model.Facility;
import com.parkezy.booking.domain.model.FacilityCapacity;
import com.parkezy.booking.domain.model.ListingSlot;
import com.parkezy.booking.domain.model.PrivateListing;
import com.parkezy.booking.domain.model.UserCapability;
import com.parkezy.booking.domain.model.UserProfile;
import com.parkezy.booking.domain.repository.FacilityRepository;
import com.parkezy.booking.domain.repository.ListingSlotRepository;
import com.parkezy.booking.domain.repository.PrivateListingRepository;
import com.parkezy.booking.identity.CurrentUserProvider;
import com.parkezy.common.exception.AccessDeniedException;
import com.parkezy.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read and write path for facilities and private listings.
 * The booking core reads rates and the auto-accept flag from here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogService {

    private final FacilityRepository facilityRepository;
    private final PrivateListingRepository listingRepository;
    private final ListingSlotRepository slotRepository;
    private final UserProfileStore userProfileStore;
    private final FacilityCapacityStore facilityCapacityStore;
    private final SlotStateStore slotStateStore;
    private final CurrentUserProvider currentUserProvider;

    /**
     * Creates a facility owned by the current user and marks them as a commercial host.
     */
    @Transactional
    public Facility createFacility(CreateFacilityRequest request) {
        String ownerId = currentUserProvider.requireCurrentUserId();
        UserProfile owner = userProfileStore.getProfile(ownerId);

        Facility facility = Facility.builder()
                .ownerId(ownerId)
                .ownerName(owner.getName())
                .name(request.name())
                .address(request.address())
                .latitude(request.latitude())
                .longitude(request.longitude())
                .facilityType(request.facilityType())
                .defaultHourlyRate(request.defaultHourlyRate())
                .capacity(FacilityCapacity.of(request.totalCapacity()))
                .build();
        Facility saved = facilityRepository.save(facility);
        userProfileStore.enableCapability(ownerId, UserCapability.CAN_HOST_COMMERCIAL);

        log.info("Created facility {} for owner {} with capacity {}", saved.getId(), ownerId, request.totalCapacity());
        return saved;
    }

    /**
     * Creates a listing with its slots for the current user and marks them as a private host.
     */
    @Transactional
    public PrivateListing createListing(CreateListingRequest request) {
        String hostId = currentUserProvider.requireCurrentUserId();
        userProfileStore.getProfile(hostId);

        PrivateListing listing = listingRepository.save(PrivateListing.builder()
                .hostId(hostId)
                .title(request.title())
                .address(request.address())
                .hourlyRate(request.hourlyRate())
                .autoAcceptBookings(request.autoAcceptBookings())
                .build());

        List<ListingSlot> slots = request.slotLabels().stream()
                .map(label -> ListingSlot.builder().listingId(listing.getId()).label(label).build())
                .toList();
        slotRepository.saveAll(slots);
        userProfileStore.enableCapability(hostId, UserCapability.CAN_HOST_PRIVATE);

        log.info("Created listing {} for host {} with {} slots", listing.getId(), hostId, slots.size());
        return listing;
    }

    /**
     * Administrative resize. Only the facility owner may change its total.
     */
    @Transactional
    public FacilityCapacity updateTotalCapacity(Long facilityId, int newTotal) {
        String userId = currentUserProvider.requireCurrentUserId();
        String ownerId = facilityRepository.findOwnerIdById(facilityId)
                .orElseThrow(() -> new ResourceNotFoundException("Facility", facilityId));
        if (!ownerId.equals(userId)) {
            throw new AccessDeniedException("Only the facility owner can change its capacity");
        }
        return facilityCapacityStore.setTotal(facilityId, newTotal);
    }

    /**
     * Host override of one slot's state, e.g. after an offline arrival. Only the listing's
     * host may write it.
     */
    @Transactional
    public ListingSlot updateSlotState(Long listingId, Long slotId, UpdateSlotStateRequest request) {
        String userId = currentUserProvider.requireCurrentUserId();
        PrivateListing listing = getListing(listingId);
        if (!listing.getHostId().equals(userId)) {
            throw new AccessDeniedException("Only the listing host can change its slots");
        }
        slotStateStore.setState(listingId, slotId, request.occupied(), request.bookingId(), request.endTime());
        return slotStateStore.getSlot(listingId, slotId);
    }

    @Transactional(readOnly = true)
    public Facility getFacility(Long facilityId) {
        return facilityRepository.findById(facilityId)
                .orElseThrow(() -> new ResourceNotFoundException("Facility", facilityId));
    }

    @Transactional(readOnly = true)
    public PrivateListing getListing(Long listingId) {
        return listingRepository.findById(listingId)
                .orElseThrow(() -> new ResourceNotFoundException("Listing", listingId));
    }
}
