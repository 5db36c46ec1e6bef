package com.parkezy.booking.api.controller;

import com.parkezy.booking.api.dto.CreateListingRequest;
import com.parkezy.booking.api.dto.ListingResponse;
import com.parkezy.booking.api.dto.ListingSlotResponse;
import com.parkezy.booking.api.dto.UpdateSlotStateRequest;
import com.parkezy.booking.domain.model.PrivateListing;
import com.parkezy.booking.domain.service.CatalogService;
import com.parkezy.booking.domain.service.SlotStateStore;
import com.parkezy.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/listings")
@RequiredArgsConstructor
public class ListingController {

    private final CatalogService catalogService;
    private final SlotStateStore slotStateStore;

    @PostMapping
    public ResponseEntity<BaseResponse<ListingResponse>> createListing(
            @Valid @RequestBody CreateListingRequest request) {
        PrivateListing listing = catalogService.createListing(request);
        ListingResponse response = ListingResponse.from(listing, slotStateStore.getSlots(listing.getId()));
        return ResponseEntity.ok(BaseResponse.success("Listing created successfully", response));
    }

    @GetMapping("/{id}/slots")
    public ResponseEntity<BaseResponse<List<ListingSlotResponse>>> getSlots(@PathVariable Long id) {
        List<ListingSlotResponse> slots = slotStateStore.getSlots(id).stream()
                .map(ListingSlotResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(slots));
    }

    @PutMapping("/{id}/slots/{slotId}")
    public ResponseEntity<BaseResponse<ListingSlotResponse>> updateSlotState(
            @PathVariable Long id, @PathVariable Long slotId, @RequestBody UpdateSlotStateRequest request) {
        ListingSlotResponse slot = ListingSlotResponse.from(catalogService.updateSlotState(id, slotId, request));
        return ResponseEntity.ok(BaseResponse.success("Slot updated", slot));
    }
}
