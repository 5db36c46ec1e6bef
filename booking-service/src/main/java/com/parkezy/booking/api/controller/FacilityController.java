package com.parkezy.booking.api.controller;

import com.parkezy.booking.api.dto.CreateFacilityRequest;
import com.parkezy.booking.api.dto.FacilityCapacityResponse;
import com.parkezy.booking.api.dto.FacilityResponse;
import com.parkezy.booking.api.dto.UpdateCapacityRequest;
import com.parkezy.booking.domain.model.FacilityCapacity;
import com.parkezy.booking.domain.service.CatalogService;
import com.parkezy.booking.domain.service.FacilityCapacityStore;
import com.parkezy.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/facilities")
@RequiredArgsConstructor
public class FacilityController {

    private final CatalogService catalogService;
    private final FacilityCapacityStore facilityCapacityStore;

    @PostMapping
    public ResponseEntity<BaseResponse<FacilityResponse>> createFacility(
            @Valid @RequestBody CreateFacilityRequest request) {
        FacilityResponse response = FacilityResponse.from(catalogService.createFacility(request));
        return ResponseEntity.ok(BaseResponse.success("Facility created successfully", response));
    }

    @GetMapping("/{id}/capacity")
    public ResponseEntity<BaseResponse<FacilityCapacityResponse>> getCapacity(@PathVariable Long id) {
        FacilityCapacity capacity = facilityCapacityStore.getCapacity(id);
        return ResponseEntity.ok(BaseResponse.success(FacilityCapacityResponse.from(id, capacity)));
    }

    @PutMapping("/{id}/capacity")
    public ResponseEntity<BaseResponse<FacilityCapacityResponse>> updateCapacity(
            @PathVariable Long id, @Valid @RequestBody UpdateCapacityRequest request) {
        FacilityCapacity capacity = catalogService.updateTotalCapacity(id, request.totalCapacity());
        return ResponseEntity.ok(BaseResponse.success("Capacity updated", FacilityCapacityResponse.from(id, capacity)));
    }
}
