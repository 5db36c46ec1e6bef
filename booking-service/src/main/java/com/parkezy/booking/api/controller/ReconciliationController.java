package com.parkezy.booking.api.controller;

import com.parkezy.booking.reconciliation.ReconciliationReport;
import com.parkezy.booking.reconciliation.ReconciliationService;
import com.parkezy.common.dto.BaseResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * On-demand run of the reconciliation sweep. Report-only unless repair=true.
 */
@RestController
@RequestMapping("/api/v1/admin/reconciliation")
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    @GetMapping
    public ResponseEntity<BaseResponse<ReconciliationReport>> reconcile(
            @RequestParam(defaultValue = "false") boolean repair) {
        return ResponseEntity.ok(BaseResponse.success(reconciliationService.reconcile(repair)));
    }

    /** 200 if the facility's available count matches its holding bookings, 409 PARTIAL_FAILURE otherwise. */
    @GetMapping("/facilities/{id}")
    public ResponseEntity<BaseResponse<Void>> checkFacility(@PathVariable Long id) {
        reconciliationService.assertFacilityConsistent(id);
        return ResponseEntity.ok(BaseResponse.success("Facility " + id + " is consistent", null));
    }
}
