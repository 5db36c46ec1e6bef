package com.parkezy.booking.api.controller;

import com.parkezy.booking.api.dto.ApproveBookingRequest;
import com.parkezy.booking.api.dto.BookingResponse;
import com.parkezy.booking.api.dto.CommercialBookingRequest;
import com.parkezy.booking.api.dto.EndSessionRequest;
import com.parkezy.booking.api.dto.PrivateBookingRequest;
import com.parkezy.booking.api.dto.RejectBookingRequest;
import com.parkezy.booking.domain.service.BookingService;
import com.parkezy.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the booking lifecycle.
 * The acting user comes from the identity header, never from the body.
 */
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;

    @PostMapping("/private")
    public ResponseEntity<BaseResponse<BookingResponse>> requestPrivateBooking(
            @Valid @RequestBody PrivateBookingRequest request) {
        BookingResponse response = bookingService.requestPrivateBooking(request);
        return ResponseEntity.ok(BaseResponse.success("Booking requested successfully", response));
    }

    @PostMapping("/commercial")
    public ResponseEntity<BaseResponse<BookingResponse>> bookCommercialSpot(
            @Valid @RequestBody CommercialBookingRequest request) {
        BookingResponse response = bookingService.bookCommercialSpot(request);
        return ResponseEntity.ok(BaseResponse.success("Booking confirmed successfully", response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getBooking(id)));
    }

    @GetMapping("/driver/{driverId}")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getDriverBookings(@PathVariable String driverId) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getDriverBookings(driverId)));
    }

    @GetMapping("/driver/{driverId}/active")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getActiveDriverBookings(@PathVariable String driverId) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getActiveDriverBookings(driverId)));
    }

    @GetMapping("/host/{hostId}")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getHostBookings(@PathVariable String hostId) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getHostBookings(hostId)));
    }

    @GetMapping("/host/{hostId}/pending")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getPendingApprovals(@PathVariable String hostId) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getPendingApprovals(hostId)));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<BaseResponse<BookingResponse>> approve(
            @PathVariable Long id, @Valid @RequestBody(required = false) ApproveBookingRequest request) {
        BookingResponse response = bookingService.approve(id, request == null ? null : request.hostMessage());
        return ResponseEntity.ok(BaseResponse.success("Booking approved", response));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<BaseResponse<BookingResponse>> reject(
            @PathVariable Long id, @Valid @RequestBody RejectBookingRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Booking rejected", bookingService.reject(id, request.reason())));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<BookingResponse>> requestCancellation(@PathVariable Long id) {
        BookingResponse response = bookingService.requestCancellation(id);
        return ResponseEntity.ok(BaseResponse.success("Cancellation " + response.status().getWireValue(), response));
    }

    @PostMapping("/{id}/cancel/confirm")
    public ResponseEntity<BaseResponse<BookingResponse>> confirmCancellation(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success("Cancellation confirmed", bookingService.confirmCancellation(id)));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<BaseResponse<BookingResponse>> startSession(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success("Session started", bookingService.startSession(id)));
    }

    @PostMapping("/{id}/end")
    public ResponseEntity<BaseResponse<BookingResponse>> endSession(
            @PathVariable Long id, @Valid @RequestBody(required = false) EndSessionRequest request) {
        BookingResponse response = bookingService.endSession(id, request == null ? null : request.actualCost());
        return ResponseEntity.ok(BaseResponse.success("Session ended", response));
    }

    @PostMapping("/{id}/no-show")
    public ResponseEntity<BaseResponse<BookingResponse>> markNoShow(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success("Booking marked as no-show", bookingService.markNoShow(id)));
    }
}
