package com.parkezy.booking.api.exception;

import com.parkezy.common.dto.BaseResponse;
import com.parkezy.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Persistence failures that reach the API. Ordered ahead of the generic handler in common,
 * which would otherwise answer them with a plain 500.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class BookingExceptionHandler {

    /** Two writers raced on the same booking row; the client should re-read and retry. */
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<BaseResponse<Void>> handleConcurrentModification(ObjectOptimisticLockingFailureException ex) {
        log.warn("Concurrent modification of {}: {}", ex.getPersistentClassName(), ex.getMessage());
        return error(ErrorCode.ILLEGAL_TRANSITION, "The booking was changed by another request. Reload and try again.");
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<BaseResponse<Void>> handleIntegrityViolation(DataIntegrityViolationException ex) {
        log.warn("Integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return error(ErrorCode.INVALID_REQUEST, "Request conflicts with existing data");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<BaseResponse<Void>> handleStoreUnavailable(DataAccessException ex) {
        log.error("Store unavailable", ex);
        return error(ErrorCode.SERVICE_UNAVAILABLE, "Booking store temporarily unavailable. Please retry.");
    }

    private static ResponseEntity<BaseResponse<Void>> error(ErrorCode code, String message) {
        return ResponseEntity.status(code.getStatus()).body(BaseResponse.error(code, message));
    }
}
