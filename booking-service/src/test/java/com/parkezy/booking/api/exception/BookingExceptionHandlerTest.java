package com.parkezy.booking.api.exception;

import com.parkezy.booking.domain.model.Booking;
import com.parkezy.common.dto.BaseResponse;
import com.parkezy.common.exception.ErrorCode;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import static org.assertj.core.api.Assertions.assertThat;

class BookingExceptionHandlerTest {

    private final BookingExceptionHandler handler = new BookingExceptionHandler();

    @Test
    void optimisticLockConflict_mapsToConflict() {
        ResponseEntity<BaseResponse<Void>> response = handler.handleConcurrentModification(
                new ObjectOptimisticLockingFailureException(Booking.class, 7L));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getErrorCode()).isEqualTo(ErrorCode.ILLEGAL_TRANSITION.name());
    }

    @Test
    void integrityViolation_mapsToBadRequest() {
        ResponseEntity<BaseResponse<Void>> response = handler.handleIntegrityViolation(
                new DataIntegrityViolationException("duplicate key"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void otherDataAccessFailure_mapsToServiceUnavailable() {
        ResponseEntity<BaseResponse<Void>> response = handler.handleStoreUnavailable(
                new QueryTimeoutException("timed out"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().getErrorCode()).isEqualTo(ErrorCode.SERVICE_UNAVAILABLE.name());
    }
}
