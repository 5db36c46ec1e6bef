package com.parkezy.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Stable error codes returned to clients, each bound to the HTTP status it maps to.
 */
@Getter
public enum ErrorCode {
    BUSINESS_ERROR(HttpStatus.BAD_REQUEST),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    NOT_AUTHENTICATED(HttpStatus.UNAUTHORIZED),
    ACCESS_DENIED(HttpStatus.FORBIDDEN),
    RESOURCE_NOT_FOUND(HttpStatus.NOT_FOUND),
    NO_CAPACITY(HttpStatus.CONFLICT),
    SLOT_UNAVAILABLE(HttpStatus.CONFLICT),
    ILLEGAL_TRANSITION(HttpStatus.CONFLICT),
    PARTIAL_FAILURE(HttpStatus.CONFLICT),
    LOCK_UNAVAILABLE(HttpStatus.CONFLICT),
    INVALID_DATA(HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }
}
