package com.parkezy.common.exception;

/**
 * Thrown when a required dependency (e.g. idempotency store) is temporarily unavailable.
 * Client should retry with the same idempotency key later.
 */
public class ServiceUnavailableException extends BusinessException {

    public ServiceUnavailableException(String message) {
        super(ErrorCode.SERVICE_UNAVAILABLE, message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(ErrorCode.SERVICE_UNAVAILABLE, message, cause);
    }
}
