package com.parkezy.common.exception;

/**
 * Referenced booking, facility, listing, slot or user does not exist. Never retried.
 */
public class ResourceNotFoundException extends BusinessException {
    public ResourceNotFoundException(String message) {
        super(ErrorCode.RESOURCE_NOT_FOUND, message);
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(ErrorCode.RESOURCE_NOT_FOUND,
                String.format("%s with identifier %s not found", resourceType, identifier));
    }
}
