package com.parkezy.common.exception;

/**
 * A persisted record failed validation on read (missing required field, broken invariant,
 * unknown schema version). Treated as data corruption; never retried.
 */
public class InvalidDataException extends BusinessException {
    public InvalidDataException(String resourceType, Object identifier, String detail) {
        super(ErrorCode.INVALID_DATA,
                String.format("Invalid %s data for identifier %s: %s", resourceType, identifier, detail));
    }
}
