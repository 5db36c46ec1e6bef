package com.parkezy.common.exception;

public class AccessDeniedException extends BusinessException {
    public AccessDeniedException(String message) {
        super(ErrorCode.ACCESS_DENIED, message);
    }
}
