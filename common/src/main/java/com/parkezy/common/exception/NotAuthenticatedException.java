package com.parkezy.common.exception;

public class NotAuthenticatedException extends BusinessException {
    public NotAuthenticatedException() {
        super(ErrorCode.NOT_AUTHENTICATED, "User is not authenticated");
    }
}
