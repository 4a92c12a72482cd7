package com.metalend.core.exception;

public class UnauthorizedException extends LendingException {
    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
