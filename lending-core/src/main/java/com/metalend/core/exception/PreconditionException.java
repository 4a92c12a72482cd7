package com.metalend.core.exception;

public class PreconditionException extends LendingException {
    public PreconditionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
