package com.metalend.core.exception;

public class ValidationException extends LendingException {
    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
