package com.metalend.core.exception;

public class LendingException extends RuntimeException {

    private final ErrorCode errorCode;

    public LendingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LendingException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public ErrorCode.Category getCategory() {
        return errorCode.getCategory();
    }
}
