package com.metalend.core.exception;

public class TransferFailedException extends LendingException {
    public TransferFailedException(String message) {
        super(ErrorCode.TRANSFER_FAILED, message);
    }

    public TransferFailedException(String message, Throwable cause) {
        super(ErrorCode.TRANSFER_FAILED, message, cause);
    }
}
