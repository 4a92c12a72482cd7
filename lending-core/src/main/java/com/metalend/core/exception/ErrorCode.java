package com.metalend.core.exception;

public enum ErrorCode {
    INVALID_AMOUNT(Category.VALIDATION),
    INVALID_PRICE(Category.VALIDATION),
    INVALID_DURATION(Category.VALIDATION),
    INVALID_PARAMETER(Category.VALIDATION),
    INVALID_ASSET(Category.VALIDATION),
    UNSUPPORTED_ASSET_CLASS(Category.VALIDATION),
    ASSET_CLASS_NOT_ALLOWED(Category.VALIDATION),
    BATCH_LENGTH_MISMATCH(Category.VALIDATION),

    DEVIATION_EXCEEDED(Category.PRECONDITION),
    PRICE_UNAVAILABLE(Category.PRECONDITION),
    ALREADY_PLEDGED(Category.PRECONDITION),
    EXCEEDS_LOAN_TO_VALUE(Category.PRECONDITION),
    POSITION_NOT_FOUND(Category.PRECONDITION),
    POSITION_NOT_ACTIVE(Category.PRECONDITION),
    POSITION_ENCUMBERED(Category.PRECONDITION),
    NOT_OWNER(Category.PRECONDITION),
    INSUFFICIENT_SHARES(Category.PRECONDITION),
    INSUFFICIENT_AVAILABLE_LIQUIDITY(Category.PRECONDITION),
    INSUFFICIENT_LIQUIDITY(Category.PRECONDITION),
    LOAN_NOT_FOUND(Category.PRECONDITION),
    LOAN_NOT_ACTIVE(Category.PRECONDITION),
    NOT_BORROWER(Category.PRECONDITION),
    NOT_ELIGIBLE(Category.PRECONDITION),
    NOT_TRIGGERED(Category.PRECONDITION),
    DELAY_NOT_ELAPSED(Category.PRECONDITION),
    ALREADY_LIQUIDATED(Category.PRECONDITION),
    TRANSFER_FAILED(Category.PRECONDITION),

    UNAUTHORIZED(Category.AUTHORIZATION);

    private final Category category;

    ErrorCode(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Validation errors are caller-correctable, precondition errors are retryable once state
     * changes, authorization errors are not retryable by the same caller.
     */
    public enum Category {
        VALIDATION,
        PRECONDITION,
        AUTHORIZATION
    }
}
