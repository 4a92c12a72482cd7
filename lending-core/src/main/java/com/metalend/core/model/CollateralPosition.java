package com.metalend.core.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class CollateralPosition {

    Long id;
    AssetRef asset;
    String owner;
    BigDecimal valueAtDeposit;
    BigDecimal loanToValueBound;
    PositionStatus status;
    Instant depositedAt;
    Instant closedAt;

    /** Loan currently backed by this position, null when unencumbered. */
    Long linkedLoanId;

    BigDecimal markedValue;
    Instant markedAt;

    public boolean isActive() {
        return status == PositionStatus.ACTIVE;
    }

    public boolean isEncumbered() {
        return linkedLoanId != null;
    }
}
