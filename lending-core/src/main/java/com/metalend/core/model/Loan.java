package com.metalend.core.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class Loan {

    Long id;
    String borrower;
    Long positionId;
    BigDecimal principal;
    BigDecimal rate;
    Instant originatedAt;
    Instant maturesAt;
    BigDecimal principalRepaid;
    BigDecimal interestRepaid;
    BigDecimal totalRepaid;
    LoanStatus status;
    Instant closedAt;

    public boolean isActive() {
        return status == LoanStatus.ACTIVE;
    }

    /** Interest stops accruing once the loan is closed. */
    public Instant accrualEnd(Instant now) {
        return closedAt != null ? closedAt : now;
    }
}
