package com.metalend.core.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class LiquidationRecord {

    Long positionId;
    Long loanId;
    BigDecimal debtSnapshot;
    BigDecimal valueSnapshot;
    BigDecimal bonus;
    LiquidationStatus status;
    String triggeredBy;
    Instant triggeredAt;
    String liquidator;
    Instant executedAt;

    public boolean isLive() {
        return status == LiquidationStatus.TRIGGERED;
    }

    public boolean isLiquidated() {
        return status == LiquidationStatus.EXECUTED;
    }

    public BigDecimal amountDue() {
        return debtSnapshot.add(bonus);
    }
}
