package com.metalend.core.model;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * @param threshold fraction of collateral value counted against debt for eligibility
 * @param bonusRate fraction of collateral value paid to the liquidator
 * @param delay     grace period between trigger and execution
 */
public record LiquidationParameters(BigDecimal threshold, BigDecimal bonusRate, Duration delay) {
}
