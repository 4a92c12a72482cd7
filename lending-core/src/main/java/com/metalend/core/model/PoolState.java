package com.metalend.core.model;

import com.metalend.core.util.MoneyUtils;

import java.math.BigDecimal;

/**
 * Aggregate pool accounting. {@code totalLiquidity - totalBorrowed} is what can be lent or withdrawn;
 * reserves are tracked outside of lender liquidity.
 */
public record PoolState(BigDecimal totalLiquidity,
                        BigDecimal totalBorrowed,
                        BigDecimal totalReserves,
                        BigDecimal totalShares) {

    public static PoolState empty() {
        return new PoolState(MoneyUtils.ZERO, MoneyUtils.ZERO, MoneyUtils.ZERO, MoneyUtils.ZERO);
    }

    public BigDecimal available() {
        return MoneyUtils.subtract(totalLiquidity, totalBorrowed);
    }

    public BigDecimal utilization() {
        return MoneyUtils.ratio(totalBorrowed, totalLiquidity);
    }

    public PoolState withLiquidity(BigDecimal liquidity, BigDecimal shares) {
        return new PoolState(MoneyUtils.scale(liquidity), totalBorrowed, totalReserves, MoneyUtils.scale(shares));
    }

    public PoolState withBorrowed(BigDecimal borrowed) {
        return new PoolState(totalLiquidity, MoneyUtils.scale(borrowed), totalReserves, totalShares);
    }

    public PoolState with(BigDecimal liquidity, BigDecimal borrowed, BigDecimal reserves) {
        return new PoolState(MoneyUtils.scale(liquidity), MoneyUtils.scale(borrowed), MoneyUtils.scale(reserves), totalShares);
    }
}
