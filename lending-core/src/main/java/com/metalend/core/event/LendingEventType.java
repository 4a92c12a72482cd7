package com.metalend.core.event;

public enum LendingEventType {
    ASSET_CLASS_SUPPORT_CHANGED,
    FLOOR_PRICE_UPDATED,
    SPOT_PRICE_UPDATED,
    REFERENCE_RATE_UPDATED,

    COLLATERAL_DEPOSITED,
    COLLATERAL_WITHDRAWN,
    COLLATERAL_FORCE_CLOSED,
    COLLATERAL_REVALUED,
    COLLATERAL_ENCUMBERED,
    COLLATERAL_RELEASED,
    LOAN_TO_VALUE_UPDATED,

    LIQUIDITY_PROVIDED,
    LIQUIDITY_WITHDRAWN,
    LOAN_ORIGINATED,
    LOAN_REPAID,
    LOAN_LIQUIDATED,
    RATE_MODEL_UPDATED,
    RESERVE_FACTOR_UPDATED,

    LIQUIDATION_TRIGGERED,
    LIQUIDATION_EXECUTED,
    LIQUIDATION_CANCELLED,
    LIQUIDATION_PARAMETERS_UPDATED,

    ASSET_CLASS_ALLOWED_CHANGED
}
