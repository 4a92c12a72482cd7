package com.metalend.core.port;

public enum Role {
    ADMIN,
    PRICE_UPDATER,
    LENDING_POOL,
    LIQUIDATION_ENGINE
}
