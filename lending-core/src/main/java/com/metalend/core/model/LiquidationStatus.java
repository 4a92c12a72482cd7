package com.metalend.core.model;

public enum LiquidationStatus {
    TRIGGERED,
    EXECUTED,
    CANCELLED
}
