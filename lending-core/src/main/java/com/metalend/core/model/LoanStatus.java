package com.metalend.core.model;

public enum LoanStatus {
    ACTIVE,
    REPAID,
    LIQUIDATED
}
