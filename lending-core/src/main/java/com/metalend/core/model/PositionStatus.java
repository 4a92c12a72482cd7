package com.metalend.core.model;

/**
 * Collateral position lifecycle.
 * ACTIVE is the only state that holds custody; both exits are terminal.
 */
public enum PositionStatus {
    ACTIVE,      // Asset in custody, may back a loan
    WITHDRAWN,   // Returned to its owner
    LIQUIDATED;  // Custody moved to a liquidator

    public boolean canTransitionTo(PositionStatus target) {
        return this == ACTIVE && target != null && target != ACTIVE;
    }
}
