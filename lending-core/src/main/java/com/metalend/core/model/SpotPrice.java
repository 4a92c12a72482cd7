package com.metalend.core.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

public record SpotPrice(BigDecimal price, Instant updatedAt) {

    public boolean isValidAt(Instant now, Duration validity) {
        return !now.isAfter(updatedAt.plus(validity));
    }
}
