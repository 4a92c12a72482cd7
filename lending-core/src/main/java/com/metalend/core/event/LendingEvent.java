package com.metalend.core.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Structured record of one committed mutation. Published only after the surrounding operation commits.
 */
public record LendingEvent(
        LendingEventType type,
        String subjectId,
        String party,
        Map<String, BigDecimal> amounts,
        Instant timestamp
) {

    public LendingEvent {
        amounts = amounts == null ? Map.of() : Map.copyOf(amounts);
    }

    public static LendingEvent of(LendingEventType type, Object subjectId, String party, Instant timestamp) {
        return new LendingEvent(type, String.valueOf(subjectId), party, Map.of(), timestamp);
    }

    public static LendingEvent of(LendingEventType type, Object subjectId, String party, Instant timestamp,
                                  Map<String, BigDecimal> amounts) {
        return new LendingEvent(type, String.valueOf(subjectId), party, amounts, timestamp);
    }
}
