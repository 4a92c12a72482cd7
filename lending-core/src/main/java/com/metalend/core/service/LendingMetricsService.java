package com.metalend.core.service;

import com.metalend.core.event.LendingEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LendingMetricsService {

    static final String EVENTS_TOTAL = "metalend_events_total";

    private final MeterRegistry meterRegistry;

    public void recordEvent(LendingEventType type) {
        Counter.builder(EVENTS_TOTAL)
                .tag("type", type.name())
                .register(meterRegistry)
                .increment();
    }

    public double eventCount(LendingEventType type) {
        Counter counter = meterRegistry.find(EVENTS_TOTAL).tag("type", type.name()).counter();
        return counter == null ? 0.0 : counter.count();
    }
}
