package com.metalend.core.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metalend.core.config.LendingProperties;
import com.metalend.core.service.LendingMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the most recent committed events and writes each one to the audit log as JSON.
 */
@Slf4j
@Component
public class LendingEventJournal {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final LendingMetricsService metrics;
    private final int capacity;
    private final Deque<LendingEvent> recent = new ArrayDeque<>();

    public LendingEventJournal(LendingProperties properties, LendingMetricsService metrics) {
        this.metrics = metrics;
        this.capacity = properties.getEvents().getJournalCapacity();
    }

    @EventListener
    public void onEvent(LendingEvent event) {
        synchronized (recent) {
            if (recent.size() >= capacity) {
                recent.removeFirst();
            }
            recent.addLast(event);
        }
        metrics.recordEvent(event.type());
        log.info("Lending event {}", toJson(event));
    }

    public List<LendingEvent> recent() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }

    public List<LendingEvent> recent(LendingEventType type) {
        return recent().stream().filter(event -> event.type() == type).toList();
    }

    String toJson(LendingEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", event.type().name());
        payload.put("subject", event.subjectId());
        payload.put("party", event.party());
        payload.put("amounts", event.amounts());
        payload.put("timestamp", String.valueOf(event.timestamp()));
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize lending event {}:{} - {}", event.type(), event.subjectId(), e.getMessage());
            return event.type() + ":" + event.subjectId();
        }
    }
}
