package com.metalend.core.support;

import com.metalend.core.event.LendingEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Undo log and pending events of one top-level operation. Every mutation registers its inverse;
 * events stay buffered until {@link OperationTemplate} commits the scope.
 */
@Slf4j
public final class OperationScope {

    private final String name;
    private final Deque<Runnable> undoSteps = new ArrayDeque<>();
    private final List<LendingEvent> pendingEvents = new ArrayList<>();

    OperationScope(String name) {
        this.name = name;
    }

    public void onRollback(Runnable undo) {
        undoSteps.push(undo);
    }

    public void publish(LendingEvent event) {
        pendingEvents.add(event);
    }

    List<LendingEvent> pendingEvents() {
        return List.copyOf(pendingEvents);
    }

    void rollback(RuntimeException cause) {
        int steps = undoSteps.size();
        while (!undoSteps.isEmpty()) {
            Runnable undo = undoSteps.pop();
            try {
                undo.run();
            } catch (RuntimeException undoFailure) {
                cause.addSuppressed(undoFailure);
                log.error("Undo step failed operation={} error={}", name, undoFailure.getMessage());
            }
        }
        pendingEvents.clear();
        log.debug("Operation rolled back operation={} undoSteps={}", name, steps);
    }
}
