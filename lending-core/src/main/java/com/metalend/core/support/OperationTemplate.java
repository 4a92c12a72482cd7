package com.metalend.core.support;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs an entry point as one all-or-nothing operation. Nested calls join the outermost scope, so a
 * failure anywhere undoes every effect of the call and no event of it is published.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OperationTemplate {

    private final ApplicationEventPublisher eventPublisher;
    private final ThreadLocal<OperationScope> current = new ThreadLocal<>();

    public <T> T execute(String name, Function<OperationScope, T> body) {
        OperationScope outer = current.get();
        if (outer != null) {
            return body.apply(outer);
        }
        OperationScope scope = new OperationScope(name);
        current.set(scope);
        T result;
        try {
            result = body.apply(scope);
        } catch (RuntimeException ex) {
            scope.rollback(ex);
            log.info("Operation rejected operation={} reason={}", name, ex.getMessage());
            throw ex;
        } finally {
            current.remove();
        }
        scope.pendingEvents().forEach(eventPublisher::publishEvent);
        return result;
    }

    public void run(String name, Consumer<OperationScope> body) {
        execute(name, scope -> {
            body.accept(scope);
            return null;
        });
    }

    public boolean inOperation() {
        return current.get() != null;
    }
}
