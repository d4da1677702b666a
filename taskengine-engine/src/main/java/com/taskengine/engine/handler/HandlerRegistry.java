package com.taskengine.engine.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup of task handlers by task type.
 */
public class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, TaskHandler> handlers = new HashMap<>();

    public HandlerRegistry(Collection<? extends TaskHandler> handlers) {
        for (TaskHandler handler : handlers) {
            TaskHandler existing = this.handlers.putIfAbsent(handler.type(), handler);
            if (existing != null) {
                throw new IllegalStateException(String.format(
                    "Duplicate handler for task type '%s': %s and %s",
                    handler.type(), existing.getClass().getName(), handler.getClass().getName()));
            }
        }
        log.info("Registered {} task handlers: {}", this.handlers.size(), this.handlers.keySet());
    }

    public Optional<TaskHandler> find(String type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public Set<String> types() {
        return Set.copyOf(handlers.keySet());
    }
}
