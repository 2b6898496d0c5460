package com.umitunal.cronlite.task;

import com.umitunal.cronlite.core.JobType;
import com.umitunal.cronlite.core.UnregisteredHandlerException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable mapping from job type to the handler that runs it.
 */
public final class TaskRegistry {
    private final Map<JobType, TaskHandler> handlers;

    private TaskRegistry(Map<JobType, TaskHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(new EnumMap<>(handlers));
    }

    /**
     * @throws UnregisteredHandlerException if the type has no handler
     */
    public TaskHandler handlerFor(JobType type) {
        TaskHandler handler = handlers.get(type);
        if (handler == null) {
            throw new UnregisteredHandlerException(type);
        }
        return handler;
    }

    public boolean isRegistered(JobType type) {
        return handlers.containsKey(type);
    }

    public Set<JobType> registeredTypes() {
        return handlers.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "TaskRegistry" + handlers.keySet();
    }

    public static class Builder {
        private final Map<JobType, TaskHandler> handlers = new EnumMap<>(JobType.class);

        private Builder() {
        }

        /**
         * @throws IllegalStateException if the type already has a handler
         */
        public Builder register(JobType type, TaskHandler handler) {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(handler, "handler");
            if (handlers.putIfAbsent(type, handler) != null) {
                throw new IllegalStateException("Handler already registered for job type: " + type);
            }
            return this;
        }

        public TaskRegistry build() {
            return new TaskRegistry(handlers);
        }
    }
}
