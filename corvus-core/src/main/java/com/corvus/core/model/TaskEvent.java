package com.corvus.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * A progress event tagged with the task that produced it.
 */
public record TaskEvent(UUID taskId, ProgressEvent event) {

    public TaskEvent {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(event, "event");
    }
}
