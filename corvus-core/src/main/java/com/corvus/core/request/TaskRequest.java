package com.corvus.core.request;

import com.corvus.core.model.TaskKind;

import java.util.Objects;

/**
 * A task kind paired with the label shown in the task list.
 */
public record TaskRequest(TaskKind kind, String description) {

    public TaskRequest {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(description, "description");
    }
}
