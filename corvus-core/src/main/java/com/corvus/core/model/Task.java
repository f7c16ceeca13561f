package com.corvus.core.model;

import com.corvus.core.exception.InvalidStateTransitionException;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A queued filesystem-mutation request.
 * Tasks are immutable snapshots; the registry swaps in a new record on every status change.
 *
 * Invariants:
 * - taskId, kind and description never change once assigned
 * - startedAt set once the task leaves PENDING
 * - finishedAt set iff status is terminal
 */
public record Task(
    UUID taskId,
    TaskKind kind,
    TaskStatus status,
    String description,

    // Timing
    Instant submittedAt,
    Instant startedAt,
    Instant finishedAt
) {
    public Task {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(submittedAt, "submittedAt");
    }

    /**
     * Create a new task in PENDING state with a fresh identifier.
     */
    public static Task create(TaskKind kind, String description) {
        return new Task(
            UUID.randomUUID(),
            kind,
            TaskStatus.pending(),
            description,
            Instant.now(),
            null,
            null
        );
    }

    public TaskState state() {
        return status.state();
    }

    public OperationType type() {
        return kind.type();
    }

    /**
     * Create a copy moved to {@code next}.
     *
     * @throws InvalidStateTransitionException if the state machine does not allow it
     */
    public Task transitionTo(TaskStatus next, Instant at) {
        if (!status.state().canTransitionTo(next.state())) {
            throw new InvalidStateTransitionException("Task", status.state().name(), next.state().name());
        }
        Instant started = startedAt != null ? startedAt : at;
        Instant finished = next.isTerminal() ? at : null;
        return new Task(taskId, kind, next, description, submittedAt, started, finished);
    }

    /**
     * Create a copy in IN_PROGRESS(0.0), as done when the dispatcher claims it.
     */
    public Task withDispatched(Instant at) {
        return transitionTo(TaskStatus.inProgress(0.0f), at);
    }
}
