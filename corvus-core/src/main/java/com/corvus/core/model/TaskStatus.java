package com.corvus.core.model;

import java.util.Objects;

/**
 * Current status of a task: its state plus the state-specific payload.
 *
 * Invariants:
 * - progress in [0.0, 1.0], meaningful only while IN_PROGRESS
 * - failureReason set iff state == FAILED
 */
public record TaskStatus(
    TaskState state,
    float progress,
    String failureReason
) {
    private static final TaskStatus PENDING = new TaskStatus(TaskState.PENDING, 0.0f, null);
    private static final TaskStatus COMPLETED = new TaskStatus(TaskState.COMPLETED, 1.0f, null);

    public TaskStatus {
        Objects.requireNonNull(state, "state");
        if (Float.isNaN(progress) || progress < 0.0f || progress > 1.0f) {
            throw new IllegalArgumentException("progress must be in [0.0, 1.0]: " + progress);
        }
        if (state == TaskState.FAILED) {
            Objects.requireNonNull(failureReason, "failureReason");
        } else if (failureReason != null) {
            throw new IllegalArgumentException("failureReason is only allowed for FAILED status");
        }
    }

    public static TaskStatus pending() {
        return PENDING;
    }

    public static TaskStatus inProgress(float progress) {
        return new TaskStatus(TaskState.IN_PROGRESS, progress, null);
    }

    public static TaskStatus completed() {
        return COMPLETED;
    }

    public static TaskStatus failed(String reason) {
        return new TaskStatus(TaskState.FAILED, 0.0f, reason);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    @Override
    public String toString() {
        return switch (state) {
            case PENDING -> "Pending";
            case IN_PROGRESS -> String.format("InProgress(%.0f%%)", progress * 100);
            case COMPLETED -> "Completed";
            case FAILED -> "Failed(" + failureReason + ")";
        };
    }
}
