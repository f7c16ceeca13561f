package com.corvus.core.model;

/**
 * Lifecycle states for a background task.
 */
public enum TaskState {
    /**
     * Task is registered and waiting for the next dispatch pass.
     * Transitions: -> IN_PROGRESS
     */
    PENDING,

    /**
     * Task has been handed to an executor.
     * Transitions: -> IN_PROGRESS (progress update), COMPLETED, FAILED
     */
    IN_PROGRESS,

    /**
     * Operation finished successfully. Terminal state.
     */
    COMPLETED,

    /**
     * Operation failed; the reason is kept for display. Terminal state.
     * Failed tasks are never retried automatically.
     */
    FAILED;

    /**
     * Check if this state is terminal (no further transitions).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Check if a task in this state may be picked up by the dispatcher.
     */
    public boolean isDispatchable() {
        return this == PENDING;
    }

    /**
     * Check if the state machine allows moving from this state to {@code target}.
     */
    public boolean canTransitionTo(TaskState target) {
        return switch (this) {
            case PENDING -> target == IN_PROGRESS;
            case IN_PROGRESS -> target == IN_PROGRESS || target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
