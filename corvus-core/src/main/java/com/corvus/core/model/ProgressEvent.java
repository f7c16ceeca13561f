package com.corvus.core.model;

import java.util.Objects;

/**
 * Transient notification sent by an executor. Never stored.
 */
public record ProgressEvent(
    Type type,
    float progress,
    String message
) {
    /**
     * Kinds of progress notifications.
     */
    public enum Type {
        /** Intermediate progress; the task stays IN_PROGRESS. */
        UPDATE,
        /** Terminal success. */
        COMPLETED,
        /** Terminal failure; {@code message} holds the reason. */
        ERROR
    }

    private static final ProgressEvent COMPLETED = new ProgressEvent(Type.COMPLETED, 1.0f, null);

    public ProgressEvent {
        Objects.requireNonNull(type, "type");
        if (type == Type.ERROR) {
            Objects.requireNonNull(message, "message");
        }
    }

    public static ProgressEvent update(float progress) {
        return new ProgressEvent(Type.UPDATE, progress, null);
    }

    public static ProgressEvent completed() {
        return COMPLETED;
    }

    public static ProgressEvent error(String message) {
        return new ProgressEvent(Type.ERROR, 0.0f, message);
    }

    public boolean isTerminal() {
        return type != Type.UPDATE;
    }

    /**
     * The status a task moves to when this event is applied.
     */
    public TaskStatus toStatus() {
        return switch (type) {
            case UPDATE -> TaskStatus.inProgress(progress);
            case COMPLETED -> TaskStatus.completed();
            case ERROR -> TaskStatus.failed(message);
        };
    }
}
