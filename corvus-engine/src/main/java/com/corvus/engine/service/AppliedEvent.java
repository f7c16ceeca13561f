package com.corvus.engine.service;

import com.corvus.core.model.ProgressEvent;
import com.corvus.core.model.Task;

import java.util.UUID;

/**
 * Result of consuming one progress event.
 *
 * @param taskId the task the event was addressed to
 * @param event the consumed event
 * @param task the task after the event was applied; null if no task has this ID
 *             or the event was dropped as an illegal transition
 */
public record AppliedEvent(
    UUID taskId,
    ProgressEvent event,
    Task task
) {
    public boolean isMatched() {
        return task != null;
    }

    /**
     * True when the event was a COMPLETED event addressed to a known task.
     */
    public boolean isCompleted() {
        return isMatched() && event.type() == ProgressEvent.Type.COMPLETED;
    }

    public boolean isFailed() {
        return isMatched() && event.type() == ProgressEvent.Type.ERROR;
    }
}
