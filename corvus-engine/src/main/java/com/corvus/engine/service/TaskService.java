package com.corvus.engine.service;

import com.corvus.core.model.Task;
import com.corvus.core.model.TaskKind;
import com.corvus.core.request.TaskRequest;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for background task management.
 * Producers submit tasks; a UI loop dispatches them and a single consumer applies
 * the progress events executors send back.
 */
public interface TaskService {

    /**
     * Register a new task in PENDING state.
     *
     * @param kind The operation and its operands
     * @param description Human-readable label
     * @return The new task's ID
     */
    UUID addTask(TaskKind kind, String description);

    /**
     * Register a prepared request.
     */
    default UUID submit(TaskRequest request) {
        return addTask(request.kind(), request.description());
    }

    /**
     * Point-in-time snapshot of all tasks in submission order.
     */
    List<Task> getTasks();

    /**
     * Snapshot of a single task.
     */
    Optional<Task> getTask(UUID taskId);

    /**
     * Launch an executor for every PENDING task.
     *
     * @return Number of tasks dispatched by this call
     */
    int processPendingTasks();

    /**
     * Block for one progress event and apply it.
     *
     * @return true only if the event was a COMPLETED event for a known task
     */
    boolean waitForEvent() throws InterruptedException;

    /**
     * Block for one progress event, apply it, and report what happened.
     */
    AppliedEvent awaitEvent() throws InterruptedException;

    /**
     * Like {@link #awaitEvent()} but gives up after {@code timeout}.
     *
     * @return The applied event, or empty if none arrived in time
     */
    Optional<AppliedEvent> pollEvent(Duration timeout) throws InterruptedException;
}
