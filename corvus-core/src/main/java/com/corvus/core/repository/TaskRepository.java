package com.corvus.core.repository;

import com.corvus.core.model.Task;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Ordered registry of submitted tasks.
 *
 * Implementations must make every write atomic with respect to snapshot reads,
 * so that no reader ever observes a half-applied status change.
 */
public interface TaskRepository {

    /**
     * Append a new task at the end of the registry.
     *
     * @param task The task to save
     * @throws IllegalArgumentException if a task with the same ID already exists
     */
    void save(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId The task ID
     * @return The task if found
     */
    Optional<Task> findById(UUID taskId);

    /**
     * Snapshot of all tasks in submission order.
     *
     * @return An immutable point-in-time copy
     */
    List<Task> findAll();

    /**
     * Atomically move every PENDING task to IN_PROGRESS(0.0).
     * A task is returned by at most one call, no matter how many callers race.
     *
     * @param now Dispatch timestamp recorded as the task's start time
     * @return The claimed tasks, in submission order
     */
    List<Task> claimPending(Instant now);

    /**
     * Atomically replace a task with the result of {@code updater}.
     *
     * @param taskId The task ID
     * @param updater Function producing the new snapshot from the current one
     * @return The updated task, or empty if no task has this ID
     */
    Optional<Task> update(UUID taskId, UnaryOperator<Task> updater);

    /**
     * Number of registered tasks.
     */
    int count();
}
