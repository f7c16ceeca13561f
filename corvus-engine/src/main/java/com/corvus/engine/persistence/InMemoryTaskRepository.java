package com.corvus.engine.persistence;

import com.corvus.core.model.Task;
import com.corvus.core.repository.TaskRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of TaskRepository.
 * Tasks live for the lifetime of the process and are never removed.
 *
 * Snapshot reads share the read lock; appends, dispatch claims and status
 * updates take the write lock one at a time.
 */
public class InMemoryTaskRepository implements TaskRepository {

    private final List<Task> tasks = new ArrayList<>();
    private final Map<UUID, Integer> positions = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void save(Task task) {
        lock.writeLock().lock();
        try {
            if (positions.containsKey(task.taskId())) {
                throw new IllegalArgumentException("Task already registered: " + task.taskId());
            }
            positions.put(task.taskId(), tasks.size());
            tasks.add(task);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Task> findById(UUID taskId) {
        lock.readLock().lock();
        try {
            Integer position = positions.get(taskId);
            return position == null ? Optional.empty() : Optional.of(tasks.get(position));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Task> findAll() {
        lock.readLock().lock();
        try {
            return List.copyOf(tasks);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Task> claimPending(Instant now) {
        lock.writeLock().lock();
        try {
            List<Task> claimed = new ArrayList<>();
            for (int i = 0; i < tasks.size(); i++) {
                Task task = tasks.get(i);
                if (task.state().isDispatchable()) {
                    Task dispatched = task.withDispatched(now);
                    tasks.set(i, dispatched);
                    claimed.add(dispatched);
                }
            }
            return claimed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Task> update(UUID taskId, UnaryOperator<Task> updater) {
        lock.writeLock().lock();
        try {
            Integer position = positions.get(taskId);
            if (position == null) {
                return Optional.empty();
            }
            Task updated = updater.apply(tasks.get(position));
            if (!updated.taskId().equals(taskId)) {
                throw new IllegalStateException("Updater changed task identity: " + taskId);
            }
            tasks.set(position, updated);
            return Optional.of(updated);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int count() {
        lock.readLock().lock();
        try {
            return tasks.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
