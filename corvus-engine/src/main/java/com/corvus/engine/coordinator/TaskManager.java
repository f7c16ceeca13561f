package com.corvus.engine.coordinator;

import com.corvus.core.exception.InvalidStateTransitionException;
import com.corvus.core.model.ProgressEvent;
import com.corvus.core.model.Task;
import com.corvus.core.model.TaskEvent;
import com.corvus.core.model.TaskKind;
import com.corvus.core.model.TaskStatus;
import com.corvus.core.repository.TaskRepository;
import com.corvus.engine.channel.ProgressChannel;
import com.corvus.engine.executor.OperationDispatcher;
import com.corvus.engine.executor.OperationRunner;
import com.corvus.engine.metrics.TaskMetrics;
import com.corvus.engine.service.AppliedEvent;
import com.corvus.engine.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Owns the task registry and the receiving end of the progress channel.
 *
 * Threading model:
 * - any thread may add tasks and read snapshots
 * - {@link #processPendingTasks()} is driven by the UI tick loop
 * - exactly one thread consumes events via {@link #awaitEvent()} / {@link #waitForEvent()}
 * - executors run on the pool and only talk back through the channel
 *
 * The manager never fails on behalf of a task; operation failures end up as FAILED status.
 */
public class TaskManager implements TaskService, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskManager.class);

    static final String EXECUTOR_UNAVAILABLE = "Task executor is shut down";

    private final TaskRepository repository;
    private final ProgressChannel channel;
    private final OperationDispatcher dispatcher;
    private final ExecutorService executor;
    private final TaskMetrics metrics;
    private final Duration shutdownTimeout;

    public TaskManager(
            TaskRepository repository,
            ProgressChannel channel,
            OperationDispatcher dispatcher,
            ExecutorService executor,
            TaskMetrics metrics,
            Duration shutdownTimeout) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    }

    @Override
    public UUID addTask(TaskKind kind, String description) {
        Task task = Task.create(kind, description);
        repository.save(task);
        metrics.taskSubmitted(task.type());
        log.info("Submitted task {} ({}): {}", task.taskId(), task.type().tag(), description);
        return task.taskId();
    }

    @Override
    public List<Task> getTasks() {
        return repository.findAll();
    }

    @Override
    public Optional<Task> getTask(UUID taskId) {
        return repository.findById(taskId);
    }

    @Override
    public int processPendingTasks() {
        List<Task> claimed = repository.claimPending(Instant.now());
        for (Task task : claimed) {
            dispatch(task);
        }
        if (!claimed.isEmpty()) {
            log.info("Dispatched {} task(s)", claimed.size());
        }
        return claimed.size();
    }

    private void dispatch(Task task) {
        ProgressChannel.Sender sender = channel.sender(task.taskId());
        OperationRunner runner = new OperationRunner(task, dispatcher.resolve(task.kind()), sender, metrics);
        metrics.taskDispatched(task.type());
        try {
            executor.execute(runner);
            log.debug("Dispatched task {} ({})", task.taskId(), task.type().tag());
        } catch (RejectedExecutionException e) {
            log.error("Could not dispatch task {}: {}", task.taskId(), e.getMessage());
            metrics.taskFailed(task.type(), Duration.ZERO);
            if (!channel.trySend(task.taskId(), ProgressEvent.error(EXECUTOR_UNAVAILABLE))) {
                // channel full: record the failure directly rather than block the caller
                repository.update(task.taskId(),
                    t -> t.transitionTo(TaskStatus.failed(EXECUTOR_UNAVAILABLE), Instant.now()));
            }
        }
    }

    @Override
    public boolean waitForEvent() throws InterruptedException {
        return awaitEvent().isCompleted();
    }

    @Override
    public AppliedEvent awaitEvent() throws InterruptedException {
        return apply(channel.receive());
    }

    @Override
    public Optional<AppliedEvent> pollEvent(Duration timeout) throws InterruptedException {
        return channel.poll(timeout).map(this::apply);
    }

    private AppliedEvent apply(TaskEvent taskEvent) {
        UUID taskId = taskEvent.taskId();
        ProgressEvent event = taskEvent.event();
        Instant now = Instant.now();
        try {
            Optional<Task> updated = repository.update(taskId, task -> task.transitionTo(event.toStatus(), now));
            if (updated.isEmpty()) {
                log.debug("Ignoring {} event for unknown task {}", event.type(), taskId);
                return new AppliedEvent(taskId, event, null);
            }
            Task task = updated.get();
            log.debug("Task {} is now {}", taskId, task.status());
            return new AppliedEvent(taskId, event, task);
        } catch (InvalidStateTransitionException | IllegalArgumentException e) {
            log.warn("Dropping {} event for task {}: {}", event.type(), taskId, e.getMessage());
            return new AppliedEvent(taskId, event, null);
        }
    }

    /**
     * Stop accepting work and wait for running executors, up to the configured grace period.
     * Executors still running afterwards are interrupted.
     */
    @Override
    public void close() {
        log.info("Shutting down task executor ({} task(s) in flight)", metrics.inFlight());
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Executors still running after {}; interrupting", shutdownTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
