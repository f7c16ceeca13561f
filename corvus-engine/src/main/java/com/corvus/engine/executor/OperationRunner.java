package com.corvus.engine.executor;

import com.corvus.core.exception.OperationException;
import com.corvus.core.model.OperationType;
import com.corvus.core.model.ProgressEvent;
import com.corvus.core.model.Task;
import com.corvus.engine.channel.ProgressChannel;
import com.corvus.engine.logging.LoggingContext;
import com.corvus.engine.metrics.TaskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;

/**
 * Executes one claimed task on a pool thread and reports its outcome.
 *
 * Exactly one terminal event is sent per run: COMPLETED on success, ERROR(reason)
 * for an operation failure or any unexpected runtime exception. Failures never
 * propagate past {@link #run()}.
 */
public class OperationRunner implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(OperationRunner.class);

    static final String UNEXPECTED_TERMINATION = "Executor terminated unexpectedly";

    private final UUID taskId;
    private final OperationType type;
    private final Operation operation;
    private final ProgressChannel.Sender sender;
    private final TaskMetrics metrics;

    public OperationRunner(Task task, Operation operation, ProgressChannel.Sender sender, TaskMetrics metrics) {
        this.taskId = task.taskId();
        this.type = task.type();
        this.operation = operation;
        this.sender = sender;
        this.metrics = metrics;
    }

    @Override
    public void run() {
        long started = System.nanoTime();
        boolean reported = false;
        try (var ctx = LoggingContext.forTask(taskId, type)) {
            log.debug("Executing task");
            try {
                operation.perform();
                log.info("Task completed");
                metrics.taskCompleted(type, elapsedSince(started));
                reported = true;
                sender.send(ProgressEvent.completed());
            } catch (OperationException e) {
                log.warn("Task failed: {} - {}", e.getErrorCode(), e.getMessage());
                reported = true;
                fail(started, reasonOf(e));
            } catch (RuntimeException e) {
                log.error("Task failed with unexpected error", e);
                reported = true;
                fail(started, reasonOf(e));
            } finally {
                if (!reported) {
                    log.error("Task ended without reporting an outcome");
                    fail(started, UNEXPECTED_TERMINATION);
                }
            }
        }
    }

    private void fail(long started, String reason) {
        metrics.taskFailed(type, elapsedSince(started));
        sender.send(ProgressEvent.error(reason));
    }

    private static String reasonOf(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
