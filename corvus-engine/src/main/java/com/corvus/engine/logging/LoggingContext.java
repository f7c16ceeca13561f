package com.corvus.engine.logging;

import com.corvus.core.model.OperationType;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper that tags every log line written during a task's execution.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(taskId, OperationType.COPY)) {
 *     log.info("Copying"); // includes taskId, operation and traceId
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [corvus-task-3] INFO  c.c.e.e.OperationRunner - Task completed
 *   taskId=5b1c... operation=copy traceId=9f2e41aa
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String OPERATION = "operation";
    public static final String TRACE_ID = "traceId";

    private final boolean ownsTraceId;

    private LoggingContext(boolean ownsTraceId) {
        this.ownsTraceId = ownsTraceId;
    }

    /**
     * Create a logging context for one task execution.
     */
    public static LoggingContext forTask(UUID taskId, OperationType operation) {
        if (taskId != null) {
            MDC.put(TASK_ID, taskId.toString());
        }
        if (operation != null) {
            MDC.put(OPERATION, operation.tag());
        }
        return new LoggingContext(ensureTraceId());
    }

    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    public static String getOperation() {
        return MDC.get(OPERATION);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    /**
     * @return true if a new trace id was generated for this context
     */
    private static boolean ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
            return true;
        }
        return false;
    }

    @Override
    public void close() {
        MDC.remove(TASK_ID);
        MDC.remove(OPERATION);
        // Pool threads are reused; only drop a trace id this context created
        if (ownsTraceId) {
            MDC.remove(TRACE_ID);
        }
    }
}
