package com.corvus.engine.metrics;

import com.corvus.core.model.OperationType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for background task execution.
 *
 * Metrics exposed:
 * - Tasks submitted, dispatched, completed and failed, by operation
 * - Task duration by operation and outcome
 * - Tasks currently executing
 */
public class TaskMetrics {

    public static final String TASKS_SUBMITTED = "corvus.tasks.submitted";
    public static final String TASKS_DISPATCHED = "corvus.tasks.dispatched";
    public static final String TASKS_COMPLETED = "corvus.tasks.completed";
    public static final String TASKS_FAILED = "corvus.tasks.failed";
    public static final String TASK_DURATION = "corvus.task.duration";
    public static final String TASKS_IN_FLIGHT = "corvus.tasks.in_flight";

    private final MeterRegistry registry;
    private final AtomicInteger inFlight = new AtomicInteger(0);

    public TaskMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(TASKS_IN_FLIGHT, inFlight, AtomicInteger::get)
            .description("Tasks currently executing")
            .register(registry);
    }

    public void taskSubmitted(OperationType operation) {
        counter(TASKS_SUBMITTED, operation, "Total tasks submitted").increment();
    }

    public void taskDispatched(OperationType operation) {
        counter(TASKS_DISPATCHED, operation, "Total tasks handed to an executor").increment();
        inFlight.incrementAndGet();
    }

    public void taskCompleted(OperationType operation, Duration duration) {
        counter(TASKS_COMPLETED, operation, "Total tasks completed successfully").increment();
        recordDuration(operation, "success", duration);
        finished();
    }

    public void taskFailed(OperationType operation, Duration duration) {
        counter(TASKS_FAILED, operation, "Total tasks failed").increment();
        recordDuration(operation, "failure", duration);
        finished();
    }

    public int inFlight() {
        return inFlight.get();
    }

    private Counter counter(String name, OperationType operation, String description) {
        return Counter.builder(name)
            .tag("operation", operation.tag())
            .description(description)
            .register(registry);
    }

    private void recordDuration(OperationType operation, String outcome, Duration duration) {
        Timer.builder(TASK_DURATION)
            .tag("operation", operation.tag())
            .tag("outcome", outcome)
            .description("Task execution duration")
            .register(registry)
            .record(duration);
    }

    private void finished() {
        inFlight.updateAndGet(v -> Math.max(0, v - 1));
    }
}
