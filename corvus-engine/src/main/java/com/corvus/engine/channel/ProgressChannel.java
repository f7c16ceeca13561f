package com.corvus.engine.channel;

import com.corvus.core.model.ProgressEvent;
import com.corvus.core.model.TaskEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Ordered conduit carrying task events from executors back to the manager.
 * Many executors send; exactly one consumer receives. Events are delivered in send order.
 *
 * The queue is bounded: a sender blocks while it is full, so a slow consumer
 * applies back-pressure to executors instead of losing events. Terminal events
 * are delivered even if the sending thread is interrupted while waiting.
 */
public class ProgressChannel {

    private static final Logger log = LoggerFactory.getLogger(ProgressChannel.class);

    public static final int DEFAULT_CAPACITY = 100;

    private final BlockingQueue<TaskEvent> queue;

    public ProgressChannel() {
        this(DEFAULT_CAPACITY);
    }

    public ProgressChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * Write end bound to one task. This is all an executor gets to see of the engine.
     */
    public Sender sender(UUID taskId) {
        Objects.requireNonNull(taskId, "taskId");
        return event -> send(taskId, event);
    }

    /**
     * Enqueue an event, waiting for space if the channel is full.
     * An interrupt drops a progress update but not a terminal event; the interrupt
     * status is restored before returning either way.
     *
     * @return false if the sending thread was interrupted and the update was dropped
     */
    public boolean send(UUID taskId, ProgressEvent event) {
        TaskEvent taskEvent = new TaskEvent(taskId, event);
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    queue.put(taskEvent);
                    return true;
                } catch (InterruptedException e) {
                    interrupted = true;
                    if (!event.isTerminal()) {
                        log.warn("Interrupted while sending {} for task {}; event dropped", event.type(), taskId);
                        return false;
                    }
                    log.warn("Interrupted while sending {} for task {}; waiting for space", event.type(), taskId);
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Enqueue an event only if there is space right now.
     *
     * @return false if the channel was full
     */
    public boolean trySend(UUID taskId, ProgressEvent event) {
        return queue.offer(new TaskEvent(taskId, event));
    }

    /**
     * Wait for the next event.
     */
    public TaskEvent receive() throws InterruptedException {
        return queue.take();
    }

    /**
     * Wait up to {@code timeout} for the next event.
     */
    public Optional<TaskEvent> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    /**
     * Number of events waiting to be consumed.
     */
    public int size() {
        return queue.size();
    }

    /**
     * Number of events that can be sent before senders start blocking.
     */
    public int remainingCapacity() {
        return queue.remainingCapacity();
    }

    /**
     * Write end of the channel for a single task.
     */
    @FunctionalInterface
    public interface Sender {

        /**
         * @return false if the event could not be delivered
         */
        boolean send(ProgressEvent event);
    }
}
