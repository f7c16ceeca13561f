package com.corvus.examples;

import com.corvus.core.model.Task;
import com.corvus.core.model.TaskKind;
import com.corvus.core.request.TaskRequest;
import com.corvus.core.request.TaskRequests;
import com.corvus.core.request.TaskRequests.PasteMode;
import com.corvus.engine.service.AppliedEvent;
import com.corvus.engine.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Drives the task engine the way an interactive file manager does.
 *
 * Shows:
 * 1. Creating files and directories
 * 2. Pasting, renaming and changing permissions
 * 3. Archiving to zip and tar.gz, plus a failing delete
 * 4. Cleaning up the scratch directory
 *
 * A tick loop dispatches pending work while a separate consumer thread applies
 * progress events, mirroring a UI frame loop and its event select.
 */
@Component
public class FileOperationsDemo implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(FileOperationsDemo.class);

    private final TaskService taskService;
    private final DemoProperties properties;

    public FileOperationsDemo(TaskService taskService, DemoProperties properties) {
        this.taskService = taskService;
        this.properties = properties;
    }

    @Override
    public void run(String... args) throws Exception {
        Path scratch = Files.createTempDirectory("corvus-demo");
        Files.writeString(scratch.resolve("report.txt"), "quarterly numbers\n");
        Files.writeString(scratch.resolve("data.csv"), "id,value\n1,42\n");
        log.info("Scratch directory: {}", scratch);

        Thread consumer = new Thread(this::consumeEvents, "corvus-demo-events");
        consumer.setDaemon(true);
        consumer.start();
        try {
            Path backup = scratch.resolve("backup");

            phase("Create", List.of(
                TaskRequests.createDirectory(backup),
                TaskRequests.createFile(scratch.resolve("notes.txt"))));

            List<TaskRequest> organize = new ArrayList<>(TaskRequests.paste(
                List.of(scratch.resolve("report.txt"), scratch.resolve("data.csv")), backup, PasteMode.COPY));
            organize.add(TaskRequests.rename(scratch.resolve("notes.txt"), "README.txt"));
            organize.add(TaskRequests.chmod(scratch.resolve("report.txt"), TaskRequests.parseMode("640").orElseThrow()));
            phase("Organize", organize);

            phase("Archive", List.of(
                TaskRequests.archive(List.of(backup), scratch, "backup", "zip"),
                TaskRequests.archive(List.of(backup, scratch.resolve("README.txt")), scratch, "bundle", "tar.gz"),
                TaskRequests.delete(scratch.resolve("does-not-exist.txt"))));

            if (properties.isKeepScratch()) {
                log.info("Keeping scratch directory {}", scratch);
            } else {
                phase("Cleanup", List.of(TaskRequests.delete(scratch)));
            }

            printTaskTable();
        } finally {
            consumer.interrupt();
        }
    }

    private void phase(String name, List<TaskRequest> requests) throws InterruptedException {
        log.info("=== {} ===", name);
        List<UUID> ids = new ArrayList<>();
        for (TaskRequest request : requests) {
            ids.add(taskService.submit(request));
        }
        runUntilSettled(ids);
    }

    /**
     * Tick until every task in {@code ids} reaches a terminal state.
     */
    private void runUntilSettled(List<UUID> ids) throws InterruptedException {
        long deadline = System.nanoTime() + properties.getPhaseTimeout().toNanos();
        while (!allTerminal(ids)) {
            taskService.processPendingTasks();
            if (System.nanoTime() > deadline) {
                throw new IllegalStateException("Tasks did not settle within " + properties.getPhaseTimeout());
            }
            Thread.sleep(properties.getTickInterval().toMillis());
        }
    }

    private boolean allTerminal(List<UUID> ids) {
        for (UUID id : ids) {
            boolean terminal = taskService.getTask(id)
                .map(task -> task.status().isTerminal())
                .orElse(true);
            if (!terminal) {
                return false;
            }
        }
        return true;
    }

    private void consumeEvents() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                onEvent(taskService.awaitEvent());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Event consumer stopped");
        }
    }

    private void onEvent(AppliedEvent applied) {
        if (!applied.isMatched()) {
            return;
        }
        Task task = applied.task();
        if (applied.isCompleted() && task.kind() instanceof TaskKind.Archive) {
            Path dest = ((TaskKind.Archive) task.kind()).dest();
            log.info("Archive {} created successfully", dest.getFileName());
        } else if (applied.isFailed()) {
            log.warn("{} failed: {}", task.description(), task.status().failureReason());
        }
    }

    private void printTaskTable() {
        log.info("{}", String.format("%-18s %-40s %s", "OPERATION", "STATUS", "DESCRIPTION"));
        for (Task task : taskService.getTasks()) {
            log.info("{}", String.format("%-18s %-40s %s", task.type().tag(), task.status(), task.description()));
        }
    }
}
