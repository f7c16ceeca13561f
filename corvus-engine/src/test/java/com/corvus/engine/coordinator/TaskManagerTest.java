package com.corvus.engine.coordinator;

import com.corvus.core.model.ProgressEvent;
import com.corvus.core.model.Task;
import com.corvus.core.model.TaskKind;
import com.corvus.core.model.TaskState;
import com.corvus.core.request.TaskRequests;
import com.corvus.engine.archive.ArchiveBuilder;
import com.corvus.engine.channel.ProgressChannel;
import com.corvus.engine.executor.FileSystemOperations;
import com.corvus.engine.executor.OperationDispatcher;
import com.corvus.engine.executor.PrivilegedOperations;
import com.corvus.engine.metrics.TaskMetrics;
import com.corvus.engine.persistence.InMemoryTaskRepository;
import com.corvus.engine.process.CommandResult;
import com.corvus.engine.service.AppliedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import static org.assertj.core.api.Assertions.*;

class TaskManagerTest {

    private static final Duration EVENT_TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    Path tmp;

    private final List<List<String>> commands = new CopyOnWriteArrayList<>();
    private InMemoryTaskRepository repository;
    private ProgressChannel channel;
    private SimpleMeterRegistry registry;
    private TaskManager manager;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTaskRepository();
        channel = new ProgressChannel();
        registry = new SimpleMeterRegistry();
        PrivilegedOperations privileged = new PrivilegedOperations(command -> {
            commands.add(command);
            return new CommandResult(command, 0, "", "");
        }, List.of("sudo"), "chown", "umount");
        OperationDispatcher dispatcher =
            new OperationDispatcher(new FileSystemOperations(), privileged, new ArchiveBuilder());
        manager = new TaskManager(
            repository,
            channel,
            dispatcher,
            Executors.newCachedThreadPool(),
            new TaskMetrics(registry),
            Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private AppliedEvent nextEvent() throws InterruptedException {
        return manager.pollEvent(EVENT_TIMEOUT)
            .orElseThrow(() -> new AssertionError("no event within " + EVENT_TIMEOUT));
    }

    private Task task(UUID id) {
        return manager.getTask(id).orElseThrow();
    }

    @Test
    void addTask_shouldRegisterPendingTaskVisibleImmediately() {
        UUID first = manager.addTask(new TaskKind.Delete(tmp.resolve("a")), "Delete \"a\"");
        UUID second = manager.addTask(new TaskKind.Delete(tmp.resolve("b")), "Delete \"b\"");

        assertThat(first).isNotEqualTo(second);
        assertThat(manager.getTasks())
            .extracting(Task::taskId)
            .containsExactly(first, second);
        assertThat(task(first).state()).isEqualTo(TaskState.PENDING);
        assertThat(task(first).description()).isEqualTo("Delete \"a\"");
        assertThat(registry.get("corvus.tasks.submitted").tag("operation", "delete").counter().count())
            .isEqualTo(2.0);
    }

    @Test
    void getTask_unknownId_shouldBeEmpty() {
        assertThat(manager.getTask(UUID.randomUUID())).isEmpty();
    }

    @Test
    void copy_shouldCompleteAndReportTrue() throws Exception {
        Path src = Files.writeString(tmp.resolve("a.txt"), "hello");
        Path dest = tmp.resolve("b.txt");
        UUID id = manager.addTask(new TaskKind.Copy(src, dest), "Copy \"a.txt\"");

        assertThat(manager.processPendingTasks()).isEqualTo(1);
        assertThat(manager.waitForEvent()).isTrue();

        Task task = task(id);
        assertThat(task.state()).isEqualTo(TaskState.COMPLETED);
        assertThat(task.finishedAt()).isNotNull();
        assertThat(dest).hasContent("hello");
    }

    @Test
    void move_shouldCompleteAndRemoveSource() throws Exception {
        Path src = Files.writeString(tmp.resolve("a.txt"), "hello");
        Path dest = tmp.resolve("c.txt");
        UUID id = manager.addTask(new TaskKind.Move(src, dest), "Move \"a.txt\"");

        manager.processPendingTasks();

        assertThat(manager.waitForEvent()).isTrue();
        assertThat(task(id).state()).isEqualTo(TaskState.COMPLETED);
        assertThat(src).doesNotExist();
        assertThat(dest).hasContent("hello");
    }

    @Test
    void deleteNonexistent_shouldFailWithReasonAndReportFalse() throws Exception {
        UUID id = manager.addTask(new TaskKind.Delete(Path.of("/nonexistent")), "Delete \"nonexistent\"");

        manager.processPendingTasks();

        assertThat(manager.waitForEvent()).isFalse();
        Task task = task(id);
        assertThat(task.state()).isEqualTo(TaskState.FAILED);
        assertThat(task.status().failureReason()).isNotBlank();
        assertThat(registry.get("corvus.tasks.failed").tag("operation", "delete").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void archive_shouldProduceZipWithRelativeEntries() throws Exception {
        Path src = Files.createDirectories(tmp.resolve("src/sub"));
        Files.writeString(tmp.resolve("src/file1.txt"), "1");
        Files.writeString(src.resolve("file2.txt"), "2");
        Path dest = tmp.resolve("out.zip");
        UUID id = manager.submit(TaskRequests.archive(List.of(tmp.resolve("src")), tmp, "out", "zip"));

        manager.processPendingTasks();
        AppliedEvent applied = nextEvent();

        assertThat(applied.taskId()).isEqualTo(id);
        assertThat(applied.isCompleted()).isTrue();
        assertThat(applied.task().state()).isEqualTo(TaskState.COMPLETED);
        try (ZipFile zip = new ZipFile(dest.toFile())) {
            assertThat(Collections.list(zip.entries()))
                .extracting(ZipEntry::getName)
                .contains("file1.txt", "sub/file2.txt")
                .noneMatch(name -> name.startsWith("src/"));
        }
    }

    @Test
    void archive_unsupportedFormat_shouldFailTask() throws Exception {
        Path input = Files.writeString(tmp.resolve("a.txt"), "a");
        UUID id = manager.addTask(new TaskKind.Archive(List.of(input), tmp.resolve("a.rar"), "rar"), "Archive");

        manager.processPendingTasks();
        AppliedEvent applied = nextEvent();

        assertThat(applied.isFailed()).isTrue();
        assertThat(task(id).status().failureReason()).isEqualTo("Unsupported archive format: rar");
        assertThat(tmp.resolve("a.rar")).doesNotExist();
    }

    @Test
    void chownAndUnmount_shouldRunExternalCommands() throws Exception {
        manager.submit(TaskRequests.chown(Path.of("/srv/share"), "alice:staff"));
        manager.submit(TaskRequests.unmount(Path.of("/mnt/usb")));

        assertThat(manager.processPendingTasks()).isEqualTo(2);
        assertThat(manager.waitForEvent()).isTrue();
        assertThat(manager.waitForEvent()).isTrue();

        assertThat(commands).containsExactlyInAnyOrder(
            List.of("sudo", "chown", "alice:staff", "/srv/share"),
            List.of("umount", "/mnt/usb"));
    }

    @Test
    void processPendingTasks_repeatedCalls_shouldNotRedispatch() throws Exception {
        manager.addTask(new TaskKind.Unmount(Path.of("/mnt/a")), "Unmount \"/mnt/a\"");

        assertThat(manager.processPendingTasks()).isEqualTo(1);
        assertThat(manager.processPendingTasks()).isZero();
        assertThat(manager.waitForEvent()).isTrue();
        assertThat(manager.processPendingTasks()).isZero();

        assertThat(commands).hasSize(1);
        assertThat(manager.pollEvent(Duration.ofMillis(100))).isEmpty();
    }

    @Test
    void processPendingTasks_concurrentCallers_shouldDispatchEachTaskOnce() throws Exception {
        int taskCount = 200;
        for (int i = 0; i < taskCount; i++) {
            manager.addTask(new TaskKind.Unmount(Path.of("/mnt/m" + i)), "Unmount " + i);
        }

        int callers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger dispatched = new AtomicInteger();
        for (int i = 0; i < callers; i++) {
            pool.submit(() -> {
                start.await();
                dispatched.addAndGet(manager.processPendingTasks());
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        int completed = 0;
        for (int i = 0; i < taskCount; i++) {
            if (nextEvent().isCompleted()) {
                completed++;
            }
        }

        assertThat(dispatched.get()).isEqualTo(taskCount);
        assertThat(completed).isEqualTo(taskCount);
        assertThat(commands).hasSize(taskCount);
        assertThat(manager.getTasks()).allMatch(t -> t.state() == TaskState.COMPLETED);
    }

    @Test
    void waitForEvent_updateEvent_shouldApplyProgressAndReportFalse() throws Exception {
        manager.addTask(new TaskKind.Unmount(Path.of("/mnt/a")), "Unmount");
        UUID id = manager.getTasks().get(0).taskId();
        // Claim without launching an executor so the injected event is the only one
        repository.claimPending(Instant.now());
        assertThat(task(id).state()).isEqualTo(TaskState.IN_PROGRESS);

        channel.send(id, ProgressEvent.update(0.5f));

        assertThat(manager.waitForEvent()).isFalse();
        assertThat(task(id).state()).isEqualTo(TaskState.IN_PROGRESS);
        assertThat(task(id).status().progress()).isEqualTo(0.5f);
    }

    @Test
    void waitForEvent_unknownTask_shouldReportFalse() throws Exception {
        channel.send(UUID.randomUUID(), ProgressEvent.completed());

        assertThat(manager.waitForEvent()).isFalse();
    }

    @Test
    void awaitEvent_unknownTask_shouldBeUnmatched() throws Exception {
        UUID stranger = UUID.randomUUID();
        channel.send(stranger, ProgressEvent.completed());

        AppliedEvent applied = manager.awaitEvent();

        assertThat(applied.taskId()).isEqualTo(stranger);
        assertThat(applied.isMatched()).isFalse();
        assertThat(applied.isCompleted()).isFalse();
    }

    @Test
    void illegalTransition_shouldBeDroppedWithoutChangingTask() throws Exception {
        UUID id = manager.addTask(new TaskKind.Delete(tmp.resolve("x")), "Delete \"x\"");

        channel.send(id, ProgressEvent.completed());

        assertThat(manager.waitForEvent()).isFalse();
        assertThat(task(id).state()).isEqualTo(TaskState.PENDING);
    }

    @Test
    void terminalTask_shouldNotRegress() throws Exception {
        Path file = Files.writeString(tmp.resolve("a.txt"), "a");
        UUID id = manager.addTask(new TaskKind.Delete(file), "Delete \"a.txt\"");
        manager.processPendingTasks();
        assertThat(manager.waitForEvent()).isTrue();

        channel.send(id, ProgressEvent.error("late failure"));

        assertThat(manager.awaitEvent().isMatched()).isFalse();
        assertThat(task(id).state()).isEqualTo(TaskState.COMPLETED);
    }

    @Test
    void processPendingTasks_afterClose_shouldFailTask() throws Exception {
        manager.close();
        UUID id = manager.addTask(new TaskKind.Delete(tmp.resolve("x")), "Delete \"x\"");

        assertThat(manager.processPendingTasks()).isEqualTo(1);
        AppliedEvent applied = nextEvent();

        assertThat(applied.isFailed()).isTrue();
        assertThat(task(id).status().failureReason()).isEqualTo(TaskManager.EXECUTOR_UNAVAILABLE);
    }

    @Test
    void processPendingTasks_afterClose_withFullChannel_shouldFailTaskWithoutBlocking() throws Exception {
        UUID other = UUID.randomUUID();
        while (channel.remainingCapacity() > 0) {
            channel.send(other, ProgressEvent.update(0.5f));
        }
        manager.close();
        UUID id = manager.addTask(new TaskKind.Delete(tmp.resolve("x")), "Delete \"x\"");

        int dispatched = CompletableFuture.supplyAsync(manager::processPendingTasks).get(5, TimeUnit.SECONDS);

        assertThat(dispatched).isEqualTo(1);
        assertThat(task(id).state()).isEqualTo(TaskState.FAILED);
        assertThat(task(id).status().failureReason()).isEqualTo(TaskManager.EXECUTOR_UNAVAILABLE);
    }

    @Test
    void pollEvent_noEvents_shouldTimeOut() throws Exception {
        assertThat(manager.pollEvent(Duration.ofMillis(50))).isEmpty();
    }
}
