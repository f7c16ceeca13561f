package com.corvus.core.request;

import com.corvus.core.model.TaskKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class TaskRequestsTest {

    private static final Path HOME = Path.of("/home/user");

    @Test
    void paste_copy_shouldTargetDestinationDirectoryPerSource() {
        List<TaskRequest> requests = TaskRequests.paste(
            List.of(HOME.resolve("a.txt"), HOME.resolve("docs")),
            Path.of("/backup"),
            TaskRequests.PasteMode.COPY);
        
        assertEquals(2, requests.size());
        assertEquals(new TaskKind.Copy(HOME.resolve("a.txt"), Path.of("/backup/a.txt")), requests.get(0).kind());
        assertEquals(new TaskKind.Copy(HOME.resolve("docs"), Path.of("/backup/docs")), requests.get(1).kind());
        assertEquals("Copy \"a.txt\" -> \"/backup\"", requests.get(0).description());
    }

    @Test
    void paste_move_shouldProduceMoveKinds() {
        List<TaskRequest> requests = TaskRequests.paste(
            List.of(HOME.resolve("a.txt")), Path.of("/backup"), TaskRequests.PasteMode.MOVE);
        
        assertInstanceOf(TaskKind.Move.class, requests.get(0).kind());
        assertTrue(requests.get(0).description().startsWith("Move "));
    }

    @Test
    void rename_shouldMoveWithinParent() {
        TaskRequest request = TaskRequests.rename(HOME.resolve("old.txt"), "new.txt");
        
        assertEquals(new TaskKind.Move(HOME.resolve("old.txt"), HOME.resolve("new.txt")), request.kind());
        assertEquals("Rename \"/home/user/old.txt\" to \"/home/user/new.txt\"", request.description());
    }

    @Test
    void rename_shouldRejectBlankOrNestedNames() {
        assertThrows(IllegalArgumentException.class, () -> TaskRequests.rename(HOME, " "));
        assertThrows(IllegalArgumentException.class, () -> TaskRequests.rename(HOME.resolve("a"), "x/y"));
    }

    @Test
    void parseMode_shouldReadOctalText() {
        assertEquals(OptionalInt.of(0755), TaskRequests.parseMode("755"));
        assertEquals(OptionalInt.of(04755), TaskRequests.parseMode("4755"));
        assertEquals(OptionalInt.empty(), TaskRequests.parseMode("789"));
        assertEquals(OptionalInt.empty(), TaskRequests.parseMode(""));
        assertEquals(OptionalInt.empty(), TaskRequests.parseMode("rwx"));
    }

    @Test
    void chmod_shouldDescribeModeInOctal() {
        TaskRequest request = TaskRequests.chmod(HOME.resolve("run.sh"), 0750);
        
        assertEquals(new TaskKind.Chmod(HOME.resolve("run.sh"), 0750), request.kind());
        assertEquals("Chmod \"run.sh\" to 750", request.description());
    }

    @Test
    void chown_shouldKeepOwnerVerbatim() {
        TaskRequest request = TaskRequests.chown(HOME.resolve("a.txt"), "alice:staff");
        
        assertEquals(new TaskKind.Chown(HOME.resolve("a.txt"), "alice:staff"), request.kind());
        assertEquals("Chown \"a.txt\" to alice:staff", request.description());
    }

    @Test
    void archive_shouldAppendFormatExtension() {
        TaskRequest request = TaskRequests.archive(
            List.of(HOME.resolve("a"), HOME.resolve("b")), HOME, "bundle", "tar.gz");
        
        TaskKind.Archive kind = (TaskKind.Archive) request.kind();
        assertEquals(HOME.resolve("bundle.tar.gz"), kind.dest());
        assertEquals("tar.gz", kind.format());
        assertEquals("Archive 2 items to \"/home/user/bundle.tar.gz\"", request.description());
    }

    @Test
    void archive_unknownFormat_shouldFallBackToZipExtensionButKeepTag() {
        TaskRequest request = TaskRequests.archive(List.of(HOME.resolve("a")), HOME, "bundle", "rar");
        
        TaskKind.Archive kind = (TaskKind.Archive) request.kind();
        assertEquals(HOME.resolve("bundle.zip"), kind.dest());
        assertEquals("rar", kind.format());
    }

    @Test
    void archive_shouldRejectEmptyNameOrSelection() {
        assertThrows(IllegalArgumentException.class,
            () -> TaskRequests.archive(List.of(HOME.resolve("a")), HOME, "", "zip"));
        assertThrows(IllegalArgumentException.class,
            () -> TaskRequests.archive(List.of(), HOME, "bundle", "zip"));
    }

    @Test
    void unmountAndCreate_shouldDescribeFullPath() {
        assertEquals("Unmount \"/mnt/usb\"", TaskRequests.unmount(Path.of("/mnt/usb")).description());
        assertEquals("Create \"/tmp/new\"", TaskRequests.createDirectory(Path.of("/tmp/new")).description());
        assertEquals("Create \"/tmp/new.txt\"", TaskRequests.createFile(Path.of("/tmp/new.txt")).description());
        assertEquals("Delete \"a.txt\"", TaskRequests.delete(HOME.resolve("a.txt")).description());
    }
}
