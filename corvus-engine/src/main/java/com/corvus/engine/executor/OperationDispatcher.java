package com.corvus.engine.executor;

import com.corvus.core.model.TaskKind;
import com.corvus.engine.archive.ArchiveBuilder;

import java.util.Objects;

/**
 * Resolves a task kind to the operation that executes it.
 * The switch is exhaustive over {@link com.corvus.core.model.OperationType}, so adding a kind
 * without wiring it here fails to compile.
 */
public class OperationDispatcher {

    private final FileSystemOperations fileSystem;
    private final PrivilegedOperations privileged;
    private final ArchiveBuilder archiveBuilder;

    public OperationDispatcher(FileSystemOperations fileSystem,
                               PrivilegedOperations privileged,
                               ArchiveBuilder archiveBuilder) {
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
        this.privileged = Objects.requireNonNull(privileged, "privileged");
        this.archiveBuilder = Objects.requireNonNull(archiveBuilder, "archiveBuilder");
    }

    public Operation resolve(TaskKind kind) {
        return switch (kind.type()) {
            case COPY -> () -> fileSystem.copy((TaskKind.Copy) kind);
            case MOVE -> () -> fileSystem.move((TaskKind.Move) kind);
            case DELETE -> () -> fileSystem.delete((TaskKind.Delete) kind);
            case CREATE_FILE -> () -> fileSystem.createFile((TaskKind.CreateFile) kind);
            case CREATE_DIRECTORY -> () -> fileSystem.createDirectory((TaskKind.CreateDirectory) kind);
            case CHMOD -> () -> fileSystem.chmod((TaskKind.Chmod) kind);
            case CHOWN -> () -> privileged.chown((TaskKind.Chown) kind);
            case UNMOUNT -> () -> privileged.unmount((TaskKind.Unmount) kind);
            case ARCHIVE -> () -> {
                TaskKind.Archive archive = (TaskKind.Archive) kind;
                archiveBuilder.build(archive.paths(), archive.dest(), archive.format());
            };
        };
    }
}
