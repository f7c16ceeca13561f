package com.corvus.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * What a task does, together with the operands it needs.
 * The variant set is closed; dispatch switches over {@link #type()}.
 */
public sealed interface TaskKind permits
        TaskKind.Copy,
        TaskKind.Move,
        TaskKind.Delete,
        TaskKind.CreateFile,
        TaskKind.CreateDirectory,
        TaskKind.Chmod,
        TaskKind.Chown,
        TaskKind.Unmount,
        TaskKind.Archive {

    OperationType type();

    record Copy(Path src, Path dest) implements TaskKind {
        public Copy {
            Objects.requireNonNull(src, "src");
            Objects.requireNonNull(dest, "dest");
        }

        @Override
        public OperationType type() {
            return OperationType.COPY;
        }
    }

    record Move(Path src, Path dest) implements TaskKind {
        public Move {
            Objects.requireNonNull(src, "src");
            Objects.requireNonNull(dest, "dest");
        }

        @Override
        public OperationType type() {
            return OperationType.MOVE;
        }
    }

    record Delete(Path path) implements TaskKind {
        public Delete {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public OperationType type() {
            return OperationType.DELETE;
        }
    }

    record CreateFile(Path path) implements TaskKind {
        public CreateFile {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public OperationType type() {
            return OperationType.CREATE_FILE;
        }
    }

    record CreateDirectory(Path path) implements TaskKind {
        public CreateDirectory {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public OperationType type() {
            return OperationType.CREATE_DIRECTORY;
        }
    }

    /**
     * Change permission bits. {@code mode} holds the raw unsigned bits, e.g. {@code 0755}.
     */
    record Chmod(Path path, int mode) implements TaskKind {
        public Chmod {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public OperationType type() {
            return OperationType.CHMOD;
        }
    }

    /**
     * Change ownership. {@code owner} is {@code user} or {@code user:group}.
     */
    record Chown(Path path, String owner) implements TaskKind {
        public Chown {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(owner, "owner");
        }

        @Override
        public OperationType type() {
            return OperationType.CHOWN;
        }
    }

    record Unmount(Path path) implements TaskKind {
        public Unmount {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public OperationType type() {
            return OperationType.UNMOUNT;
        }
    }

    /**
     * Pack {@code paths} into {@code dest}. {@code format} is the literal tag
     * ({@code zip}, {@code tar} or {@code tar.gz}); other values fail at execution time.
     */
    record Archive(List<Path> paths, Path dest, String format) implements TaskKind {
        public Archive {
            paths = List.copyOf(Objects.requireNonNull(paths, "paths"));
            Objects.requireNonNull(dest, "dest");
            Objects.requireNonNull(format, "format");
        }

        @Override
        public OperationType type() {
            return OperationType.ARCHIVE;
        }
    }
}
