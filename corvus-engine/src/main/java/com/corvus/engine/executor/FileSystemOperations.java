package com.corvus.engine.executor;

import com.corvus.core.exception.OperationException;
import com.corvus.core.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;

/**
 * Thin wrappers over the platform file APIs, one per file-level task kind.
 * Every I/O failure surfaces as an {@link OperationException} with a readable reason.
 */
public class FileSystemOperations {

    private static final Logger log = LoggerFactory.getLogger(FileSystemOperations.class);

    private static final PosixFilePermission[] PERMISSION_BITS = {
        PosixFilePermission.OTHERS_EXECUTE,
        PosixFilePermission.OTHERS_WRITE,
        PosixFilePermission.OTHERS_READ,
        PosixFilePermission.GROUP_EXECUTE,
        PosixFilePermission.GROUP_WRITE,
        PosixFilePermission.GROUP_READ,
        PosixFilePermission.OWNER_EXECUTE,
        PosixFilePermission.OWNER_WRITE,
        PosixFilePermission.OWNER_READ
    };

    /**
     * Copy a file over {@code dest}, replacing an existing file but never a directory.
     * A directory source is copied recursively and may not be copied into its own subtree.
     */
    public void copy(TaskKind.Copy kind) throws OperationException {
        Path src = kind.src();
        Path dest = kind.dest();
        try {
            if (Files.isDirectory(src)) {
                if (isWithin(dest, src)) {
                    throw new OperationException(OperationException.IO_ERROR,
                        "Cannot copy a directory into itself: " + src + " -> " + dest);
                }
                copyTree(src, dest);
            } else {
                replaceFile(src, dest);
            }
            log.debug("Copied {} to {}", src, dest);
        } catch (IOException e) {
            throw ioFailure(e);
        }
    }

    /**
     * Rename {@code src} to {@code dest}, replacing an existing destination file.
     * A file is never moved over a directory.
     */
    public void move(TaskKind.Move kind) throws OperationException {
        try {
            if (Files.isDirectory(kind.dest(), LinkOption.NOFOLLOW_LINKS) && !Files.isDirectory(kind.src())) {
                throw isADirectory(kind.dest());
            }
            Files.move(kind.src(), kind.dest(), StandardCopyOption.REPLACE_EXISTING);
            log.debug("Moved {} to {}", kind.src(), kind.dest());
        } catch (IOException e) {
            throw ioFailure(e);
        }
    }

    /**
     * Remove a file, or a directory with everything below it.
     */
    public void delete(TaskKind.Delete kind) throws OperationException {
        Path path = kind.path();
        try {
            if (Files.isDirectory(path)) {
                deleteTree(path);
            } else {
                Files.delete(path);
            }
            log.debug("Deleted {}", path);
        } catch (IOException e) {
            throw ioFailure(e);
        }
    }

    /**
     * Create an empty file, truncating it if it already exists.
     */
    public void createFile(TaskKind.CreateFile kind) throws OperationException {
        try (OutputStream ignored = Files.newOutputStream(kind.path())) {
            log.debug("Created file {}", kind.path());
        } catch (IOException e) {
            throw ioFailure(e);
        }
    }

    /**
     * Create a single directory. Fails if it exists or its parent is missing.
     */
    public void createDirectory(TaskKind.CreateDirectory kind) throws OperationException {
        try {
            Files.createDirectory(kind.path());
            log.debug("Created directory {}", kind.path());
        } catch (IOException e) {
            throw ioFailure(e);
        }
    }

    /**
     * Apply the requested mode bits verbatim through the {@code unix:mode} attribute.
     * Where that view is unavailable only the nine rwx bits can be applied.
     */
    public void chmod(TaskKind.Chmod kind) throws OperationException {
        Path path = kind.path();
        try {
            try {
                Files.setAttribute(path, "unix:mode", kind.mode());
            } catch (UnsupportedOperationException | IllegalArgumentException e) {
                log.debug("unix attribute view unavailable for {}, applying rwx bits only", path);
                Files.setPosixFilePermissions(path, toPermissions(kind.mode()));
            }
            log.debug("Changed mode of {} to {}", path, Integer.toOctalString(kind.mode()));
        } catch (UnsupportedOperationException e) {
            throw new OperationException(OperationException.IO_ERROR,
                "Permissions are not supported on this filesystem: " + path, e);
        } catch (IOException e) {
            throw ioFailure(e);
        }
    }

    static Set<PosixFilePermission> toPermissions(int mode) {
        Set<PosixFilePermission> permissions = EnumSet.noneOf(PosixFilePermission.class);
        for (int bit = 0; bit < PERMISSION_BITS.length; bit++) {
            if ((mode & (1 << bit)) != 0) {
                permissions.add(PERMISSION_BITS[bit]);
            }
        }
        return permissions;
    }

    private static void copyTree(Path src, Path dest) throws IOException {
        Files.walkFileTree(src, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Path target = dest.resolve(src.relativize(dir).toString());
                if (!Files.isDirectory(target)) {
                    Files.createDirectory(target);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                replaceFile(file, dest.resolve(src.relativize(file).toString()));
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static void replaceFile(Path file, Path target) throws IOException {
        if (Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
            throw isADirectory(target);
        }
        Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * True if {@code path} is {@code dir} or lies below it, lexically or once symlinks are resolved.
     */
    static boolean isWithin(Path path, Path dir) throws IOException {
        Path target = path.toAbsolutePath().normalize();
        Path root = dir.toAbsolutePath().normalize();
        if (target.startsWith(root)) {
            return true;
        }
        Path existing = target;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return false;
        }
        Path resolved = existing.toRealPath().resolve(existing.relativize(target));
        return resolved.normalize().startsWith(dir.toRealPath());
    }

    private static FileSystemException isADirectory(Path path) {
        return new FileSystemException(path.toString(), null, "Is a directory");
    }

    private static void deleteTree(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static OperationException ioFailure(IOException e) {
        return new OperationException(OperationException.IO_ERROR, IoErrors.describe(e), e);
    }
}
