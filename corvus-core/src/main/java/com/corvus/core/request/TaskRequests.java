package com.corvus.core.request;

import com.corvus.core.model.ArchiveFormat;
import com.corvus.core.model.TaskKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Builds task requests for the user actions that imply a filesystem mutation.
 * Descriptions are generated here, once, at submission time.
 */
public final class TaskRequests {

    /**
     * How a paste treats its clipboard sources.
     */
    public enum PasteMode {
        COPY("Copy"),
        MOVE("Move");

        private final String label;

        PasteMode(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private TaskRequests() {
        // Static factory methods only
    }

    /**
     * One copy or move per source, each landing in {@code destinationDir} under its own file name.
     */
    public static List<TaskRequest> paste(List<Path> sources, Path destinationDir, PasteMode mode) {
        List<TaskRequest> requests = new ArrayList<>(sources.size());
        for (Path src : sources) {
            Path dest = destinationDir.resolve(fileName(src));
            TaskKind kind = mode == PasteMode.COPY
                ? new TaskKind.Copy(src, dest)
                : new TaskKind.Move(src, dest);
            String description = String.format("%s \"%s\" -> \"%s\"", mode.label(), fileName(src), destinationDir);
            requests.add(new TaskRequest(kind, description));
        }
        return requests;
    }

    public static TaskRequest delete(Path path) {
        return new TaskRequest(new TaskKind.Delete(path), String.format("Delete \"%s\"", fileName(path)));
    }

    public static TaskRequest createFile(Path path) {
        return new TaskRequest(new TaskKind.CreateFile(path), String.format("Create \"%s\"", path));
    }

    public static TaskRequest createDirectory(Path path) {
        return new TaskRequest(new TaskKind.CreateDirectory(path), String.format("Create \"%s\"", path));
    }

    /**
     * Rename within the same parent directory. Executed as a move.
     *
     * @throws IllegalArgumentException if {@code newName} is blank or contains a path separator
     */
    public static TaskRequest rename(Path path, String newName) {
        if (newName == null || newName.isBlank()) {
            throw new IllegalArgumentException("New name cannot be empty");
        }
        if (newName.contains("/") || newName.contains(path.getFileSystem().getSeparator())) {
            throw new IllegalArgumentException("New name must not contain a path separator: " + newName);
        }
        Path target = path.resolveSibling(newName);
        return new TaskRequest(
            new TaskKind.Move(path, target),
            String.format("Rename \"%s\" to \"%s\"", path, target));
    }

    public static TaskRequest chmod(Path path, int mode) {
        return new TaskRequest(
            new TaskKind.Chmod(path, mode),
            String.format("Chmod \"%s\" to %s", fileName(path), Integer.toOctalString(mode)));
    }

    /**
     * Parse permission bits typed as octal text, e.g. {@code "755"}.
     *
     * @return the mode, or empty if the text is not a valid octal number
     */
    public static OptionalInt parseMode(String octalText) {
        if (octalText == null || octalText.isBlank()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseUnsignedInt(octalText.trim(), 8));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    public static TaskRequest chown(Path path, String owner) {
        return new TaskRequest(
            new TaskKind.Chown(path, owner),
            String.format("Chown \"%s\" to %s", fileName(path), owner));
    }

    public static TaskRequest unmount(Path mountPoint) {
        return new TaskRequest(new TaskKind.Unmount(mountPoint), String.format("Unmount \"%s\"", mountPoint));
    }

    /**
     * Archive {@code paths} into {@code directory/name + extension}.
     * An unknown format tag gets the {@code .zip} extension; the task itself will still fail on the tag.
     *
     * @throws IllegalArgumentException if {@code name} is blank or {@code paths} is empty
     */
    public static TaskRequest archive(List<Path> paths, Path directory, String name, String format) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Archive name cannot be empty");
        }
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("Nothing selected to archive");
        }
        String extension = ArchiveFormat.fromTag(format)
            .map(ArchiveFormat::extension)
            .orElse(ArchiveFormat.ZIP.extension());
        Path dest = directory.resolve(name + extension);
        return new TaskRequest(
            new TaskKind.Archive(paths, dest, format),
            String.format("Archive %d items to \"%s\"", paths.size(), dest));
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }
}
