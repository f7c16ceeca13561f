package com.corvus.engine.executor;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;

/**
 * Turns I/O exceptions into the one-line reasons shown next to failed tasks.
 * NIO exceptions often carry only the path as their message, which reads badly in a task list.
 */
public final class IoErrors {

    private IoErrors() {
    }

    public static String describe(IOException e) {
        if (e instanceof NoSuchFileException) {
            return "No such file or directory: " + subject((FileSystemException) e);
        }
        if (e instanceof AccessDeniedException) {
            return "Permission denied: " + subject((FileSystemException) e);
        }
        if (e instanceof FileAlreadyExistsException) {
            return "File exists: " + subject((FileSystemException) e);
        }
        if (e instanceof DirectoryNotEmptyException) {
            return "Directory not empty: " + subject((FileSystemException) e);
        }
        if (e instanceof NotDirectoryException) {
            return "Not a directory: " + subject((FileSystemException) e);
        }
        if (e instanceof FileSystemException && ((FileSystemException) e).getReason() != null) {
            FileSystemException fse = (FileSystemException) e;
            return fse.getReason() + ": " + subject(fse);
        }
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }

    private static String subject(FileSystemException e) {
        if (e.getFile() == null) {
            return String.valueOf(e.getMessage());
        }
        return e.getOtherFile() == null ? e.getFile() : e.getFile() + " -> " + e.getOtherFile();
    }
}
