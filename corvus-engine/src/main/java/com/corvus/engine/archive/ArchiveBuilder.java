package com.corvus.engine.archive;

import com.corvus.core.exception.ArchiveException;
import com.corvus.core.model.ArchiveFormat;
import com.corvus.engine.executor.IoErrors;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Serializes files and directories into a zip, tar or gzip-compressed tar container.
 *
 * <p>Entry naming differs between the two families:
 * <ul>
 *   <li>zip: a file input becomes one entry named by its file name; a directory input
 *       contributes its contents relative to itself, without the directory's own name.</li>
 *   <li>tar / tar.gz: a file input is stored under its own path (leading root removed);
 *       a directory input is stored under its own name as the top-level entry.</li>
 * </ul>
 *
 * <p>Children are visited in name order. If the destination lies inside an input
 * directory it is skipped. Any I/O failure after the destination was opened aborts
 * the build and the partial destination is deleted best-effort. A destination that
 * could not be opened is left untouched.
 */
public class ArchiveBuilder {

    private static final Logger log = LoggerFactory.getLogger(ArchiveBuilder.class);

    private static final Comparator<Path> BY_NAME = Comparator.comparing(p -> p.getFileName().toString());

    /**
     * Build an archive, resolving the format from its literal tag.
     *
     * @throws ArchiveException if the tag is unknown (nothing is written) or the build fails
     */
    public void build(List<Path> inputs, Path dest, String formatTag) throws ArchiveException {
        build(inputs, dest, ArchiveFormat.requireTag(formatTag));
    }

    /**
     * Build an archive of {@code inputs} at {@code dest}.
     *
     * @return number of entries written
     * @throws ArchiveException if any input cannot be read or the destination cannot be written
     */
    public int build(List<Path> inputs, Path dest, ArchiveFormat format) throws ArchiveException {
        log.info("Building {} archive {} from {} input(s)", format.tag(), dest, inputs.size());
        OutputStream out;
        try {
            out = open(dest);
        } catch (IOException e) {
            throw new ArchiveException(IoErrors.describe(e), e);
        }
        try {
            int entries = switch (format) {
                case ZIP -> writeZip(inputs, dest, out);
                case TAR -> writeTar(inputs, dest, out, false);
                case TAR_GZ -> writeTar(inputs, dest, out, true);
            };
            log.info("Archive {} written with {} entries", dest, entries);
            return entries;
        } catch (ArchiveException e) {
            discardPartial(dest, out);
            throw e;
        } catch (IOException e) {
            discardPartial(dest, out);
            throw new ArchiveException(IoErrors.describe(e), e);
        }
    }

    // ========== zip ==========

    private int writeZip(List<Path> inputs, Path dest, OutputStream out) throws IOException, ArchiveException {
        Path skip = normalized(dest);
        try (ZipArchiveOutputStream zip = new ZipArchiveOutputStream(out)) {
            int count = 0;
            for (Path input : inputs) {
                if (Files.isDirectory(input)) {
                    count += addDirectoryToZip(zip, input, input, skip, new HashSet<>());
                } else {
                    addFileToZip(zip, input, fileName(input));
                    count++;
                }
            }
            zip.finish();
            return count;
        }
    }

    private int addDirectoryToZip(ZipArchiveOutputStream zip, Path base, Path dir, Path skip,
                                  Set<Path> ancestors) throws IOException, ArchiveException {
        enter(dir, ancestors);
        int count = 0;
        for (Path child : children(dir)) {
            if (normalized(child).equals(skip)) {
                continue;
            }
            String name = entryName(base.relativize(child));
            if (Files.isDirectory(child)) {
                ZipArchiveEntry entry = zip.createArchiveEntry(child, name);
                zip.putArchiveEntry(entry);
                zip.closeArchiveEntry();
                count++;
                count += addDirectoryToZip(zip, base, child, skip, ancestors);
            } else {
                addFileToZip(zip, child, name);
                count++;
            }
        }
        ancestors.remove(dir.toRealPath());
        return count;
    }

    private void addFileToZip(ZipArchiveOutputStream zip, Path file, String name) throws IOException {
        log.debug("zip: {}", name);
        ZipArchiveEntry entry = zip.createArchiveEntry(file, name);
        zip.putArchiveEntry(entry);
        Files.copy(file, zip);
        zip.closeArchiveEntry();
    }

    // ========== tar / tar.gz ==========

    private int writeTar(List<Path> inputs, Path dest, OutputStream out, boolean gzip)
            throws IOException, ArchiveException {
        Path skip = normalized(dest);
        if (gzip) {
            out = new GzipCompressorOutputStream(out);
        }
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(out)) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
            int count = 0;
            for (Path input : inputs) {
                if (Files.isDirectory(input)) {
                    Path name = input.getFileName();
                    if (name == null) {
                        throw new ArchiveException("Cannot archive a filesystem root: " + input);
                    }
                    count += addDirectoryToTar(tar, input, name.toString(), skip, new HashSet<>());
                } else {
                    addToTar(tar, input, relativeEntryName(input));
                    count++;
                }
            }
            tar.finish();
            return count;
        }
    }

    private int addDirectoryToTar(TarArchiveOutputStream tar, Path dir, String name, Path skip,
                                  Set<Path> ancestors) throws IOException, ArchiveException {
        enter(dir, ancestors);
        addToTar(tar, dir, name);
        int count = 1;
        for (Path child : children(dir)) {
            if (normalized(child).equals(skip)) {
                continue;
            }
            String childName = name + "/" + child.getFileName();
            if (Files.isDirectory(child)) {
                count += addDirectoryToTar(tar, child, childName, skip, ancestors);
            } else {
                addToTar(tar, child, childName);
                count++;
            }
        }
        ancestors.remove(dir.toRealPath());
        return count;
    }

    private void addToTar(TarArchiveOutputStream tar, Path path, String name) throws IOException {
        log.debug("tar: {}", name);
        TarArchiveEntry entry = tar.createArchiveEntry(path, name);
        tar.putArchiveEntry(entry);
        if (Files.isRegularFile(path)) {
            Files.copy(path, tar);
        }
        tar.closeArchiveEntry();
    }

    /**
     * Tar member name for a file given by path: root stripped, {@code .} skipped, {@code ..} refused.
     */
    static String relativeEntryName(Path path) throws ArchiveException {
        Path relative = path.getRoot() != null ? path.getRoot().relativize(path) : path;
        List<String> parts = new ArrayList<>();
        for (Path part : relative) {
            String s = part.toString();
            if (s.equals("..")) {
                throw new ArchiveException("Paths in archives must not contain '..': " + path);
            }
            if (!s.isEmpty() && !s.equals(".")) {
                parts.add(s);
            }
        }
        if (parts.isEmpty()) {
            throw new ArchiveException("Cannot derive an archive entry name from " + path);
        }
        return String.join("/", parts);
    }

    // ========== shared ==========

    private static OutputStream open(Path dest) throws IOException {
        return new BufferedOutputStream(Files.newOutputStream(dest));
    }

    private static List<Path> children(Path dir) throws IOException {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.sorted(BY_NAME).toList();
        }
    }

    private static void enter(Path dir, Set<Path> ancestors) throws IOException, ArchiveException {
        if (!ancestors.add(dir.toRealPath())) {
            throw new ArchiveException("Filesystem loop detected at " + dir);
        }
    }

    private static String entryName(Path relative) {
        List<String> parts = new ArrayList<>();
        for (Path part : relative) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }

    private static String fileName(Path path) throws ArchiveException {
        Path name = path.getFileName();
        if (name == null) {
            throw new ArchiveException("Cannot derive an archive entry name from " + path);
        }
        return name.toString();
    }

    private static Path normalized(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static void discardPartial(Path dest, OutputStream out) {
        try {
            out.close();
        } catch (IOException e) {
            log.debug("Closing partial archive {} failed: {}", dest, IoErrors.describe(e));
        }
        try {
            if (Files.deleteIfExists(dest)) {
                log.debug("Removed partial archive {}", dest);
            }
        } catch (IOException e) {
            log.warn("Could not remove partial archive {}: {}", dest, IoErrors.describe(e));
        }
    }
}
