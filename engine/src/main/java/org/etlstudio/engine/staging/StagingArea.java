package org.etlstudio.engine.staging;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A per-call temporary directory that materializes in-memory file content
 * so backend programs can read it by path.
 *
 * The directory is deleted, with everything in it, on {@link #close()}.
 * Use it with try-with-resources:
 *
 * <pre>
 * try (StagingArea staging = StagingArea.create()) {
 *     Map&lt;String, Path&gt; paths = staging.stage(Map.of("people.csv", text));
 *     ...
 * }
 * </pre>
 */
public final class StagingArea implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(StagingArea.class);

    public static final String PREFIX = "etl_uploads_";

    private final Path directory;
    private boolean closed;

    private StagingArea(Path directory) {
        this.directory = directory;
    }

    public static StagingArea create() throws IOException {
        Path directory = Files.createTempDirectory(PREFIX);
        LOG.debug("Created staging directory {}", directory);
        return new StagingArea(directory);
    }

    public Path directory() {
        return directory;
    }

    /**
     * Writes each named blob to its own file.
     *
     * @param contents Original name (usually the source path) to file text
     * @return Original name to the absolute path of the staged file, in input order
     */
    public Map<String, Path> stage(Map<String, String> contents) throws IOException {
        Objects.requireNonNull(contents, "Contents cannot be null");
        Map<String, Path> staged = new LinkedHashMap<>();
        int index = 0;
        for (Map.Entry<String, String> entry : contents.entrySet()) {
            String fileName = index++ + "_" + safeFileName(entry.getKey());
            staged.put(entry.getKey(), writeFile(fileName, entry.getValue()));
        }
        return staged;
    }

    /**
     * Writes one file inside the staging directory.
     *
     * @return The absolute path of the written file
     */
    public Path writeFile(String fileName, String content) throws IOException {
        ensureOpen();
        Path target = directory.resolve(safeFileName(fileName)).toAbsolutePath();
        Files.writeString(target, content == null ? "" : content, StandardCharsets.UTF_8);
        return target;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (!Files.exists(directory)) {
            return;
        }
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
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
        LOG.debug("Removed staging directory {}", directory);
    }

    private void ensureOpen() {
        if (closed) {
            throw new UncheckedIOException(new IOException("Staging area is closed: " + directory));
        }
    }

    /**
     * Keeps the last path segment and replaces characters that are unsafe in
     * file names.
     */
    static String safeFileName(String name) {
        String base = name == null ? "" : name.replace('\\', '/');
        int slash = base.lastIndexOf('/');
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        base = base.replaceAll("[^A-Za-z0-9._-]", "_");
        if (base.isEmpty() || base.equals(".") || base.equals("..")) {
            return "file";
        }
        return base;
    }
}
