package org.calista.kb.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileIO — the single I/O entry point for configs, rule snapshots and event logs.
 *
 * <ul>
 *   <li>atomic commits (temp sibling + fsync + move)</li>
 *   <li>streaming JSONL reads</li>
 *   <li>path resolution confined to the base directory</li>
 * </ul>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private final Path baseDir;
    private final Charset charset;
    private final boolean atomicWrites;

    public FileIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8, true);
    }

    public FileIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        this.atomicWrites = atomicWrites;
        log.info("FileIO init: baseDir={}, charset={}, atomicWrites={}", this.baseDir, charset, atomicWrites);
        try {
            Files.createDirectories(this.baseDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists", e);
        }
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    /**
     * Resolves a relative path inside the base directory. Absolute paths and ".." escapes
     * are rejected; backslashes count as separators.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    public boolean exists(Path file) {
        return Files.exists(Objects.requireNonNull(file, "file"));
    }

    // ----------------------------
    // Text
    // ----------------------------

    public String readString(Path file) throws IOException {
        return Files.readString(Objects.requireNonNull(file, "file"), charset);
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(content, "content");
        WriterHandle h = openWriter(file);
        try {
            h.writer.write(content);
            commit(h);
        } catch (IOException e) {
            rollback(h);
            throw e;
        }
    }

    // ----------------------------
    // JSONL
    // ----------------------------

    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(file, "file");
        String s = Objects.requireNonNull(jsonLine, "jsonLine").trim();
        if (s.isEmpty()) return;
        ensureParentDir(file);
        Files.writeString(file, s + System.lineSeparator(), charset,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    /** Small JSONL files only; use {@link #jsonlStream(Path)} for large ones. */
    public List<String> readJsonl(Path file) throws IOException {
        try (Stream<String> s = jsonlStream(file)) {
            List<String> out = s.collect(Collectors.toList());
            log.debug("readJsonl: {} ({} records)", file, out.size());
            return out;
        }
    }

    /** Trimmed, non-empty JSONL lines. The stream must be closed. */
    public Stream<String> jsonlStream(Path file) throws IOException {
        return Files.lines(Objects.requireNonNull(file, "file"), charset)
                .map(String::trim)
                .filter(x -> !x.isEmpty());
    }

    // ----------------------------
    // Safe Writer API
    // ----------------------------

    /**
     * Opens a writer. With atomic writes the data goes to a temp sibling until
     * {@link #commit(WriterHandle)}; otherwise straight to the target.
     */
    public WriterHandle openWriter(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        ensureParentDir(file);

        Path tmp = atomicWrites ? file.resolveSibling(file.getFileName() + ".tmp") : null;
        BufferedWriter w = Files.newBufferedWriter(tmp != null ? tmp : file, charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return new WriterHandle(file, tmp, w);
    }

    public void commit(WriterHandle h) throws IOException {
        Objects.requireNonNull(h, "handle");
        try {
            h.writer.close();
        } catch (IOException e) {
            log.error("commit: failed to close writer for {}", h.targetFile, e);
            throw e;
        }
        if (h.tmpFile != null) atomicCommit(h.tmpFile, h.targetFile);
    }

    /** Discards whatever was written; with atomic writes the target keeps its previous content. */
    public void rollback(WriterHandle h) {
        if (h == null) return;
        try {
            h.writer.close();
        } catch (IOException e) {
            log.debug("rollback: close failed for {}: {}", h.targetFile, e.toString());
        }
        if (h.tmpFile != null) {
            try {
                Files.deleteIfExists(h.tmpFile);
            } catch (IOException e) {
                log.warn("rollback: failed to delete tmp {}", h.tmpFile, e);
            }
        }
    }

    public static final class WriterHandle {
        public final Path targetFile;
        public final Path tmpFile; // null without atomic writes
        public final BufferedWriter writer;

        private WriterHandle(Path targetFile, Path tmpFile, BufferedWriter writer) {
            this.targetFile = targetFile;
            this.tmpFile = tmpFile;
            this.writer = writer;
        }
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private static void ensureParentDir(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    private static void atomicCommit(Path tmp, Path target) throws IOException {
        try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
            ch.force(true);
        }
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        }
    }
}
