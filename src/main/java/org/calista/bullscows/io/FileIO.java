package org.calista.bullscows.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.Objects;

/**
 * FileIO: single entry point for file access (config files).
 *
 * <ul>
 *   <li>sandboxed resolve: relative paths only, no escaping baseDir via ".."</li>
 *   <li>atomic writes: temp sibling + move, with a non-atomic fallback</li>
 *   <li>unchanged content is not rewritten</li>
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
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}", this.baseDir, charset, atomicWrites);
        try {
            Files.createDirectories(this.baseDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists", e);
        }
    }

    /**
     * Resolves a relative path inside baseDir. Absolute paths and ".." escapes are rejected.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, charset);
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");

        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);

        if (isSameContent(file, content)) {
            log.debug("writeString: skip unchanged content for {}", file);
            return;
        }

        if (!atomicWrites) {
            Files.writeString(file, content, charset, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return;
        }

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, content, charset, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        atomicCommit(tmp, file);
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private boolean isSameContent(Path file, String content) throws IOException {
        if (!Files.isRegularFile(file)) return false;
        return content.equals(Files.readString(file, charset));
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            // a failed move leaves the temp file behind
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.debug("atomicCommit: could not remove {}: {}", tmp, e.toString());
            }
        }
    }
}
