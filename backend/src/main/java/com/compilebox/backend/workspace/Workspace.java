package com.compilebox.backend.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * A private directory holding one request's source file and build output.
 *
 * Created by {@link WorkspaceManager#create}; owned by exactly one request.
 * {@link #close()} deletes the directory tree. Deletion is best-effort:
 * failures are logged and never thrown. A second close is a no-op.
 */
public class Workspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private final String id;
    private final Path   directory;
    private final AtomicBoolean closed = new AtomicBoolean();

    Workspace(String id, Path directory) {
        this.id        = id;
        this.directory = directory;
    }

    public String id()        { return id; }
    public Path   directory() { return directory; }

    public Path resolve(String fileName) {
        return directory.resolve(fileName);
    }

    /** Write {@code content} as UTF-8 to {@code fileName} inside this workspace. */
    public Path writeFile(String fileName, String content) throws IOException {
        Path file = resolve(fileName);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        log.debug("Wrote {} ({} chars) to workspace {}", fileName, content.length(), id);
        return file;
    }

    /** Top-level entries of the workspace, sorted by name. */
    public List<Path> listFiles() throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.sorted(Comparator.comparing(p -> p.getFileName().toString())).toList();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> tree = Files.walk(directory)) {
            tree.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Failed to delete {}: {}", path, e.getMessage());
                }
            });
            log.debug("Deleted workspace {}", directory);
        } catch (IOException e) {
            log.warn("Failed to clean up workspace {}: {}", directory, e.getMessage());
        }
    }
}
