package com.compilebox.backend.workspace;

import com.compilebox.backend.config.CompilerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Creates per-request {@link Workspace}s under the configured temp root and
 * keeps the root itself free of build leftovers.
 */
@Component
public class WorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceManager.class);

    private final Path root;

    public WorkspaceManager(CompilerProperties properties) {
        this.root = properties.tempRoot();
    }

    public Path root() {
        return root;
    }

    /**
     * Create a fresh, empty workspace directory named {@code <prefix>_<uuid>}.
     */
    public Workspace create(String prefix) throws IOException {
        Files.createDirectories(root);
        String id = UUID.randomUUID().toString();
        Path dir = Files.createDirectory(root.resolve(prefix + "_" + id));
        log.debug("Created workspace {}", dir);
        return new Workspace(id, dir);
    }

    /**
     * Delete stray top-level files in the temp root that look like artifacts
     * of an earlier build (sources, executables, {@code temp_*} files).
     * Workspace directories are left alone. Never throws.
     *
     * @return number of files deleted
     */
    public int purgeStaleArtifacts() {
        if (!Files.isDirectory(root)) {
            return 0;
        }
        AtomicInteger deleted = new AtomicInteger();
        try (Stream<Path> entries = Files.list(root)) {
            entries.filter(Files::isRegularFile)
                    .filter(file -> isStaleArtifact(file.getFileName().toString()))
                    .forEach(file -> {
                        try {
                            if (Files.deleteIfExists(file)) {
                                deleted.incrementAndGet();
                                log.debug("Deleted stale artifact {}", file.getFileName());
                            }
                        } catch (IOException e) {
                            log.warn("Failed to delete stale artifact {}: {}", file, e.getMessage());
                        }
                    });
        } catch (IOException e) {
            log.warn("Failed to list {} for cleanup: {}", root, e.getMessage());
        }
        if (deleted.get() > 0) {
            log.info("Purged {} stale artifacts from {}", deleted.get(), root);
        }
        return deleted.get();
    }

    static boolean isStaleArtifact(String fileName) {
        return fileName.endsWith(".tri")
                || fileName.endsWith(".exe")
                || fileName.startsWith("temp_")
                || fileName.equals("privet")
                || fileName.equals("a.out")
                || fileName.equals("main");
    }
}
