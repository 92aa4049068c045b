package com.compilebox.backend.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Finds the program the compiler produced in a workspace.
 *
 * The compiler's naming of its output is not fixed, so a few conventional
 * names are tried before falling back to a scan of the directory.
 */
final class ExecutableLocator {

    private static final Logger log = LoggerFactory.getLogger(ExecutableLocator.class);

    static final List<String> LEGACY_NAMES = List.of("privet", "privet.exe", "a.out");

    private ExecutableLocator() {}

    /**
     * @param directory  workspace the compiler ran in
     * @param baseName   source file name without its {@code .tri} suffix
     * @param sourceFile source file name, never returned
     */
    static Optional<Path> locate(Path directory, String baseName, String sourceFile) {
        Optional<Path> conventional = findConventional(directory, baseName);
        if (conventional.isPresent()) {
            return conventional;
        }
        try (Stream<Path> entries = Files.list(directory)) {
            Optional<Path> scanned = entries
                    .filter(Files::isRegularFile)
                    .filter(path -> looksExecutable(path.getFileName().toString(), sourceFile))
                    .min(Comparator.comparing(path -> path.getFileName().toString()));
            scanned.ifPresent(path -> log.debug("Found executable {} by directory scan", path.getFileName()));
            return scanned;
        } catch (IOException e) {
            log.warn("Failed to scan {} for an executable: {}", directory, e.getMessage());
            return Optional.empty();
        }
    }

    /** Only the conventional output names, no directory scan. */
    static Optional<Path> findConventional(Path directory, String baseName) {
        for (String candidate : candidates(baseName)) {
            Path path = directory.resolve(candidate);
            if (Files.isRegularFile(path)) {
                log.debug("Found executable {}", candidate);
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }

    static List<String> candidates(String baseName) {
        return Stream.concat(Stream.of(baseName, baseName + ".exe"), LEGACY_NAMES.stream()).toList();
    }

    static boolean looksExecutable(String fileName, String sourceFile) {
        if (fileName.equals(sourceFile) || fileName.startsWith(".") || fileName.startsWith("_")) {
            return false;
        }
        return fileName.endsWith(".exe") || !fileName.contains(".");
    }
}
