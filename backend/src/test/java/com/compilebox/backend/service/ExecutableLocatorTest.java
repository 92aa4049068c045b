package com.compilebox.backend.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutableLocatorTest {

    @TempDir Path dir;

    @Test
    void locate_baseNamePreferredOverLegacyNames() throws Exception {
        Files.writeString(dir.resolve("temp_ab.tri"), "src");
        Files.writeString(dir.resolve("temp_ab"), "bin");
        Files.writeString(dir.resolve("a.out"), "bin");

        assertThat(ExecutableLocator.locate(dir, "temp_ab", "temp_ab.tri")).contains(dir.resolve("temp_ab"));
    }

    @Test
    void locate_scanSkipsSourceHiddenAndDottedFiles() throws Exception {
        Files.writeString(dir.resolve("temp_ab.tri"), "src");
        Files.writeString(dir.resolve(".cache"), "x");
        Files.writeString(dir.resolve("_build"), "x");
        Files.writeString(dir.resolve("report.txt"), "x");
        Files.writeString(dir.resolve("program"), "bin");

        assertThat(ExecutableLocator.locate(dir, "temp_ab", "temp_ab.tri")).contains(dir.resolve("program"));
    }

    @Test
    void findConventional_ignoresScannedNames() throws Exception {
        Files.writeString(dir.resolve("program"), "bin");

        assertThat(ExecutableLocator.findConventional(dir, "temp_ab")).isEmpty();
        assertThat(ExecutableLocator.locate(dir, "temp_ab", "temp_ab.tri")).contains(dir.resolve("program"));
    }

    @Test
    void locate_nothingExecutable_isEmpty() throws Exception {
        Files.writeString(dir.resolve("temp_ab.tri"), "src");

        assertThat(ExecutableLocator.locate(dir, "temp_ab", "temp_ab.tri")).isEmpty();
    }

    @Test
    void looksExecutable_acceptsExeAndExtensionless() {
        assertThat(ExecutableLocator.looksExecutable("prog.exe", "s.tri")).isTrue();
        assertThat(ExecutableLocator.looksExecutable("prog", "s.tri")).isTrue();
        assertThat(ExecutableLocator.looksExecutable("prog.o", "s.tri")).isFalse();
    }
}
