package com.compilebox.backend.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CompilerPropertiesTest {

    @TempDir Path root;

    @Test
    void staleProcessAge_notSet_defaultsToZero() {
        CompilerProperties props = PropertiesFixtures.forRoot(root);

        assertThat(props.staleProcessAge()).isEqualTo(Duration.ZERO);
    }

    @Test
    void tempRoot_isAbsoluteAndNormalized() {
        CompilerProperties props = PropertiesFixtures.forRoot(root.resolve("a/../b"));

        assertThat(props.tempRoot()).isAbsolute().isEqualTo(root.resolve("b").toAbsolutePath());
    }

    @Test
    void flagLists_nullBecomesEmpty() {
        CompilerProperties props = new CompilerProperties("c", "t", Duration.ofSeconds(1), Duration.ofSeconds(1),
                1, 1, "ok", null, null, "", Duration.ofSeconds(1), Duration.ofSeconds(3));

        assertThat(props.compileFlags()).isEmpty();
        assertThat(props.astFlags()).isEmpty();
        assertThat(props.staleProcessAge()).isEqualTo(Duration.ofSeconds(3));
    }
}
