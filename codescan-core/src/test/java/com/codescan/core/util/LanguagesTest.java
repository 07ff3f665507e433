package com.codescan.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Languages}.
 */
class LanguagesTest {

    @ParameterizedTest
    @CsvSource({
        "app.py, python",
        "Main.JAVA, java",
        "index.tsx, typescript",
        "server.go, go",
        "engine.cpp, cpp",
        "Program.cs, csharp",
        "Module.vb, visualbasic",
        "notes.txt, unknown",
        "Makefile, unknown"
    })
    void of_mapsExtensionToLanguage(String fileName, String language) {
        assertThat(Languages.of(Path.of("src", fileName))).isEqualTo(language);
    }

    @Test
    void extension_usesLastDotOnly() {
        assertThat(Languages.extension(Path.of("backup.tar.GZ"))).hasValue(".gz");
    }

    @Test
    void extension_dotFileOrTrailingDot_hasNone() {
        assertThat(Languages.extension(Path.of(".gitignore"))).isEmpty();
        assertThat(Languages.extension(Path.of("weird."))).isEmpty();
        assertThat(Languages.extension(Path.of("LICENSE"))).isEmpty();
    }

    @Test
    void known_containsMappedLanguagesOnly() {
        assertThat(Languages.known()).contains("python", "javascript", "java").doesNotContain(Languages.UNKNOWN);
    }
}
