package com.codegraph.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void relativePath_withNestedFile_usesForwardSlashes() {
        Path file = tempDir.resolve("pkg").resolve("sub").resolve("a.py");

        assertThat(FileUtils.relativePath(tempDir, file)).isEqualTo("pkg/sub/a.py");
    }

    @Test
    void toUnixPath_withBackslashes_replacesThem() {
        assertThat(FileUtils.toUnixPath("src\\main\\App.java")).isEqualTo("src/main/App.java");
    }

    @ParameterizedTest
    @CsvSource({
        "App.java, java",
        "src/Main.TS, ts",
        "pkg.v2/readme, ''",
        ".gitignore, ''",
        "archive.tar.gz, gz"
    })
    void getExtension_returnsLowercaseExtension(String fileName, String expected) {
        assertThat(FileUtils.getExtension(fileName)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "pkg/a.py, pkg.a",
        "./src/app/main.ts, src.app.main",
        "Main.java, Main",
        "scripts/run, scripts.run",
        "pkg/.hidden, pkg..hidden"
    })
    void moduleName_derivesDottedName(String path, String expected) {
        assertThat(FileUtils.moduleName(path)).isEqualTo(expected);
    }

    @Test
    void directoryOf_withRootFile_returnsDot() {
        assertThat(FileUtils.directoryOf("a.py")).isEqualTo(".");
        assertThat(FileUtils.directoryOf("pkg/sub/a.py")).isEqualTo("pkg/sub");
    }

    @Test
    void matchesAny_withFileNamePattern_matchesNestedFiles() {
        List<PathMatcher> matchers = FileUtils.globMatchers(List.of("*.min.js", " ", "vendor/**"));

        assertThat(matchers).hasSize(2);
        assertThat(FileUtils.matchesAny("static/app.min.js", matchers)).isTrue();
        assertThat(FileUtils.matchesAny("vendor/lib/x.js", matchers)).isTrue();
        assertThat(FileUtils.matchesAny("src/app.js", matchers)).isFalse();
    }

    @Test
    void matchesAny_withoutMatchers_returnsFalse() {
        assertThat(FileUtils.matchesAny("a.py", FileUtils.globMatchers(null))).isFalse();
    }
}
