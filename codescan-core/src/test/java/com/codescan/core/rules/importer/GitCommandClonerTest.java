package com.codescan.core.rules.importer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GitCommandCloner}, with a shell script standing in for {@code git}.
 */
class GitCommandClonerTest {

    @TempDir
    Path tempDir;

    private Path script(String body) throws IOException {
        Path script = tempDir.resolve("fake-git.sh");
        Files.writeString(script, "#!/bin/sh\n" + body);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwx------"));
        return script;
    }

    @Test
    void command_buildsShallowSingleBranchClone() {
        GitCommandCloner cloner = new GitCommandCloner(Duration.ofSeconds(30));

        assertThat(cloner.command("https://example.com/rules.git", "develop", tempDir.resolve("clone")))
            .containsExactly("git", "clone", "--depth", "1", "--branch", "develop", "--single-branch",
                "--config", "http.timeout=30", "https://example.com/rules.git",
                tempDir.resolve("clone").toString());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void cloneRepository_verboseFailingGit_reportsExitCodeInsteadOfTimingOut() throws IOException {
        // Given
        Path git = script("""
            head -c 1000000 /dev/zero | tr '\\000' 'x' >&2
            echo
            echo "fatal: Remote branch develop not found" >&2
            exit 3
            """);
        GitCommandCloner cloner = new GitCommandCloner(Duration.ofSeconds(20), git.toString());

        // When / Then
        long started = System.nanoTime();
        assertThatThrownBy(() -> cloner.cloneRepository("https://example.com/rules.git", "develop", tempDir.resolve("clone")))
            .isInstanceOf(IOException.class)
            .hasMessageStartingWith("git clone exited with 3")
            .hasMessageEndingWith("fatal: Remote branch develop not found");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(20));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void cloneRepository_successfulGit_leavesNoLogBehind() throws IOException {
        // Given
        Path git = script("echo cloning; exit 0\n");
        GitCommandCloner cloner = new GitCommandCloner(Duration.ofSeconds(20), git.toString());
        long logsBefore = countLogs();

        // When
        cloner.cloneRepository("https://example.com/rules.git", "main", tempDir.resolve("clone"));

        // Then
        assertThat(countLogs()).isEqualTo(logsBefore);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void cloneRepository_hangingGit_timesOut() throws IOException {
        Path git = script("sleep 30\n");
        GitCommandCloner cloner = new GitCommandCloner(Duration.ofSeconds(1), git.toString());

        assertThatThrownBy(() -> cloner.cloneRepository("https://example.com/rules.git", "main", tempDir.resolve("clone")))
            .isInstanceOf(IOException.class)
            .hasMessage("git clone timed out after 1s");
    }

    private static long countLogs() throws IOException {
        try (Stream<Path> files = Files.list(Path.of(System.getProperty("java.io.tmpdir")))) {
            return files.filter(file -> file.getFileName().toString().startsWith("codescan-git-")).count();
        }
    }
}
