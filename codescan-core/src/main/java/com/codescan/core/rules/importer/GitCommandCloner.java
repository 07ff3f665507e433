package com.codescan.core.rules.importer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link RepositoryCloner} that runs the {@code git} executable.
 *
 * <p>Runs {@code git clone --depth 1 --branch <branch> --single-branch --config http.timeout=<s>}
 * and kills the process when it exceeds the same timeout. The combined output of git goes to a
 * scratch log file, so a chatty clone never blocks on a full pipe; the end of that log is
 * included in the error of a failed clone.
 */
public class GitCommandCloner implements RepositoryCloner {

    private static final Logger log = LoggerFactory.getLogger(GitCommandCloner.class);

    static final int OUTPUT_TAIL_CHARS = 2000;

    private final Duration timeout;
    private final String executable;

    public GitCommandCloner() {
        this(Duration.ofSeconds(60));
    }

    public GitCommandCloner(Duration timeout) {
        this(timeout, "git");
    }

    GitCommandCloner(Duration timeout, String executable) {
        this.timeout = timeout;
        this.executable = executable;
    }

    @Override
    public void cloneRepository(String url, String branch, Path target) throws IOException {
        List<String> command = command(url, branch, target);
        log.debug("Running: {}", String.join(" ", command));

        Path output = Files.createTempFile("codescan-git-", ".log");
        try {
            Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(output.toFile())
                .start();
            try {
                boolean finished = process.waitFor(timeout.toSeconds(), TimeUnit.SECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    throw new IOException("git clone timed out after " + timeout.toSeconds() + "s");
                }
                if (process.exitValue() != 0) {
                    throw new IOException("git clone exited with " + process.exitValue() + ": " + tail(output));
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new IOException("git clone interrupted", e);
            }
        } finally {
            Files.deleteIfExists(output);
        }
    }

    List<String> command(String url, String branch, Path target) {
        return List.of(
            executable, "clone",
            "--depth", "1",
            "--branch", branch,
            "--single-branch",
            "--config", "http.timeout=" + timeout.toSeconds(),
            url,
            target.toString()
        );
    }

    private static String tail(Path output) throws IOException {
        String text = new String(Files.readAllBytes(output), StandardCharsets.UTF_8).trim();
        return text.length() <= OUTPUT_TAIL_CHARS ? text : text.substring(text.length() - OUTPUT_TAIL_CHARS);
    }
}
