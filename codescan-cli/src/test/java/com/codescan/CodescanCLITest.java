package com.codescan;

import com.codescan.core.model.ScanResult;
import com.codescan.core.model.ScanType;
import com.codescan.core.model.Severity;
import com.codescan.core.serialization.ScanResultCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CodescanCLI} and its subcommands.
 */
class CodescanCLITest {

    private static final String PYTHON_RULES = """
        rules:
          - id: pickle-load
            message: Untrusted data passed to pickle
            severity: ERROR
            languages: [python]
            pattern: pickle.loads(...)
          - id: yaml-load
            message: Unsafe yaml load
            severity: WARNING
            languages: [python]
            pattern: yaml.load($X)
        """;

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream outputStream;
    private ByteArrayOutputStream errorStream;

    private Path project;
    private Path rulesDir;
    private Path configFile;

    @BeforeEach
    void setUp() throws IOException {
        outputStream = new ByteArrayOutputStream();
        errorStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errorStream, true, StandardCharsets.UTF_8));

        project = Files.createDirectories(tempDir.resolve("project"));
        Files.writeString(project.resolve("app.py"), "import os\nos.system(cmd)\n");
        rulesDir = tempDir.resolve("vulndb");
        configFile = tempDir.resolve("missing-config.yaml");
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int run(String... args) {
        return CodescanCLI.commandLine().execute(args);
    }

    private String output() {
        return outputStream.toString(StandardCharsets.UTF_8);
    }

    private String errors() {
        return errorStream.toString(StandardCharsets.UTF_8);
    }

    @Test
    void noCommand_printsBanner() {
        // When
        int exitCode = run();

        // Then
        assertThat(exitCode).isZero();
        assertThat(output()).contains("CodeScan - Security Vulnerability Scanner");
    }

    @Test
    void quiet_noCommand_printsNothing() {
        // When
        int exitCode = run("-q");

        // Then
        assertThat(exitCode).isZero();
        assertThat(output()).isEmpty();
    }

    @Test
    void scan_rulesOnlyDirectory_writesJsonReport() throws IOException {
        // Given
        Path report = tempDir.resolve("report.json");

        // When
        int exitCode = run("scan", project.toString(), "--rules-only",
            "--rules-dir", rulesDir.toString(), "-c", configFile.toString(),
            "--workers", "2", "-o", report.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(output())
            .contains("✓ Loaded 8 rules")
            .contains("✓ Scanned 1 files")
            .contains("Findings: 1")
            .contains("critical")
            .contains("✓ Scan complete");

        ScanResult result = ScanResultCodec.read(report);
        assertThat(result.scanType()).isEqualTo(ScanType.DIRECTORY);
        assertThat(result.findings()).singleElement().satisfies(issue -> {
            assertThat(issue.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(issue.lineNumber()).isEqualTo(2);
            assertThat(issue.filePath()).endsWith("app.py");
        });
        assertThat(result.stats().languages()).containsEntry("python", 1);
        assertThat(Files.exists(rulesDir.resolve("vulndb.json"))).isTrue();
    }

    @Test
    void scan_rulesOnlySingleFile_producesFileScan() throws IOException {
        // Given
        Path report = tempDir.resolve("file-report.json");

        // When
        int exitCode = run("scan", project.resolve("app.py").toString(), "--rules-only",
            "--rules-dir", rulesDir.toString(), "-c", configFile.toString(), "-o", report.toString());

        // Then
        assertThat(exitCode).isZero();
        ScanResult result = ScanResultCodec.read(report);
        assertThat(result.scanType()).isEqualTo(ScanType.FILE);
        assertThat(result.totalIssues()).isEqualTo(1);
    }

    @Test
    void scan_missingPath_returnsOne() {
        // When
        int exitCode = run("scan", tempDir.resolve("does-not-exist").toString(), "--rules-only",
            "--rules-dir", rulesDir.toString(), "-c", configFile.toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("Not a directory");
    }

    @Test
    void scan_unknownModelProfile_returnsOne() {
        // When
        int exitCode = run("scan", project.toString(), "--model", "nonexistent",
            "--rules-dir", rulesDir.toString(), "-c", configFile.toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("✗ Scan failed: Unknown model profile: nonexistent");
    }

    @Test
    void rulesList_freshStore_showsDefaultBuckets() {
        // When
        int exitCode = run("rules", "--rules-dir", rulesDir.toString(), "-c", configFile.toString(), "list");

        // Then
        assertThat(exitCode).isZero();
        assertThat(output())
            .contains("common")
            .contains("python")
            .contains("javascript")
            .contains("java")
            .contains("Total: 8 rules");
    }

    @Test
    void rulesList_bucket_showsPatterns() {
        // When
        int exitCode = run("rules", "--rules-dir", rulesDir.toString(), "-c", configFile.toString(), "list", "python");

        // Then
        assertThat(exitCode).isZero();
        assertThat(output())
            .contains("python-1")
            .contains("Pattern: os\\.system|subprocess\\.call|eval\\(");
    }

    @Test
    void rulesList_unknownBucket_returnsOne() {
        // When
        int exitCode = run("rules", "--rules-dir", rulesDir.toString(), "-c", configFile.toString(), "list", "cobol");

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("Unknown bucket: cobol");
    }

    @Test
    void rulesImportDir_semgrepRules_addsToPythonBucket() throws IOException {
        // Given
        Path semgrep = Files.createDirectories(tempDir.resolve("semgrep"));
        Files.writeString(semgrep.resolve("python.yaml"), PYTHON_RULES);

        // When
        int exitCode = run("rules", "--rules-dir", rulesDir.toString(), "-c", configFile.toString(),
            "import-dir", semgrep.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(output()).contains("✓ Imported 2 new rules");

        outputStream.reset();
        run("rules", "--rules-dir", rulesDir.toString(), "-c", configFile.toString(), "list");
        assertThat(output()).contains("Total: 10 rules");
    }

    @Test
    void rulesImportDir_missingDirectory_returnsOne() {
        // When
        int exitCode = run("rules", "--rules-dir", rulesDir.toString(), "-c", configFile.toString(),
            "import-dir", tempDir.resolve("nowhere").toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("✗ Import from");
    }

    @Test
    void rulesExport_bucket_writesOnlyThatBucket() throws IOException {
        // Given
        Path target = tempDir.resolve("python-rules.json");

        // When
        int exitCode = run("rules", "--rules-dir", rulesDir.toString(), "-c", configFile.toString(),
            "export", target.toString(), "--bucket", "python");

        // Then
        assertThat(exitCode).isZero();
        String exported = Files.readString(target);
        assertThat(exported).contains("\"python\"").contains("python-2").doesNotContain("\"common\"");
    }

    @Test
    void rulesUpdate_unreachableFeed_returnsOneAndKeepsStore() {
        // When
        int exitCode = run("rules", "--rules-dir", rulesDir.toString(), "-c", configFile.toString(),
            "update", "--url", "http://127.0.0.1:1/latest.json");

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("Rule update failed");
        assertThat(Files.exists(rulesDir.resolve("vulndb.json"))).isTrue();
    }
}
