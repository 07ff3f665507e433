package com.codescan.core.scanner;

import com.codescan.core.config.ScanSettings;
import com.codescan.core.model.ScanResult;
import com.codescan.core.model.ScanStats;
import com.codescan.core.model.ScanType;
import com.codescan.core.model.VulnerabilityIssue;
import com.codescan.core.provider.AnalysisAdapter;
import com.codescan.core.rules.PatternMatchEngine;
import com.codescan.core.rules.RuleSet;
import com.codescan.core.util.Languages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs file analysis over a directory, a single file or a list of changed files.
 *
 * <p>A directory scan goes through four phases:
 * <ol>
 *   <li><b>collecting</b>: {@link FileCollector} lists the eligible files (5% and 10%)</li>
 *   <li><b>analyzing</b>: a fixed pool of worker threads runs {@link FileAnalyzer} on every
 *       file, with at most one file per worker in flight; each completion is aggregated on
 *       the calling thread and reported as {@code 10 + 70 * completed / total} percent</li>
 *   <li><b>aggregating</b>: statistics (85%), optional project summary (90%) and the result
 *       (95%)</li>
 *   <li><b>done</b> (100%)</li>
 * </ol>
 * Failures at any stage end up in {@link ScanStats#error()}; nothing is thrown to the caller.
 * A file whose analysis fails is logged and skipped; it still counts towards the extension
 * statistics but contributes no lines, language or findings.
 *
 * <p>Findings of different files are aggregated in completion order. Once the
 * {@link ScanCancellation} is set no further file is dispatched; files already handed to a
 * worker are awaited and aggregated.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ScanOrchestrator orchestrator = ScanOrchestrator.create(config.scan(), adapter, ruleStore);
 * ScanResult result = orchestrator.scanDirectory(Path.of("src"), 8,
 *     (message, percent) -> System.out.println(percent + "% " + message), new ScanCancellation());
 * }</pre>
 */
public class ScanOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

    static final String NO_FILES = "No scannable files found";

    private final FileAnalyzer analyzer;
    private final PathFilter filter;
    private final FileCollector collector;
    private final ProjectSummarizer summarizer;
    private final Clock clock;

    /**
     * Creates an orchestrator.
     *
     * @param analyzer per-file analyzer
     * @param filter path filter
     * @param summarizer project summarizer, or null to skip summaries
     * @param clock clock for scan ids and timestamps
     */
    public ScanOrchestrator(FileAnalyzer analyzer, PathFilter filter, ProjectSummarizer summarizer, Clock clock) {
        this.analyzer = analyzer;
        this.filter = filter;
        this.collector = new FileCollector(filter);
        this.summarizer = summarizer;
        this.clock = clock;
    }

    /**
     * Wires an orchestrator from settings, an adapter and the active rules.
     *
     * @param settings scan settings
     * @param adapter analysis adapter
     * @param rules active rules
     * @return orchestrator using the system clock
     */
    public static ScanOrchestrator create(ScanSettings settings, AnalysisAdapter adapter, RuleSet rules) {
        PathFilter filter = new PathFilter(settings);
        FileAnalyzer analyzer = new FileAnalyzer(adapter, new PatternMatchEngine(rules));
        ProjectSummarizer summarizer = settings.summarizeProject() ? new ProjectSummarizer(adapter, filter) : null;
        return new ScanOrchestrator(analyzer, filter, summarizer, Clock.systemUTC());
    }

    public ScanResult scanDirectory(Path directory, int concurrency) {
        return scanDirectory(directory, concurrency, ScanProgressListener.NONE, new ScanCancellation());
    }

    public ScanResult scanDirectory(Path directory, int concurrency, ScanProgressListener listener) {
        return scanDirectory(directory, concurrency, listener, new ScanCancellation());
    }

    /**
     * Scans every eligible file below a directory.
     *
     * @param directory directory to scan
     * @param concurrency number of worker threads, at least 1 is used
     * @param listener progress listener
     * @param cancellation cooperative cancellation flag
     * @return scan result, with {@code stats.error} set when the scan failed or found no files
     */
    public ScanResult scanDirectory(Path directory, int concurrency, ScanProgressListener listener,
                                    ScanCancellation cancellation) {
        long startedAt = clock.millis();
        String scanId = "dir_" + startedAt / 1000;
        Progress progress = new Progress(listener, cancellation);

        if (!Files.isDirectory(directory)) {
            log.error("Not a directory: {}", directory);
            return result(scanId, directory, ScanType.DIRECTORY, startedAt, List.of(),
                ScanStats.failed("Not a directory: " + directory), Map.of());
        }

        log.info("Scanning directory {} with {} workers", directory, Math.max(1, concurrency));
        progress.report("Collecting files...", 5);
        List<Path> files;
        try {
            files = collector.collect(directory);
        } catch (IOException e) {
            log.error("Cannot collect files in {}", directory, e);
            progress.report("Scan failed: " + e.getMessage(), 100);
            return result(scanId, directory, ScanType.DIRECTORY, startedAt, List.of(),
                ScanStats.failed(e.getMessage()), Map.of());
        }

        log.info("Found {} files to scan", files.size());
        progress.report("Found " + files.size() + " files to scan", 10);
        if (files.isEmpty()) {
            log.warn("No scannable files in {}", directory);
            progress.report(NO_FILES, 100);
            return result(scanId, directory, ScanType.DIRECTORY, startedAt, List.of(),
                ScanStats.failed(NO_FILES), Map.of());
        }

        Aggregate aggregate = analyzeAll(files, concurrency, progress, cancellation);

        progress.report("Generating project statistics...", 85);
        ScanStats stats = aggregate.toStats(files.size(), cancellation.isCancelled());

        Map<String, Object> projectInfo;
        if (summarizer != null && !cancellation.isCancelled()) {
            progress.report("Analyzing project...", 90);
            projectInfo = summarizer.summarize(directory, stats);
        } else {
            projectInfo = ProjectSummarizer.basicInfo(stats);
        }

        progress.report("Scan finished, preparing results...", 95);
        ScanResult result = result(scanId, directory, ScanType.DIRECTORY, startedAt,
            aggregate.findings, stats, projectInfo);
        log.info("Scan of {} complete: {} files, {} findings{}", directory, stats.totalFiles(),
            result.totalIssues(), stats.cancelled() ? " (cancelled)" : "");
        progress.report("Scan complete", 100);
        return result;
    }

    /**
     * Scans a single file.
     *
     * @param file file to scan
     * @return scan result; empty for excluded files, with {@code stats.error} for missing or
     *         unreadable ones
     */
    public ScanResult scanFile(Path file) {
        long startedAt = clock.millis();
        String scanId = "file_" + startedAt / 1000;

        if (!Files.isRegularFile(file)) {
            log.error("File not found: {}", file);
            return result(scanId, file, ScanType.FILE, startedAt, List.of(),
                ScanStats.failed("File not found: " + file), Map.of());
        }
        if (filter.shouldExclude(file)) {
            log.info("Skipping excluded file: {}", file);
            return result(scanId, file, ScanType.FILE, startedAt, List.of(), ScanStats.empty(), Map.of());
        }

        FileReport report;
        long size;
        try {
            report = analyzer.analyze(file);
            size = Files.size(file);
        } catch (IOException e) {
            log.error("Cannot scan {}: {}", file, e.getMessage());
            return result(scanId, file, ScanType.FILE, startedAt, List.of(),
                ScanStats.failed(e.getMessage()), Map.of());
        }

        Aggregate aggregate = new Aggregate();
        aggregate.countExtension(file);
        aggregate.add(report);

        Map<String, Object> projectInfo = new LinkedHashMap<>();
        projectInfo.put("language", report.language());
        projectInfo.put("file_size_bytes", size);
        return result(scanId, file, ScanType.FILE, startedAt, aggregate.findings,
            aggregate.toStats(1, false), projectInfo);
    }

    /**
     * Scans a list of files relative to a base directory, such as the files changed by a merge.
     *
     * <p>Only listed files that exist and pass the filter are analysed. Repository history is
     * not inspected.
     *
     * @param base base directory
     * @param relativePaths paths relative to {@code base}
     * @param scanId identifier of this scan
     * @param listener progress listener
     * @return scan result of type {@link ScanType#GIT_MERGE}
     */
    public ScanResult scanPaths(Path base, List<String> relativePaths, String scanId, ScanProgressListener listener) {
        long startedAt = clock.millis();
        ScanCancellation cancellation = new ScanCancellation();
        Progress progress = new Progress(listener, cancellation);

        List<Path> files = new ArrayList<>();
        for (String relative : relativePaths) {
            Path file = base.resolve(relative);
            if (Files.isRegularFile(file) && !filter.shouldExclude(file)) {
                files.add(file);
            } else {
                log.debug("Skipping changed path {}", relative);
            }
        }
        progress.report("Found " + files.size() + " files to scan", 10);

        Aggregate aggregate = analyzeAll(files, 1, progress, cancellation);
        Map<String, Object> projectInfo = new LinkedHashMap<>();
        projectInfo.put("merge_info", Map.of("diff_files", List.copyOf(relativePaths)));

        ScanResult result = result(scanId, base, ScanType.GIT_MERGE, startedAt, aggregate.findings,
            aggregate.toStats(relativePaths.size(), false), projectInfo);
        progress.report("Scan complete", 100);
        return result;
    }

    private Aggregate analyzeAll(List<Path> files, int concurrency, Progress progress, ScanCancellation cancellation) {
        Aggregate aggregate = new Aggregate();
        int total = files.size();
        if (total == 0) {
            return aggregate;
        }

        int workers = Math.max(1, concurrency);
        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        CompletionService<FileReport> completion = new ExecutorCompletionService<>(pool);
        Map<Future<FileReport>, Path> inFlight = new HashMap<>();
        int next = 0;
        try {
            // At most one file per worker is handed to the pool; the rest wait for a completion.
            while (next < total && inFlight.size() < workers && !cancellation.isCancelled()) {
                Path file = files.get(next++);
                inFlight.put(completion.submit(() -> analyzer.analyze(file)), file);
            }
            if (inFlight.isEmpty()) {
                log.info("Scan cancelled before any of {} files was dispatched", total);
            }

            int completed = 0;
            while (!inFlight.isEmpty()) {
                Future<FileReport> future = completion.take();
                Path file = inFlight.remove(future);
                completed++;
                aggregate.countExtension(file);
                try {
                    aggregate.add(future.get());
                } catch (ExecutionException e) {
                    log.warn("Skipping {}: {}", file, e.getCause().toString());
                }
                log.debug("Analyzed ({}/{}): {}", completed, total, file);
                progress.report("Scanning (" + completed + "/" + total + "): " + file.getFileName(),
                    10 + (int) (70.0 * completed / total));

                if (next < total) {
                    if (cancellation.isCancelled()) {
                        log.info("Scan cancelled, {} of {} files dispatched", next, total);
                        next = total;
                    } else {
                        Path nextFile = files.get(next++);
                        inFlight.put(completion.submit(() -> analyzer.analyze(nextFile)), nextFile);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scan interrupted, stopping workers");
            cancellation.cancel();
            pool.shutdownNow();
        } finally {
            pool.shutdown();
        }
        return aggregate;
    }

    private static ScanResult result(String scanId, Path path, ScanType type, long timestamp,
                                     List<VulnerabilityIssue> findings, ScanStats stats,
                                     Map<String, Object> projectInfo) {
        return new ScanResult(scanId, path.toString(), type, timestamp, findings, stats, projectInfo);
    }

    /**
     * Findings and counters, only touched by the aggregating thread.
     */
    private static final class Aggregate {
        private final List<VulnerabilityIssue> findings = new ArrayList<>();
        private final Map<String, Integer> languages = new TreeMap<>();
        private final Map<String, Integer> extensions = new TreeMap<>();
        private long lines;

        void add(FileReport report) {
            findings.addAll(report.findings());
            lines += report.linesOfCode();
            languages.merge(report.language(), 1, Integer::sum);
        }

        void countExtension(Path file) {
            Languages.extension(file).ifPresent(extension -> extensions.merge(extension, 1, Integer::sum));
        }

        ScanStats toStats(int totalFiles, boolean cancelled) {
            return new ScanStats(totalFiles, lines, languages, extensions, null, cancelled);
        }
    }

    /**
     * Forwards progress while the scan is not cancelled, never letting the percentage drop.
     */
    private static final class Progress {
        private final ScanProgressListener listener;
        private final ScanCancellation cancellation;
        private int last;

        Progress(ScanProgressListener listener, ScanCancellation cancellation) {
            this.listener = listener == null ? ScanProgressListener.NONE : listener;
            this.cancellation = cancellation;
        }

        void report(String message, int percent) {
            if (cancellation.isCancelled()) {
                return;
            }
            last = Math.max(last, Math.min(100, percent));
            listener.onProgress(message, last);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "codescan-worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
