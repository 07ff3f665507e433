package com.codescan.core.scanner;

import com.codescan.core.model.Confidence;
import com.codescan.core.model.Severity;
import com.codescan.core.model.VulnerabilityIssue;
import com.codescan.core.provider.AnalysisAdapter;
import com.codescan.core.provider.ProviderException;
import com.codescan.core.rules.PatternMatchEngine;
import com.codescan.core.util.FileUtils;
import com.codescan.core.util.Languages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Produces the findings of a single file.
 *
 * <p>The file content is sent to the {@link AnalysisAdapter} and the response parsed into
 * findings, then the {@link PatternMatchEngine} runs over the same content. Provider findings
 * come first, rule findings after them, without deduplication.
 *
 * <p>Failures never escape as exceptions, except an unreadable file:
 * <ul>
 *   <li>a provider failure yields a single informational finding naming the failure kind,
 *       and no rule findings</li>
 *   <li>unparseable provider output yields an informational finding, followed by the rule
 *       findings</li>
 * </ul>
 */
public class FileAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FileAnalyzer.class);

    static final String PARSE_FAILURE_DESCRIPTION =
        "The model did not return findings in the expected JSON format; deep analysis could not be completed";
    static final String PARSE_FAILURE_RECOMMENDATION = "Check the API configuration and try again";
    static final String PROVIDER_FAILURE_RECOMMENDATION =
        "Check the API settings: make sure the API key is valid and the network connection is available.";

    private final AnalysisAdapter adapter;
    private final PatternMatchEngine engine;
    private final FindingResponseParser parser;

    public FileAnalyzer(AnalysisAdapter adapter, PatternMatchEngine engine) {
        this(adapter, engine, new FindingResponseParser());
    }

    public FileAnalyzer(AnalysisAdapter adapter, PatternMatchEngine engine, FindingResponseParser parser) {
        this.adapter = adapter;
        this.engine = engine;
        this.parser = parser;
    }

    /**
     * Analyses a file.
     *
     * @param file file to analyse
     * @return findings of the file
     * @throws IOException if the file cannot be read
     */
    public List<VulnerabilityIssue> analyzeFile(Path file) throws IOException {
        return analyze(file).findings();
    }

    /**
     * Analyses a file and reports its language and line count alongside the findings.
     *
     * @param file file to analyse
     * @return file report
     * @throws IOException if the file cannot be read
     */
    public FileReport analyze(Path file) throws IOException {
        String content = FileUtils.readLenient(file);
        String language = Languages.of(file);
        return new FileReport(file, language, FileUtils.countLines(content), analyzeContent(file, language, content));
    }

    List<VulnerabilityIssue> analyzeContent(Path file, String language, String content) {
        String filePath = file.toString();
        AnalysisOutcome outcome = requestFindings(file, language, content);

        List<VulnerabilityIssue> findings = new ArrayList<>();
        if (outcome.isSuccess()) {
            findings.addAll(outcome.findings());
        } else if (outcome.failure().kind() == AnalysisFailure.Kind.PARSE) {
            log.warn("Cannot parse provider output for {}: {}", file, outcome.failure().message());
            findings.add(VulnerabilityIssue.unlocated(
                Severity.INFO, filePath, PARSE_FAILURE_DESCRIPTION, PARSE_FAILURE_RECOMMENDATION, Confidence.LOW));
        } else {
            AnalysisFailure failure = outcome.failure();
            log.warn("Provider failed for {}: {} {}", file, failure.kind(), failure.message());
            return List.of(VulnerabilityIssue.unlocated(
                Severity.INFO,
                filePath,
                failure.kind().label() + " error while calling the analysis provider: " + failure.message(),
                PROVIDER_FAILURE_RECOMMENDATION,
                Confidence.HIGH));
        }

        findings.addAll(engine.match(file, language, content));
        return findings;
    }

    private AnalysisOutcome requestFindings(Path file, String language, String content) {
        String response;
        try {
            log.debug("Requesting provider analysis of {}", file);
            response = adapter.analyze(AnalysisPrompts.forFile(file, language, content));
        } catch (ProviderException e) {
            return AnalysisOutcome.failed(AnalysisFailure.from(e));
        }
        return parser.parse(response, file.toString());
    }
}
