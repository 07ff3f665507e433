package com.codescan.core.scanner;

import com.codescan.core.model.Confidence;
import com.codescan.core.model.Severity;
import com.codescan.core.model.VulnerabilityIssue;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FindingResponseParser}.
 */
class FindingResponseParserTest {

    private final FindingResponseParser parser = new FindingResponseParser();

    @Test
    void parse_fencedJsonBlock_returnsFindings() {
        // Given
        String response = """
            Here is what I found:
            ```json
            [
              {"severity": "high", "description": "SQL built from input", "line_number": 12,
               "code_snippet": "cursor.execute(q)", "recommendation": "Use parameters",
               "cwe_id": "CWE-89", "confidence": "high"}
            ]
            ```
            """;

        // When
        AnalysisOutcome outcome = parser.parse(response, "app.py");

        // Then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.findings()).hasSize(1);
        VulnerabilityIssue issue = outcome.findings().get(0);
        assertThat(issue.severity()).isEqualTo(Severity.HIGH);
        assertThat(issue.filePath()).isEqualTo("app.py");
        assertThat(issue.lineNumber()).isEqualTo(12);
        assertThat(issue.codeSnippet()).isEqualTo("cursor.execute(q)");
        assertThat(issue.cweId()).isEqualTo("CWE-89");
        assertThat(issue.confidence()).isEqualTo(Confidence.HIGH);
    }

    @Test
    void parse_codeFenceBeforeJsonFence_usesJsonFence() {
        // Given
        String response = """
            The vulnerable line is:
            ```python
            os.system(cmd)
            ```
            Findings:
            ```json
            [{"severity": "high", "description": "Command injection", "line_number": 3}]
            ```
            """;

        // When
        AnalysisOutcome outcome = parser.parse(response, "app.py");

        // Then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.findings()).singleElement().satisfies(issue -> {
            assertThat(issue.severity()).isEqualTo(Severity.HIGH);
            assertThat(issue.description()).isEqualTo("Command injection");
            assertThat(issue.lineNumber()).isEqualTo(3);
        });
    }

    @Test
    void parse_plainFenceAfterQuotedCode_usesArrayFence() {
        // Given
        String response = "```\nprint(user_input)\n```\n\n```\n[{\"description\": \"Unvalidated input\"}]\n```";

        // When
        AnalysisOutcome outcome = parser.parse(response, "app.py");

        // Then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.findings()).extracting(VulnerabilityIssue::description)
            .containsExactly("Unvalidated input");
    }

    @Test
    void parse_arrayEmbeddedInProse_extractsBrackets() {
        String response = "Findings: [{\"description\": \"x\"}] end of report";

        AnalysisOutcome outcome = parser.parse(response, "a.js");

        assertThat(outcome.findings()).hasSize(1);
    }

    @Test
    void parse_missingFields_appliesDefaults() {
        AnalysisOutcome outcome = parser.parse("[{}]", "a.js");

        VulnerabilityIssue issue = outcome.findings().get(0);
        assertThat(issue.severity()).isEqualTo(Severity.MEDIUM);
        assertThat(issue.confidence()).isEqualTo(Confidence.MEDIUM);
        assertThat(issue.description()).isEqualTo(FindingResponseParser.NO_DESCRIPTION);
        assertThat(issue.recommendation()).isEmpty();
        assertThat(issue.lineNumber()).isNull();
        assertThat(issue.cweId()).isNull();
    }

    @Test
    void parse_lenientFieldTypes_areNormalized() {
        String response = """
            [{"severity": "CRITICAL", "line_number": "7", "cwe_id": 79, "confidence": "unsure"},
             {"line_number": "near the top"}]
            """;

        AnalysisOutcome outcome = parser.parse(response, "a.js");

        assertThat(outcome.findings()).hasSize(2);
        assertThat(outcome.findings().get(0).severity()).isEqualTo(Severity.CRITICAL);
        assertThat(outcome.findings().get(0).lineNumber()).isEqualTo(7);
        assertThat(outcome.findings().get(0).cweId()).isEqualTo("79");
        assertThat(outcome.findings().get(0).confidence()).isEqualTo(Confidence.MEDIUM);
        assertThat(outcome.findings().get(1).lineNumber()).isNull();
    }

    @Test
    void parse_nonObjectElements_areSkipped() {
        AnalysisOutcome outcome = parser.parse("[\"text\", 42, {\"description\": \"real\"}]", "a.js");

        assertThat(outcome.findings()).extracting(VulnerabilityIssue::description).containsExactly("real");
    }

    @Test
    void parse_emptyArray_succeedsWithoutFindings() {
        AnalysisOutcome outcome = parser.parse("[]", "a.js");

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.findings()).isEmpty();
    }

    @Test
    void parse_prose_failsWithParseKind() {
        AnalysisOutcome outcome = parser.parse("The code looks fine to me.", "a.js");

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.failure().kind()).isEqualTo(AnalysisFailure.Kind.PARSE);
    }

    @Test
    void parse_jsonObject_failsWithParseKind() {
        AnalysisOutcome outcome = parser.parse("{\"issues\": 3}", "a.js");

        assertThat(outcome.failure().kind()).isEqualTo(AnalysisFailure.Kind.PARSE);
    }
}
