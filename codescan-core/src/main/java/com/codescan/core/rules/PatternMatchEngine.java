package com.codescan.core.rules;

import com.codescan.core.model.Confidence;
import com.codescan.core.model.RulePattern;
import com.codescan.core.model.VulnerabilityIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates rule patterns against file content.
 *
 * <p>Every rule applicable to the file's language is tested case-insensitively against the
 * whole content. A matching rule yields one finding, located on the first line that matches
 * on its own, with a snippet of up to two lines on each side. A rule whose match spans lines
 * yields a finding without line number or snippet. Findings keep rule order.
 *
 * <p>Patterns are compiled once and cached; the engine is safe for concurrent use. A pattern
 * that does not compile is logged once and skipped from then on.
 */
public class PatternMatchEngine {

    private static final Logger log = LoggerFactory.getLogger(PatternMatchEngine.class);

    static final String DEFAULT_DESCRIPTION = "Potential vulnerability detected";
    static final String DEFAULT_RECOMMENDATION = "Review this code";
    private static final int SNIPPET_CONTEXT = 2;

    private final RuleSet rules;
    private final Map<String, Optional<Pattern>> compiled = new ConcurrentHashMap<>();

    public PatternMatchEngine(RuleSet rules) {
        this.rules = rules;
    }

    /**
     * Matches content without a file path. Findings carry an empty path.
     *
     * @param language language of the content
     * @param content content to match
     * @return findings in rule order
     */
    public List<VulnerabilityIssue> match(String language, String content) {
        return match("", language, content);
    }

    /**
     * Matches the content of a file.
     *
     * @param file file the content came from
     * @param language language of the file
     * @param content file content
     * @return findings in rule order
     */
    public List<VulnerabilityIssue> match(Path file, String language, String content) {
        return match(file.toString(), language, content);
    }

    private List<VulnerabilityIssue> match(String filePath, String language, String content) {
        List<VulnerabilityIssue> findings = new ArrayList<>();
        String[] lines = null;

        for (RulePattern rule : rules.getPatternsFor(language)) {
            Optional<Pattern> pattern = compile(rule);
            if (pattern.isEmpty() || !pattern.get().matcher(content).find()) {
                continue;
            }
            if (lines == null) {
                lines = content.split("\n", -1);
            }

            Integer lineNumber = null;
            String snippet = null;
            for (int i = 0; i < lines.length; i++) {
                Matcher matcher = pattern.get().matcher(lines[i]);
                if (matcher.find()) {
                    lineNumber = i + 1;
                    snippet = snippet(lines, i);
                    break;
                }
            }

            findings.add(new VulnerabilityIssue(
                rule.severity(),
                filePath,
                lineNumber,
                snippet,
                rule.description().isBlank() ? DEFAULT_DESCRIPTION : rule.description(),
                Optional.ofNullable(rule.metadataText("recommendation")).orElse(DEFAULT_RECOMMENDATION),
                rule.metadataText("cwe"),
                Confidence.MEDIUM
            ));
        }
        return findings;
    }

    private Optional<Pattern> compile(RulePattern rule) {
        if (rule.pattern().isEmpty()) {
            return Optional.empty();
        }
        return compiled.computeIfAbsent(rule.pattern(), source -> {
            try {
                return Optional.of(Pattern.compile(source, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                log.warn("Skipping rule {} with invalid pattern '{}': {}", rule.id(), source, e.getDescription());
                return Optional.empty();
            }
        });
    }

    private static String snippet(String[] lines, int index) {
        int from = Math.max(0, index - SNIPPET_CONTEXT);
        int to = Math.min(lines.length, index + SNIPPET_CONTEXT + 1);
        return String.join("\n", Arrays.asList(lines).subList(from, to));
    }
}
