package com.codescan.core.rules.importer;

import com.codescan.core.model.RulePattern;
import com.codescan.core.model.RuleSource;
import com.codescan.core.model.Severity;
import com.codescan.core.util.Languages;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Translates one rule of the Semgrep-style dialect into a {@link RulePattern}.
 *
 * <p>The dialect matches code structurally. The internal engine only understands regular
 * expressions, so the translation keeps the literal text of the primary pattern and makes it
 * safe to use as a case-insensitive text matcher:
 * <ol>
 *   <li>pick the primary pattern (see {@link #extractPattern(JsonNode)} for the order)</li>
 *   <li>remove metavariables such as {@code $X} or {@code $FUNC_NAME}</li>
 *   <li>split the text on the ellipsis {@code ...}, escape every fragment and re-join the
 *       fragments with the lazy wildcard {@code .*?}</li>
 * </ol>
 * Alternatives under {@code pattern-either} are translated one by one and joined with an
 * unescaped {@code |}; a {@code pattern-not} becomes a negative lookahead.
 *
 * <p><b>Example:</b> {@code os.system($CMD, ...)} becomes {@code os\.system\(, .*?\)}.
 */
public class DialectRuleTranslator {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern METAVARIABLE = Pattern.compile("\\$[A-Z_]+");
    private static final String ELLIPSIS = "...";
    private static final String WILDCARD = ".*?";
    private static final String REGEX_METACHARACTERS = "\\^$.|?*+()[]{}";
    private static final int NAME_LENGTH = 50;

    /**
     * Translates a raw rule.
     *
     * @param rule rule object
     * @return translated rule with source {@link RuleSource#SEMGREP}
     * @throws RuleImportException if the node is not a rule object
     */
    public RulePattern translate(JsonNode rule) {
        if (rule == null || !rule.isObject()) {
            throw new RuleImportException("Rule is not an object: " + rule);
        }

        String id = text(rule, "id");
        String message = text(rule, "message");
        String name = text(rule, "name");
        if (name.isEmpty()) {
            name = message.length() > NAME_LENGTH ? message.substring(0, NAME_LENGTH) : message;
        }

        Map<String, Object> metadata = metadata(rule);
        String pattern = extractPattern(rule).orElseGet(() -> normalize(placeholder(rule, id)));

        return new RulePattern(
            id,
            name,
            pattern,
            message,
            mapSeverity(text(rule, "severity")),
            languages(rule),
            RuleSource.SEMGREP,
            metadata
        );
    }

    /**
     * Extracts and normalizes the primary pattern, trying in order: {@code pattern} text,
     * {@code pattern.pattern}, {@code pattern-either}, {@code pattern-regex},
     * {@code pattern-inside}, {@code pattern-not}, the first {@code pattern} inside
     * {@code patterns} (one nested level included) and the first {@code rules[].pattern}.
     *
     * @param rule rule object
     * @return normalized pattern, or empty when the rule carries none
     */
    Optional<String> extractPattern(JsonNode rule) {
        JsonNode pattern = rule.get("pattern");
        if (pattern != null && pattern.isTextual() && !pattern.asText().isEmpty()) {
            return Optional.of(normalize(pattern.asText()));
        }
        if (pattern != null && pattern.isObject() && hasText(pattern, "pattern")) {
            return Optional.of(normalize(pattern.get("pattern").asText()));
        }

        Optional<String> either = either(rule.get("pattern-either"));
        if (either.isPresent()) {
            return either;
        }

        if (hasText(rule, "pattern-regex")) {
            return Optional.of(normalize(rule.get("pattern-regex").asText()));
        }
        if (hasText(rule, "pattern-inside")) {
            return Optional.of(normalize(rule.get("pattern-inside").asText()));
        }
        if (hasText(rule, "pattern-not")) {
            return Optional.of("(?!" + normalize(rule.get("pattern-not").asText()) + ")");
        }

        JsonNode patterns = rule.get("patterns");
        if (patterns != null && patterns.isArray()) {
            for (JsonNode entry : patterns) {
                if (hasText(entry, "pattern")) {
                    return Optional.of(normalize(entry.get("pattern").asText()));
                }
                JsonNode nested = entry.get("patterns");
                if (nested != null && nested.isArray()) {
                    for (JsonNode inner : nested) {
                        if (hasText(inner, "pattern")) {
                            return Optional.of(normalize(inner.get("pattern").asText()));
                        }
                    }
                }
            }
        }

        JsonNode rules = rule.get("rules");
        if (rules != null && rules.isArray()) {
            for (JsonNode subRule : rules) {
                if (hasText(subRule, "pattern")) {
                    return Optional.of(normalize(subRule.get("pattern").asText()));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Removes metavariables, escapes the literal text and turns ellipses into lazy wildcards.
     *
     * @param raw dialect pattern text
     * @return regular expression
     */
    static String normalize(String raw) {
        String withoutMetavariables = METAVARIABLE.matcher(raw).replaceAll("");
        StringBuilder result = new StringBuilder();
        int start = 0;
        int ellipsis;
        while ((ellipsis = withoutMetavariables.indexOf(ELLIPSIS, start)) >= 0) {
            result.append(escape(withoutMetavariables.substring(start, ellipsis))).append(WILDCARD);
            start = ellipsis + ELLIPSIS.length();
        }
        result.append(escape(withoutMetavariables.substring(start)));
        return result.toString();
    }

    /**
     * Escapes regular expression metacharacters with a backslash.
     *
     * @param literal literal text
     * @return text matching {@code literal} verbatim
     */
    static String escape(String literal) {
        StringBuilder escaped = new StringBuilder(literal.length() + 8);
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (REGEX_METACHARACTERS.indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    /**
     * Maps dialect severities onto internal ones.
     *
     * @param severity dialect severity, any case
     * @return {@code ERROR} as high, {@code WARNING} as medium, {@code INFO} as info, internal
     *         names as themselves and anything else as medium
     */
    static Severity mapSeverity(String severity) {
        return switch (severity.trim().toUpperCase(Locale.ROOT)) {
            case "ERROR", "HIGH" -> Severity.HIGH;
            case "INFO" -> Severity.INFO;
            case "CRITICAL" -> Severity.CRITICAL;
            case "LOW" -> Severity.LOW;
            default -> Severity.MEDIUM;
        };
    }

    private Optional<String> either(JsonNode alternatives) {
        if (alternatives == null || !alternatives.isArray()) {
            return Optional.empty();
        }
        List<String> translated = new ArrayList<>();
        for (JsonNode alternative : alternatives) {
            if (alternative.isTextual() && !alternative.asText().isEmpty()) {
                translated.add(normalize(alternative.asText().replace('\n', ' ')));
            } else if (hasText(alternative, "pattern")) {
                translated.add(normalize(alternative.get("pattern").asText().replace('\n', ' ')));
            }
        }
        if (translated.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join("|", translated));
    }

    private String placeholder(JsonNode rule, String id) {
        JsonNode metadata = rule.get("metadata");
        if (metadata != null && metadata.isObject()) {
            if (metadata.has("cwe")) {
                return "# CWE-" + firstText(metadata.get("cwe"));
            }
            if (metadata.has("owasp")) {
                return "# OWASP-" + firstText(metadata.get("owasp"));
            }
        }
        return "# " + id;
    }

    private Set<String> languages(JsonNode rule) {
        Set<String> languages = new LinkedHashSet<>();
        JsonNode node = rule.get("languages");
        if (node != null && node.isArray()) {
            for (JsonNode language : node) {
                String value = language.asText("").trim();
                if (!value.isEmpty()) {
                    languages.add(value.toLowerCase(Locale.ROOT));
                }
            }
        } else if (node != null && node.isTextual() && !node.asText().isBlank()) {
            languages.add(node.asText().trim().toLowerCase(Locale.ROOT));
        }
        if (languages.isEmpty()) {
            languages.add(Languages.COMMON);
        }
        return languages;
    }

    private Map<String, Object> metadata(JsonNode rule) {
        JsonNode metadata = rule.get("metadata");
        if (metadata == null || !metadata.isObject()) {
            return Map.of();
        }
        try {
            return MAPPER.convertValue(metadata, new TypeReference<Map<String, Object>>() { });
        } catch (IllegalArgumentException e) {
            throw new RuleImportException("Unreadable metadata in rule " + text(rule, "id"), e);
        }
    }

    private static String firstText(JsonNode node) {
        if (node.isArray()) {
            return node.isEmpty() ? "" : node.get(0).asText();
        }
        return node.asText();
    }

    private static boolean hasText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() && !value.asText().isEmpty();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText("");
    }
}
