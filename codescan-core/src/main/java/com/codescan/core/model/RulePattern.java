package com.codescan.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A single rule of the rule store.
 *
 * <p>Identity is {@code (bucket, id)}: two rules with the same id in the same language
 * bucket are versions of the same logical rule. The {@code pattern} is a regular
 * expression evaluated case-insensitively by the pattern match engine.
 *
 * @param id unique id within its bucket, may be empty before merging
 * @param name short display name
 * @param pattern regular expression
 * @param description what the rule detects
 * @param severity severity of findings produced by this rule
 * @param languages languages the rule declares ({@code "*"} for all)
 * @param source where the rule came from
 * @param metadata free-form metadata (CWE, OWASP, references, recommendation)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RulePattern(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("pattern") String pattern,
    @JsonProperty("description") String description,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("languages") Set<String> languages,
    @JsonProperty("source") RuleSource source,
    @JsonProperty("metadata") Map<String, Object> metadata
) {
    /**
     * Compact constructor normalizing nulls.
     */
    public RulePattern {
        if (id == null) {
            id = "";
        }
        if (name == null) {
            name = "";
        }
        if (pattern == null) {
            pattern = "";
        }
        if (description == null) {
            description = "";
        }
        if (severity == null) {
            severity = Severity.MEDIUM;
        }
        languages = languages == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(languages));
        if (source == null) {
            source = RuleSource.USER;
        }
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Returns a copy of this rule with another id.
     *
     * @param newId id to assign
     * @return rule with {@code newId}
     */
    public RulePattern withId(String newId) {
        return new RulePattern(newId, name, pattern, description, severity, languages, source, metadata);
    }

    /**
     * Returns a metadata value as text.
     *
     * <p>List values yield their first element, which is how the rule dialect usually
     * records a single CWE or OWASP category.
     *
     * @param key metadata key
     * @return text value, or null when absent
     */
    public String metadataText(String key) {
        Object value = metadata.get(key);
        if (value instanceof Iterable<?> iterable) {
            var iterator = iterable.iterator();
            value = iterator.hasNext() ? iterator.next() : null;
        }
        return value != null ? value.toString() : null;
    }
}
