package com.codescan.core.rules;

import com.codescan.core.model.RulePattern;
import com.codescan.core.model.RuleSource;
import com.codescan.core.model.Severity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rule set installed when no rule store exists yet.
 */
final class DefaultRules {

    private DefaultRules() {
    }

    static Map<String, List<RulePattern>> create() {
        Map<String, List<RulePattern>> rules = new LinkedHashMap<>();
        rules.put("common", List.of(
            rule("common-1", "Hard-coded secret", "password|secret|token|api_key|apikey",
                "Detects secrets hard-coded in source", Severity.HIGH, "*"),
            rule("common-2", "Potential SQL injection", "execute|query|select.*from.*where",
                "Detects potential SQL injection", Severity.CRITICAL, "*"),
            rule("common-3", "Unhandled exception", "try|catch|except",
                "Detects exceptions that may not be handled properly", Severity.MEDIUM, "*")
        ));
        rules.put("python", List.of(
            rule("python-1", "Unsafe pickle usage", "pickle\\.loads|pickle\\.load",
                "Detects deserialization of untrusted data with pickle", Severity.HIGH, "python"),
            rule("python-2", "os.system command injection", "os\\.system|subprocess\\.call|eval\\(",
                "Detects potential command injection", Severity.CRITICAL, "python")
        ));
        rules.put("javascript", List.of(
            rule("javascript-1", "Unsafe eval usage", "eval\\(|setTimeout\\(.*\\)|setInterval\\(.*\\)",
                "Detects unsafe use of eval", Severity.HIGH, "javascript"),
            rule("javascript-2", "XSS sink", "innerHTML|document\\.write|\\$\\(.*\\)\\.html\\(",
                "Detects potential cross-site scripting", Severity.CRITICAL, "javascript")
        ));
        rules.put("java", List.of(
            rule("java-1", "Unsafe deserialization", "ObjectInputStream|readObject",
                "Detects unsafe deserialization", Severity.HIGH, "java")
        ));
        return rules;
    }

    private static RulePattern rule(String id, String name, String pattern, String description,
                                    Severity severity, String language) {
        return new RulePattern(id, name, pattern, description, severity, Set.of(language), RuleSource.BUILTIN, Map.of());
    }
}
