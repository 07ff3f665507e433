package com.codescan.core.rules.importer;

import com.codescan.core.model.RulePattern;
import com.codescan.core.model.RuleSource;
import com.codescan.core.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DialectRuleTranslator}.
 */
class DialectRuleTranslatorTest {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final DialectRuleTranslator translator = new DialectRuleTranslator();

    private static JsonNode yaml(String text) throws Exception {
        return YAML.readTree(text);
    }

    @Test
    void translate_fullRule_mapsEveryField() throws Exception {
        // Given
        JsonNode rule = yaml("""
            id: python-os-system
            message: Command built from user input is passed to os.system
            severity: ERROR
            languages: [Python]
            pattern: os.system($CMD)
            metadata:
              cwe: ["CWE-78: OS Command Injection"]
              owasp: A03
            """);

        // When
        RulePattern translated = translator.translate(rule);

        // Then
        assertThat(translated.id()).isEqualTo("python-os-system");
        assertThat(translated.name()).isEqualTo("Command built from user input is passed to os.syst");
        assertThat(translated.description()).isEqualTo("Command built from user input is passed to os.system");
        assertThat(translated.severity()).isEqualTo(Severity.HIGH);
        assertThat(translated.languages()).containsExactly("python");
        assertThat(translated.source()).isEqualTo(RuleSource.SEMGREP);
        assertThat(translated.pattern()).isEqualTo("os\\.system\\(\\)");
        assertThat(translated.metadataText("cwe")).isEqualTo("CWE-78: OS Command Injection");
    }

    @Test
    void translate_explicitName_isKept() throws Exception {
        RulePattern translated = translator.translate(yaml("{id: a, name: Short name, message: long message, pattern: x}"));

        assertThat(translated.name()).isEqualTo("Short name");
    }

    @Test
    void translate_ellipsis_becomesLazyWildcardThatMatches() throws Exception {
        // Given
        RulePattern translated = translator.translate(yaml("{id: a, pattern: 'subprocess.call(..., shell=True)'}"));

        // When
        Pattern compiled = Pattern.compile(translated.pattern(), Pattern.CASE_INSENSITIVE);

        // Then
        assertThat(translated.pattern()).isEqualTo("subprocess\\.call\\(.*?, shell=True\\)");
        assertThat(compiled.matcher("subprocess.call(cmd, shell=True)").find()).isTrue();
        assertThat(compiled.matcher("subprocess.call(cmd)").find()).isFalse();
    }

    @Test
    void translate_patternEither_joinsEscapedAlternatives() throws Exception {
        // Given
        RulePattern translated = translator.translate(yaml("""
            id: either
            pattern-either:
              - pattern: pickle.loads($X)
              - yaml.load($X)
            """));

        // When
        Pattern compiled = Pattern.compile(translated.pattern());

        // Then
        assertThat(translated.pattern()).isEqualTo("pickle\\.loads\\(\\)|yaml\\.load\\(\\)");
        assertThat(compiled.matcher("pickle.loads()").find()).isTrue();
        assertThat(compiled.matcher("yaml.load()").find()).isTrue();
    }

    @Test
    void translate_nestedPatternObject_isUsed() throws Exception {
        RulePattern translated = translator.translate(yaml("{id: a, pattern: {pattern: eval($X)}}"));

        assertThat(translated.pattern()).isEqualTo("eval\\(\\)");
    }

    @Test
    void translate_patternRegex_isEscapedLikeAnyPattern() throws Exception {
        RulePattern translated = translator.translate(yaml("{id: a, pattern-regex: 'md5|sha1'}"));

        assertThat(translated.pattern()).isEqualTo("md5\\|sha1");
    }

    @Test
    void translate_patternInsideBeforePatternNot() throws Exception {
        RulePattern translated = translator.translate(yaml("{id: a, pattern-inside: 'def f():', pattern-not: 'g()'}"));

        assertThat(translated.pattern()).isEqualTo("def f\\(\\):");
    }

    @Test
    void translate_patternNot_becomesNegativeLookahead() throws Exception {
        RulePattern translated = translator.translate(yaml("{id: a, pattern-not: 'safe_eval(x)'}"));

        assertThat(translated.pattern()).isEqualTo("(?!safe_eval\\(x\\))");
    }

    @Test
    void translate_patternsList_usesFirstPatternIncludingNestedLevel() throws Exception {
        // Given
        JsonNode rule = yaml("""
            id: nested
            patterns:
              - pattern-inside: 'with open(...):'
              - patterns:
                  - pattern-not: safe()
                  - pattern: requests.get($URL, verify=False)
            """);

        // When
        RulePattern translated = translator.translate(rule);

        // Then
        assertThat(translated.pattern()).isEqualTo("requests\\.get\\(, verify=False\\)");
    }

    @Test
    void translate_subRules_useFirstSubRulePattern() throws Exception {
        RulePattern translated = translator.translate(yaml("{id: a, rules: [{id: b}, {id: c, pattern: 'exec(x)'}]}"));

        assertThat(translated.pattern()).isEqualTo("exec\\(x\\)");
    }

    @Test
    void translate_noPattern_usesCwePlaceholder() throws Exception {
        RulePattern translated = translator.translate(yaml("{id: taint-rule, metadata: {cwe: ['78'], owasp: A1}}"));

        assertThat(translated.pattern()).isEqualTo("# CWE-78");
    }

    @Test
    void translate_noPatternAndNoCwe_usesOwaspThenId() throws Exception {
        assertThat(translator.translate(yaml("{id: r, metadata: {owasp: A1}}")).pattern()).isEqualTo("# OWASP-A1");
        assertThat(translator.translate(yaml("{id: bare-rule}")).pattern()).isEqualTo("# bare-rule");
    }

    @Test
    void translate_noLanguages_goesToCommon() throws Exception {
        assertThat(translator.translate(yaml("{id: a, pattern: x}")).languages()).containsExactly("common");
    }

    @Test
    void translate_notAnObject_throws() throws Exception {
        JsonNode scalar = yaml("just text");

        assertThatThrownBy(() -> translator.translate(scalar)).isInstanceOf(RuleImportException.class);
    }

    @ParameterizedTest
    @CsvSource({
        "ERROR, HIGH",
        "error, HIGH",
        "WARNING, MEDIUM",
        "INFO, INFO",
        "critical, CRITICAL",
        "low, LOW",
        "INVENTORY, MEDIUM",
        "'', MEDIUM"
    })
    void mapSeverity_mapsDialectValues(String dialect, Severity expected) {
        assertThat(DialectRuleTranslator.mapSeverity(dialect)).isEqualTo(expected);
    }

    @Test
    void normalize_metavariablesRemovedAndMetacharactersEscaped() {
        assertThat(DialectRuleTranslator.normalize("$OBJ.query($SQL + $INPUT)")).isEqualTo("\\.query\\( \\+ \\)");
        assertThat(DialectRuleTranslator.escape("a^b$c[d]{e}|f?")).isEqualTo("a\\^b\\$c\\[d\\]\\{e\\}\\|f\\?");
    }
}
