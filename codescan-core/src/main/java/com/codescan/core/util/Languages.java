package com.codescan.core.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps file extensions to the language names used as rule buckets.
 *
 * <p>Language names are lower case and double as rule store bucket keys, so a rule
 * imported for {@code go} or {@code csharp} applies to {@code .go} and {@code .cs} files.
 * Files whose extension is not listed are {@value #UNKNOWN}.
 */
public final class Languages {

    /** Language of files with an unmapped extension. */
    public static final String UNKNOWN = "unknown";

    /** Bucket whose rules apply to every language. */
    public static final String COMMON = "common";

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
        Map.entry(".py", "python"),
        Map.entry(".js", "javascript"),
        Map.entry(".jsx", "javascript"),
        Map.entry(".ts", "typescript"),
        Map.entry(".tsx", "typescript"),
        Map.entry(".java", "java"),
        Map.entry(".c", "c"),
        Map.entry(".h", "c"),
        Map.entry(".cpp", "cpp"),
        Map.entry(".cs", "csharp"),
        Map.entry(".go", "go"),
        Map.entry(".rs", "rust"),
        Map.entry(".php", "php"),
        Map.entry(".rb", "ruby"),
        Map.entry(".swift", "swift"),
        Map.entry(".kt", "kotlin"),
        Map.entry(".scala", "scala"),
        Map.entry(".m", "objective-c"),
        Map.entry(".sh", "bash"),
        Map.entry(".bat", "batch"),
        Map.entry(".ps1", "powershell"),
        Map.entry(".sql", "sql"),
        Map.entry(".html", "html"),
        Map.entry(".css", "css"),
        Map.entry(".scss", "scss"),
        Map.entry(".less", "less"),
        Map.entry(".xml", "xml"),
        Map.entry(".json", "json"),
        Map.entry(".yaml", "yaml"),
        Map.entry(".yml", "yaml"),
        Map.entry(".md", "markdown"),
        Map.entry(".tex", "latex"),
        Map.entry(".r", "r"),
        Map.entry(".dart", "dart"),
        Map.entry(".lua", "lua"),
        Map.entry(".pl", "perl"),
        Map.entry(".groovy", "groovy"),
        Map.entry(".vb", "visualbasic")
    );

    private Languages() {
        // Utility class
    }

    /**
     * Determines the language of a file from its extension.
     *
     * @param file file path
     * @return language name, or {@value #UNKNOWN}
     */
    public static String of(Path file) {
        return extension(file)
            .map(BY_EXTENSION::get)
            .orElse(UNKNOWN);
    }

    /**
     * Returns the lower-case extension of a file, including the leading dot.
     *
     * <p>Only the last dot counts: {@code archive.tar.gz} has extension {@code .gz}.
     * Dot files without another dot ({@code .gitignore}) have no extension.
     *
     * @param file file path
     * @return extension, or empty when the name has none
     */
    public static Optional<String> extension(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(name.substring(dot).toLowerCase(Locale.ROOT));
    }

    /**
     * Returns every known language name.
     *
     * @return sorted language names
     */
    public static Set<String> known() {
        return new TreeSet<>(BY_EXTENSION.values());
    }
}
